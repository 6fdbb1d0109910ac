package com.realestate.sitegrammar;

import com.realestate.scraper.ExtractionConfig;
import com.realestate.scraper.ListingField;
import com.realestate.scraper.PartialFieldMap;
import com.realestate.scraper.SourceId;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Grammar for Zillow listing pages.
 * <p>
 * URL shape: {@code /homedetails/<street>-<unit?>-<city>-<ST>-<zip>/<id>_zpid/}.
 * Embedded state is published in {@code data-zrr-shared-data-key} scripts, {@code __NEXT_DATA__} and the
 * Apollo preload cache, whose values are often JSON documents serialized into strings.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class ZillowGrammar extends AbstractSiteGrammar {
    private static final Pattern ID = Pattern.compile("/(\\d+)_zpid");
    private static final Pattern LISTING_URL = Pattern.compile("/homedetails/[^?#]+_zpid");
    private static final Pattern CROPPED_PHOTO = Pattern.compile("-cc_ft_(?:192|384|576|768|960)(?=\\.\\w+(?:$|\\?))");
    private static final String FULL_PHOTO = "-uncropped_scaled_within_1536_1152";

    static final Set<String> STREET_SUFFIXES = Set.of(
        "st", "street", "ave", "avenue", "rd", "road", "dr", "drive", "ln", "lane", "blvd", "ct", "court", "way",
        "pl", "place", "ter", "terrace", "cir", "circle", "pkwy", "hwy", "sq", "trl", "loop", "run", "row", "aly",
        "xing", "pike", "plz", "walk");
    static final Set<String> UNIT_MARKERS = Set.of("apt", "unit", "ste", "suite", "#", "lot", "fl");

    public ZillowGrammar(ExtractionConfig config) {
        super(config);
    }

    @Override
    public SourceId sourceId() {
        return SourceId.ZILLOW;
    }

    @Override
    protected String domain() {
        return "zillow.com";
    }

    @Override
    protected Pattern idPattern() {
        return ID;
    }

    @Override
    public List<String> stateScriptSelectors() {
        return List.of("script[data-zrr-shared-data-key]", "script#__NEXT_DATA__", "script#hdpApolloPreloadedData");
    }

    @Override
    public boolean isListingUrl(String url) {
        return detect(url) && LISTING_URL.matcher(url).find();
    }

    @Override
    public String upgradeImage(String url) {
        if (url == null) return null;
        return CROPPED_PHOTO.matcher(url).replaceFirst(FULL_PHOTO);
    }

    /**
     * Decodes the address slug that follows {@code /homedetails/}.
     * <p>
     * The zip is the trailing five digit token and the state the two-letter token before it. The street ends
     * at the last street-suffix token; a unit marker directly after it starts the unit. Without a recognizable
     * suffix the last remaining token is taken as the city.
     */
    @Override
    public PartialFieldMap extractUrlAddress(String url) {
        PartialFieldMap out = new PartialFieldMap();
        List<String> segments = pathSegments(url);
        int idx = segments.indexOf("homedetails");
        if (idx < 0 || idx + 1 >= segments.size()) return out;
        List<String> tokens = Arrays.asList(segments.get(idx + 1).split("-"));
        int end = tokens.size();
        if (end > 0 && tokens.get(end - 1).matches("\\d{5}")) {
            out.put(ListingField.POSTAL_CODE, tokens.get(end - 1));
            end--;
        }
        if (end > 0 && tokens.get(end - 1).matches("[A-Za-z]{2}")) {
            out.put(ListingField.STATE, tokens.get(end - 1).toUpperCase(Locale.ROOT));
            end--;
        }
        List<String> rest = tokens.subList(0, end);
        if (rest.isEmpty()) return out;

        int suffix = -1;
        for (int i = rest.size() - 1; i > 0; i--) {
            if (STREET_SUFFIXES.contains(rest.get(i).toLowerCase(Locale.ROOT))) {
                suffix = i;
                break;
            }
        }
        if (suffix < 0) {
            if (rest.size() > 1) {
                out.put(ListingField.STREET, words(rest.subList(0, rest.size() - 1)));
            }
            out.put(ListingField.CITY, rest.get(rest.size() - 1));
            return out;
        }
        out.put(ListingField.STREET, words(rest.subList(0, suffix + 1)));
        int cityStart = suffix + 1;
        if (cityStart + 1 < rest.size() && UNIT_MARKERS.contains(rest.get(cityStart).toLowerCase(Locale.ROOT))) {
            out.put(ListingField.UNIT, rest.get(cityStart) + " " + rest.get(cityStart + 1));
            cityStart += 2;
        }
        if (cityStart < rest.size()) out.put(ListingField.CITY, words(rest.subList(cityStart, rest.size())));
        return out;
    }
}
