package com.realestate.sitegrammar;

import com.realestate.scraper.ExtractionConfig;
import com.realestate.scraper.ListingField;
import com.realestate.scraper.PartialFieldMap;
import com.realestate.scraper.SourceId;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Grammar for Redfin listing pages.
 * <p>
 * URL shape: {@code /<ST>/<City-Name>/<street>-<zip>/unit-<unit>/home/<id>}, the unit segment being optional.
 * Photo URLs carry a size class ({@code genMid}, {@code genBcs}) that maps onto a {@code bigphoto} path.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class RedfinGrammar extends AbstractSiteGrammar {
    private static final Pattern ID = Pattern.compile("/home/(\\d+)");
    private static final Pattern SIZED_PHOTO =
        Pattern.compile("/(?:mbphoto|mbphotov3|islphoto)/(\\d+)/gen(?:Mid|Bcs|Sm)\\.([^/?#]+)");

    public RedfinGrammar(ExtractionConfig config) {
        super(config);
    }

    @Override
    public SourceId sourceId() {
        return SourceId.REDFIN;
    }

    @Override
    protected String domain() {
        return "redfin.com";
    }

    @Override
    protected Pattern idPattern() {
        return ID;
    }

    @Override
    public List<String> stateScriptSelectors() {
        return List.of("script#__NEXT_DATA__");
    }

    @Override
    public boolean isListingUrl(String url) {
        return detect(url) && ID.matcher(url).find();
    }

    @Override
    public String upgradeImage(String url) {
        if (url == null) return null;
        return SIZED_PHOTO.matcher(url).replaceFirst("/bigphoto/$1/$2");
    }

    @Override
    public PartialFieldMap extractUrlAddress(String url) {
        PartialFieldMap out = new PartialFieldMap();
        List<String> segments = pathSegments(url);
        int home = segments.indexOf("home");
        if (home < 3) return out;
        String state = segments.get(0);
        if (state.matches("[A-Za-z]{2}")) out.put(ListingField.STATE, state.toUpperCase(Locale.ROOT));
        out.put(ListingField.CITY, words(Arrays.asList(segments.get(1).split("-"))));

        List<String> streetTokens = Arrays.asList(segments.get(2).split("-"));
        int end = streetTokens.size();
        if (end > 1 && streetTokens.get(end - 1).matches("\\d{5}")) {
            out.put(ListingField.POSTAL_CODE, streetTokens.get(end - 1));
            end--;
        }
        out.put(ListingField.STREET, words(streetTokens.subList(0, end)));

        if (home > 3 && segments.get(3).toLowerCase(Locale.ROOT).startsWith("unit-")) {
            out.put(ListingField.UNIT, segments.get(3).substring("unit-".length()));
        }
        return out;
    }
}
