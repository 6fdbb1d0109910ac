package com.realestate.scraper;

import com.realestate.sitegrammar.SiteGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces candidate image URLs to one best-quality URL per picture.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Filter: any URL containing a logo or icon marker is dropped, on every site.</li>
 *   <li>Upgrade: the site grammar's rewrite rule is applied, then the generic rule that turns a
 *   {@code /<w>x<h>.webp} thumbnail into {@code /origin.webp}.</li>
 *   <li>Identity: an embedded content hash ({@code <hex>_img_<n>}), a UUID or a long hex segment identifies the
 *   picture; otherwise the file name with its size tokens removed does.</li>
 *   <li>Score: origin/full markers beat dimension tokens of at least the configured pixel count, which beat
 *   size-class keywords, which beat no marker at all.</li>
 *   <li>Dedup: per identity the highest score is kept, the first seen on a tie. Identities keep their
 *   first-seen order.</li>
 * </ul>
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class ImageQualityResolver {
    private static final Logger logger = LoggerFactory.getLogger(ImageQualityResolver.class);

    private static final Pattern WEBP_THUMBNAIL = Pattern.compile("/\\d{2,5}x\\d{2,5}\\.webp$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTENT_HASH = Pattern.compile("[a-f0-9]{32,}_img_\\d+");
    private static final Pattern UUID = Pattern.compile("[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12}");
    private static final Pattern LONG_HEX = Pattern.compile("(?<![a-z0-9])[a-f0-9]{24,}(?![a-z0-9])");
    private static final Pattern DIMENSIONS = Pattern.compile("(?<!\\d)(\\d{2,5})[x_](\\d{2,5})(?!\\d)");
    private static final String SIZE_TOKEN =
        "(?:origin|original|full|xl|xlarge|large|lg|l|medium|md|med|m|s|small|sm|thumb|thumbnail"
            + "|\\d{2,5}x\\d{2,5}|cc_ft_\\d+|uncropped_scaled_within_\\d+_\\d+|p_[a-z])";
    private static final Pattern TRAILING_SIZE = Pattern.compile("[-_.]" + SIZE_TOKEN + "$");
    private static final Pattern WHOLE_SIZE = Pattern.compile("^" + SIZE_TOKEN + "$");

    private static final Set<String> ORIGIN_TOKENS = Set.of("origin", "original", "full");
    private static final Set<String> LARGE_TOKENS = Set.of("xl", "xlarge", "large", "lg", "bigphoto");
    private static final Set<String> MEDIUM_TOKENS = Set.of("l", "medium", "md", "med");
    private static final Set<String> SMALL_TOKENS = Set.of("s", "small", "sm", "thumb", "thumbnail");

    private final ExtractionConfig config;

    public ImageQualityResolver(ExtractionConfig config) {
        this.config = config;
    }

    /**
     * Filters, upgrades and deduplicates candidate image URLs.
     * @param urls candidate URLs in first-seen order (may contain nulls and duplicates)
     * @param grammar grammar of the listing's site, for its upgrade rule
     * @return one URL per picture, in first-seen order
     */
    public List<String> resolve(List<String> urls, SiteGrammar grammar) {
        Map<String, String> bestByIdentity = new LinkedHashMap<>();
        Map<String, Integer> bestScore = new LinkedHashMap<>();
        int dropped = 0;
        for (String raw : urls) {
            String url = TextUtils.safe(raw);
            if (url == null) continue;
            if (isLogo(url)) {
                dropped++;
                continue;
            }
            String upgraded = upgrade(url, grammar);
            String key = identityKey(upgraded);
            int score = score(upgraded);
            Integer current = bestScore.get(key);
            if (current == null || score > current) {
                bestByIdentity.put(key, upgraded);
                bestScore.put(key, score);
            }
        }
        logger.debug("Media: {} candidate(s), {} logo/icon dropped, {} kept", urls.size(), dropped,
            bestByIdentity.size());
        return new ArrayList<>(bestByIdentity.values());
    }

    boolean isLogo(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (String marker : config.logoMarkers()) {
            if (lower.contains(marker)) return true;
        }
        return false;
    }

    static String upgrade(String url, SiteGrammar grammar) {
        String upgraded = grammar == null ? url : grammar.upgradeImage(url);
        if (upgraded == null) upgraded = url;
        return WEBP_THUMBNAIL.matcher(upgraded).replaceFirst("/origin.webp");
    }

    /**
     * Derives the picture identity of an image URL.
     * <p>
     * The file name decides first. A directory names the picture only when the file name is nothing but a
     * size token; photos of one listing often share an id directory.
     */
    static String identityKey(String url) {
        String path = TextUtils.pathOf(url).toLowerCase(Locale.ROOT);
        if (path.isEmpty()) path = url.toLowerCase(Locale.ROOT).replaceAll("[?#].*$", "");
        String[] segments = path.split("/");
        String basename = segments.length == 0 ? path : segments[segments.length - 1];
        int dot = basename.lastIndexOf('.');
        String stem = dot > 0 ? basename.substring(0, dot) : basename;
        String previous;
        do {
            previous = stem;
            stem = TRAILING_SIZE.matcher(stem).replaceFirst("");
        } while (!stem.equals(previous));

        String content = contentIdentity(stem);
        if (content != null) return content;
        if (stem.isEmpty() || WHOLE_SIZE.matcher(stem).matches()) {
            String parent = segments.length > 1 ? segments[segments.length - 2] : "";
            content = contentIdentity(parent);
            return content != null ? content : parent + "/";
        }
        Matcher indexed = CONTENT_HASH.matcher(path);
        if (indexed.find()) return indexed.group();
        return stem;
    }

    private static String contentIdentity(String text) {
        for (Pattern pattern : List.of(CONTENT_HASH, UUID, LONG_HEX)) {
            Matcher m = pattern.matcher(text);
            if (m.find()) return m.group();
        }
        return null;
    }

    /**
     * Infers a quality rank from the URL's markers.
     */
    int score(String url) {
        String lower = TextUtils.pathOf(url).toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) lower = url.toLowerCase(Locale.ROOT);
        String[] tokens = lower.split("[^a-z0-9]+");
        for (String token : tokens) {
            if (ORIGIN_TOKENS.contains(token)) return 100;
        }
        Matcher dims = DIMENSIONS.matcher(lower);
        long pixels = 0;
        while (dims.find()) {
            pixels = Math.max(pixels, Long.parseLong(dims.group(1)) * Long.parseLong(dims.group(2)));
        }
        if (pixels >= config.largeImagePixels()) {
            return 80 + (int) Math.min(19, pixels / config.largeImagePixels());
        }
        int keyword = 0;
        for (String token : tokens) {
            if (LARGE_TOKENS.contains(token)) keyword = Math.max(keyword, 40);
            else if (MEDIUM_TOKENS.contains(token)) keyword = Math.max(keyword, 30);
            else if (token.equals("m")) keyword = Math.max(keyword, 25);
            else if (SMALL_TOKENS.contains(token)) keyword = Math.max(keyword, 15);
        }
        if (keyword > 0) return keyword;
        return pixels > 0 ? 5 : 10;
    }
}
