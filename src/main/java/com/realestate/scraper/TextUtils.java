package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;

/**
 * Utility class for string and URL helpers shared by the extractors.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public final class TextUtils {
    private static final Logger logger = LoggerFactory.getLogger(TextUtils.class);

    private TextUtils() {}

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Returns the first argument that is not null or blank, trimmed, or null if there is none.
     */
    public static String firstNonBlank(String... values) {
        if (values == null) return null;
        for (String v : values) {
            if (!isBlank(v)) return v.trim();
        }
        return null;
    }

    /**
     * Trims a string and turns blank input into null.
     */
    public static String safe(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * Collapses every run of whitespace (including non-breaking spaces) into one space and trims.
     * @param s input text (may be null)
     * @return collapsed text, or null for blank input
     */
    public static String collapseWhitespace(String s) {
        if (s == null) return null;
        return safe(s.replace('\u00A0', ' ').replaceAll("\\s+", " "));
    }

    /**
     * Resolves a possibly relative URL against a base URL.
     * <p>
     * Protocol-relative ({@code //host/path}) and root-relative ({@code /path}) forms are resolved against the
     * base's origin. Absolute URLs are returned unchanged; anything unparseable is returned as given.
     * @param baseUrl absolute base URL (may be null)
     * @param maybeUrl candidate URL (may be null)
     * @return the resolved URL, or null for blank input
     */
    public static String resolveAgainst(String baseUrl, String maybeUrl) {
        if (isBlank(maybeUrl)) return null;
        String candidate = maybeUrl.trim();
        try {
            URI u = URI.create(candidate);
            if (u.isAbsolute()) return candidate;
        } catch (IllegalArgumentException e) {
            logger.debug("Candidate URL '{}' is not a valid URI: {}", candidate, e.getMessage());
            return candidate;
        }
        if (isBlank(baseUrl)) return candidate;
        try {
            URI base = URI.create(baseUrl.trim());
            if (candidate.startsWith("//")) {
                return (base.getScheme() == null ? "https" : base.getScheme()) + ":" + candidate;
            }
            if (base.isAbsolute()) return base.resolve(candidate).toString();
        } catch (IllegalArgumentException e) {
            logger.debug("Could not resolve '{}' against '{}': {}", candidate, baseUrl, e.getMessage());
        }
        return candidate;
    }

    /**
     * Returns the lower-case host of a URL, without a leading {@code www.}, or null if it has none.
     */
    public static String hostOf(String url) {
        if (isBlank(url)) return null;
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) return null;
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            logger.debug("Could not parse host of '{}': {}", url, e.getMessage());
            return null;
        }
    }

    /**
     * Returns the path of a URL, or an empty string if the URL cannot be parsed.
     */
    public static String pathOf(String url) {
        if (isBlank(url)) return "";
        try {
            String path = URI.create(url.trim()).getRawPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            logger.debug("Could not parse path of '{}': {}", url, e.getMessage());
            return "";
        }
    }
}
