package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable configuration injected into every extraction component at construction.
 * <p>
 * Defaults live in the classpath resource {@value #RESOURCE}. Configuration workflow:
 * <ul>
 *   <li>{@link #defaults()} reads the resource only and ignores the environment, for tests.</li>
 *   <li>{@link #load()} lets an environment variable, then a JVM system property, override any key of the
 *   resource. Environment variable names are the key upper-cased with dots and dashes turned into
 *   underscores ({@code blocked.min-length} becomes {@code BLOCKED_MIN_LENGTH}).</li>
 * </ul>
 * List values are comma separated.
 *
 * @param blockedMinLength documents shorter than this many characters are treated as blocked
 * @param blockedMarkers lower-case phrases that identify a bot challenge or block page
 * @param placeholderTitles lower-case titles that carry no information and are never kept
 * @param logoMarkers lower-case tokens that disqualify an image URL
 * @param maxImageCandidates upper bound on image URLs collected from the DOM
 * @param largeImagePixels pixel count from which a dimension token counts as a large image
 * @param priceHistoryWindow characters scanned after a date for the matching price
 * @param maxSimilarUrls upper bound on similar-listing URLs kept
 * @param embeddedStatePayloads names of script payloads that hold a serialized state object
 * @param agentSelectors CSS selectors of agent containers
 * @param descriptionSelectors CSS selectors of description containers
 * @param aliases embedded-state key aliases
 * @param propertyTypeSynonyms free-text synonyms per controlled property type
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public record ExtractionConfig(
    int blockedMinLength,
    List<String> blockedMarkers,
    List<String> placeholderTitles,
    List<String> logoMarkers,
    int maxImageCandidates,
    int largeImagePixels,
    int priceHistoryWindow,
    int maxSimilarUrls,
    List<String> embeddedStatePayloads,
    List<String> agentSelectors,
    List<String> descriptionSelectors,
    FieldAliasRegistry aliases,
    Map<PropertyType, List<String>> propertyTypeSynonyms
) {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

    public static final String RESOURCE = "listing-scraper.properties";
    private static final String TYPE_PREFIX = "property-type.";

    public ExtractionConfig {
        blockedMarkers = List.copyOf(blockedMarkers);
        placeholderTitles = List.copyOf(placeholderTitles);
        logoMarkers = List.copyOf(logoMarkers);
        embeddedStatePayloads = List.copyOf(embeddedStatePayloads);
        agentSelectors = List.copyOf(agentSelectors);
        descriptionSelectors = List.copyOf(descriptionSelectors);
        propertyTypeSynonyms = Map.copyOf(propertyTypeSynonyms);
    }

    /**
     * Returns the configuration from the bundled defaults, ignoring environment and system properties.
     * @throws IllegalStateException if the bundled resource is missing or unreadable
     */
    public static ExtractionConfig defaults() {
        return fromProperties(readDefaults());
    }

    /**
     * Returns the bundled defaults with environment variable and system property overrides applied.
     * @throws IllegalStateException if the bundled resource is missing or unreadable
     */
    public static ExtractionConfig load() {
        Properties props = readDefaults();
        for (String key : props.stringPropertyNames()) {
            String override = envOrProp(key);
            if (override != null) {
                logger.debug("Configuration override for '{}'", key);
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    /**
     * Builds a configuration from already loaded properties.
     * @throws IllegalArgumentException if a numeric key holds a non-numeric value
     */
    public static ExtractionConfig fromProperties(Properties props) {
        Map<PropertyType, List<String>> synonyms = new EnumMap<>(PropertyType.class);
        for (String name : props.stringPropertyNames()) {
            if (!name.startsWith(TYPE_PREFIX)) continue;
            PropertyType type = PropertyType.fromCode(name.substring(TYPE_PREFIX.length()));
            if (type == null) {
                logger.warn("Ignoring synonyms for unknown property type key '{}'", name);
                continue;
            }
            synonyms.put(type, lowerAll(splitList(props.getProperty(name))));
        }
        return new ExtractionConfig(
            intValue(props, "blocked.min-length", 1024),
            lowerAll(splitList(props.getProperty("blocked.markers"))),
            lowerAll(splitList(props.getProperty("placeholder.titles"))),
            lowerAll(splitList(props.getProperty("media.logo-markers"))),
            intValue(props, "media.max-candidates", 50),
            intValue(props, "media.large-image-pixels", 500_000),
            intValue(props, "price-history.window", 160),
            intValue(props, "similar.max-urls", 20),
            splitList(props.getProperty("embedded-state.payloads")),
            splitList(props.getProperty("agent.selectors")),
            splitList(props.getProperty("description.selectors")),
            FieldAliasRegistry.fromProperties(props),
            synonyms
        );
    }

    /**
     * Returns a copy with a different blocked-page minimum length.
     */
    public ExtractionConfig withBlockedMinLength(int minLength) {
        return new ExtractionConfig(minLength, blockedMarkers, placeholderTitles, logoMarkers, maxImageCandidates,
            largeImagePixels, priceHistoryWindow, maxSimilarUrls, embeddedStatePayloads, agentSelectors,
            descriptionSelectors, aliases, propertyTypeSynonyms);
    }

    /**
     * Splits a comma separated value into trimmed, non-blank items.
     */
    static List<String> splitList(String value) {
        if (value == null || value.isBlank()) return List.of();
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) items.add(part.trim());
        }
        return items;
    }

    private static List<String> lowerAll(List<String> items) {
        return items.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    private static int intValue(Properties props, String key, int defaultVal) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' must be an integer: " + raw, e);
        }
    }

    private static Properties readDefaults() {
        Properties props = new Properties();
        try (InputStream in = ExtractionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        return props;
    }

    private static String envOrProp(String key) {
        String envKey = key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            String ev = System.getenv(envKey);
            if (ev != null) return ev;
        } catch (SecurityException e) {
            logger.debug("Environment lookup for {} not permitted: {}", envKey, e.getMessage());
        }
        return System.getProperty(key);
    }
}
