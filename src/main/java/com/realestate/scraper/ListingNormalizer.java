package com.realestate.scraper;

import com.realestate.sitegrammar.SiteGrammarRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a merged record into a typed record with stable identifiers.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every raw value is coerced according to its {@link ListingField.Kind}; a value that cannot be coerced
 *   leaves the field empty rather than zero.</li>
 *   <li>Property types map onto {@link PropertyType} through the configured synonyms (exact code first, then
 *   the longest synonym found on word boundaries); unrecognized text maps to {@link PropertyType#OTHER}.</li>
 *   <li>Price events get ISO dates and one of {@code listed, sold, price_change, pending, withdrawn, other}.</li>
 *   <li>Identity: {@code listing_id} and {@code property_id} hash the source id with the listing id found in
 *   the URL by the site grammar, or with the normalized URL when the URL carries none. Ids read from page
 *   content never take part, so every fetch of one URL gets the same identity. {@code location_id} hashes the
 *   normalized address tuple and is null when no address component is known.</li>
 *   <li>{@code price_per_unit_area} is list price divided by interior area, two decimals, only when both are
 *   present and the area is not zero.</li>
 * </ul>
 * Normalizing an already normalized record returns it unchanged.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class ListingNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(ListingNormalizer.class);

    private static final String PROPERTY_NAMESPACE = "property";
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final List<Map.Entry<String, PropertyType>> synonyms;
    private final SiteGrammarRegistry registry;

    public ListingNormalizer(ExtractionConfig config) {
        this(config, new SiteGrammarRegistry(config));
    }

    public ListingNormalizer(ExtractionConfig config, SiteGrammarRegistry registry) {
        this.registry = registry;
        List<Map.Entry<String, PropertyType>> entries = new ArrayList<>();
        config.propertyTypeSynonyms().forEach((type, words) -> {
            for (String word : words) entries.add(Map.entry(word, type));
        });
        entries.sort(Comparator.comparingInt((Map.Entry<String, PropertyType> e) -> e.getKey().length()).reversed()
            .thenComparing(Map.Entry::getKey));
        this.synonyms = List.copyOf(entries);
    }

    /**
     * Normalizes a merged record.
     * @param raw record produced by the cascade merger
     * @return a new, normalized record carrying identity and derived metrics
     */
    public CanonicalRecord normalize(CanonicalRecord raw) {
        if (raw.isNormalized()) return raw;
        CanonicalRecord out = new CanonicalRecord(raw.sourceUrl(), raw.sourceId());
        for (Map.Entry<ListingField, Object> e : raw.values().entrySet()) {
            Object coerced = coerce(e.getKey(), raw.text(e.getKey()));
            if (coerced == null) {
                logger.debug("Dropping uncoercible {}='{}' for {}", e.getKey(), e.getValue(), raw.sourceUrl());
                continue;
            }
            out.offer(e.getKey(), coerced);
        }
        out.offerMedia(raw.media());
        out.offerAgents(raw.agents().stream().map(ListingNormalizer::normalizeAgent)
            .filter(a -> !a.isEmpty()).distinct().toList());
        out.offerPriceHistory(raw.priceHistory().stream().map(this::normalizeEvent).distinct().toList());
        out.offerSimilarUrls(raw.similarUrls());
        out.offerAmenities(raw.amenities());

        String identityKey = identityKey(raw.sourceUrl());
        String listingId = IdentityHasher.hash(raw.sourceId().code(), identityKey);
        String propertyId = IdentityHasher.hash(PROPERTY_NAMESPACE, raw.sourceId().code(), identityKey);
        out.markNormalized(listingId, propertyId, locationId(out), pricePerUnitArea(out));
        return out;
    }

    /**
     * Returns the key that listing and property ids hash: the URL's listing id, else the normalized URL.
     */
    String identityKey(String sourceUrl) {
        return registry.resolve(sourceUrl).externalId(sourceUrl).orElseGet(() -> normalizeUrl(sourceUrl));
    }

    /**
     * Coerces one raw value according to the field's kind.
     * @return the typed value, or null when nothing usable remains
     */
    Object coerce(ListingField field, String raw) {
        if (raw == null) return null;
        return switch (field.kind()) {
            case TEXT -> field == ListingField.STATE ? normalizeState(raw) : TextUtils.collapseWhitespace(raw);
            case DECIMAL -> clean(ValueCoercion.toDecimal(raw));
            case COORDINATE -> ValueCoercion.toCoordinate(raw);
            case INTEGER -> ValueCoercion.toInteger(raw);
            case DATE -> ValueCoercion.toIsoDate(raw);
            case POSTAL -> ValueCoercion.toPostalCode(raw);
            case PROPERTY_TYPE -> propertyType(raw);
            case STATUS -> ListingStatus.fromText(raw);
        };
    }

    /**
     * Maps free text onto the property type vocabulary; unrecognized text yields {@link PropertyType#OTHER}.
     */
    public PropertyType propertyType(String raw) {
        String s = TextUtils.collapseWhitespace(raw);
        if (s == null) return null;
        PropertyType exact = PropertyType.fromCode(s);
        if (exact != null) return exact;
        String text = s.toLowerCase(Locale.ROOT).replace('_', ' ');
        for (Map.Entry<String, PropertyType> synonym : synonyms) {
            if (containsWord(text, synonym.getKey())) return synonym.getValue();
        }
        return PropertyType.OTHER;
    }

    /**
     * Classifies a raw price-event description.
     */
    static String classifyEvent(String raw) {
        if (raw == null) return "other";
        String s = raw.toLowerCase(Locale.ROOT);
        if (s.contains("sold")) return "sold";
        if (s.contains("pending") || s.contains("contingent") || s.contains("under contract")) return "pending";
        if (s.contains("withdrawn") || s.contains("removed") || s.contains("delisted") || s.contains("off market")
            || s.contains("expired") || s.contains("cancel")) {
            return "withdrawn";
        }
        if (s.contains("price")) return "price_change";
        if (s.contains("listed") || s.contains("listing") || s.contains("for sale")) return "listed";
        return "other";
    }

    /**
     * Canonical form of a listing URL for identity: lower-case scheme and host, no query, no fragment, no
     * trailing slash.
     */
    static String normalizeUrl(String url) {
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
            return scheme + "://" + host + path;
        } catch (IllegalArgumentException e) {
            logger.debug("Using raw URL for identity of '{}': {}", url, e.getMessage());
            return url.trim();
        }
    }

    /**
     * Normalizes an address component for hashing: accents removed, lower case, punctuation as spaces.
     */
    static String hashableAddressPart(String s) {
        if (s == null) return "";
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(s, Normalizer.Form.NFKD)).replaceAll("");
        return NON_ALNUM.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static String locationId(CanonicalRecord record) {
        boolean hasAddress = record.has(ListingField.STREET) || record.has(ListingField.CITY)
            || record.has(ListingField.STATE) || record.has(ListingField.POSTAL_CODE);
        if (!hasAddress) return null;
        return IdentityHasher.hash(
            hashableAddressPart(record.text(ListingField.STREET)),
            hashableAddressPart(record.text(ListingField.UNIT)),
            hashableAddressPart(record.text(ListingField.CITY)),
            hashableAddressPart(record.text(ListingField.STATE)),
            hashableAddressPart(record.text(ListingField.POSTAL_CODE)));
    }

    private static BigDecimal pricePerUnitArea(CanonicalRecord record) {
        BigDecimal price = record.decimal(ListingField.LIST_PRICE);
        BigDecimal area = record.decimal(ListingField.INTERIOR_AREA);
        if (price == null || area == null || area.signum() == 0) return null;
        return clean(price.divide(area, 2, RoundingMode.HALF_UP));
    }

    private PriceEvent normalizeEvent(PriceEvent event) {
        return new PriceEvent(
            ValueCoercion.toIsoDate(event.eventDate()),
            classifyEvent(event.eventType()),
            clean(event.price()),
            TextUtils.collapseWhitespace(event.notes()));
    }

    private static AgentContact normalizeAgent(AgentContact agent) {
        String email = TextUtils.safe(agent.email());
        return new AgentContact(
            TextUtils.collapseWhitespace(agent.name()),
            TextUtils.collapseWhitespace(agent.phone()),
            TextUtils.collapseWhitespace(agent.brokerage()),
            email == null ? null : email.toLowerCase(Locale.ROOT));
    }

    private static String normalizeState(String raw) {
        String s = TextUtils.collapseWhitespace(raw);
        if (s == null) return null;
        return s.length() == 2 ? s.toUpperCase(Locale.ROOT) : s;
    }

    private static BigDecimal clean(BigDecimal d) {
        if (d == null) return null;
        BigDecimal stripped = d.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(word) + "(?![a-z0-9])").matcher(text).find();
    }
}
