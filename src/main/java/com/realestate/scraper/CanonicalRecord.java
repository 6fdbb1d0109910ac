package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The merged representation of one listing document, owned by a single extraction run.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>The cascade merger creates the record and fills it through {@link #offer(ListingField, Object)} and
 *   {@link #absorb(PartialFieldMap)}. Every scalar field and every list is set at most once: an offer for a
 *   field that already holds a value is refused, whatever the offered value looks like.</li>
 *   <li>The normalizer builds a new record holding typed values ({@link BigDecimal}, {@link Integer},
 *   {@link ListingStatus}, {@link PropertyType}, ISO date strings) and stamps the identity with
 *   {@link #markNormalized(String, String, String, BigDecimal)}.</li>
 *   <li>The table projector reads the normalized record and discards it.</li>
 * </ul>
 * Instances are not thread-safe and are never shared between documents.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class CanonicalRecord {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalRecord.class);

    private final String sourceUrl;
    private final SourceId sourceId;
    private final Map<ListingField, Object> values = new EnumMap<>(ListingField.class);
    private List<String> media = List.of();
    private List<AgentContact> agents = List.of();
    private List<PriceEvent> priceHistory = List.of();
    private List<String> similarUrls = List.of();
    private List<String> amenities = List.of();

    private String listingId;
    private String propertyId;
    private String locationId;
    private BigDecimal pricePerUnitArea;
    private boolean normalized;

    public CanonicalRecord(String sourceUrl, SourceId sourceId) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("sourceUrl cannot be null or blank");
        }
        this.sourceUrl = sourceUrl;
        this.sourceId = sourceId == null ? SourceId.UNKNOWN : sourceId;
    }

    /**
     * Sets a field if it is still empty.
     * @param field target field
     * @param value candidate value; null and blank strings are ignored
     * @return true if the value was stored, false if the field was already set or the value was empty
     */
    public boolean offer(ListingField field, Object value) {
        if (field == null || value == null) return false;
        if (value instanceof String s && s.isBlank()) return false;
        if (values.containsKey(field)) {
            logger.trace("Refusing {}='{}': already set to '{}'", field, value, values.get(field));
            return false;
        }
        values.put(field, value);
        return true;
    }

    public boolean offerMedia(List<String> urls) {
        if (!media.isEmpty() || urls == null || urls.isEmpty()) return false;
        media = List.copyOf(urls);
        return true;
    }

    public boolean offerAgents(List<AgentContact> contacts) {
        if (!agents.isEmpty() || contacts == null || contacts.isEmpty()) return false;
        agents = List.copyOf(contacts);
        return true;
    }

    public boolean offerPriceHistory(List<PriceEvent> events) {
        if (!priceHistory.isEmpty() || events == null || events.isEmpty()) return false;
        priceHistory = List.copyOf(events);
        return true;
    }

    public boolean offerSimilarUrls(List<String> urls) {
        if (!similarUrls.isEmpty() || urls == null || urls.isEmpty()) return false;
        similarUrls = List.copyOf(urls);
        return true;
    }

    public boolean offerAmenities(List<String> items) {
        if (!amenities.isEmpty() || items == null || items.isEmpty()) return false;
        amenities = List.copyOf(items);
        return true;
    }

    /**
     * Offers every value and list of a stage result; fields already set keep their value.
     * @param partial stage output (may be null)
     * @return number of scalar fields and lists that were filled by this call
     */
    public int absorb(PartialFieldMap partial) {
        if (partial == null) return 0;
        int filled = 0;
        for (Map.Entry<ListingField, String> e : partial.values().entrySet()) {
            if (offer(e.getKey(), e.getValue())) filled++;
        }
        if (offerMedia(partial.media())) filled++;
        if (offerAgents(partial.agents())) filled++;
        if (offerPriceHistory(partial.priceHistory())) filled++;
        if (offerSimilarUrls(partial.similarUrls())) filled++;
        if (offerAmenities(partial.amenities())) filled++;
        return filled;
    }

    public String sourceUrl() {
        return sourceUrl;
    }

    public SourceId sourceId() {
        return sourceId;
    }

    public boolean has(ListingField field) {
        return values.containsKey(field);
    }

    /**
     * Returns true when at least one field of the group is set.
     */
    public boolean hasAny(ListingField.Group group) {
        for (ListingField f : ListingField.inGroup(group)) if (values.containsKey(f)) return true;
        return false;
    }

    public Object get(ListingField field) {
        return values.get(field);
    }

    /**
     * Returns the value as text: enum values as their code, numbers in plain notation.
     */
    public String text(ListingField field) {
        Object v = values.get(field);
        if (v == null) return null;
        if (v instanceof ListingStatus s) return s.code();
        if (v instanceof PropertyType t) return t.code();
        if (v instanceof BigDecimal d) return d.toPlainString();
        return v.toString();
    }

    /**
     * Returns a decimal value, or null if the field is unset or not decimal typed.
     */
    public BigDecimal decimal(ListingField field) {
        return values.get(field) instanceof BigDecimal d ? d : null;
    }

    /**
     * Returns an integer value, or null if the field is unset or not integer typed.
     */
    public Integer integer(ListingField field) {
        return values.get(field) instanceof Integer i ? i : null;
    }

    public ListingStatus status() {
        return values.get(ListingField.STATUS) instanceof ListingStatus s ? s : null;
    }

    public PropertyType propertyType() {
        return values.get(ListingField.PROPERTY_TYPE) instanceof PropertyType t ? t : null;
    }

    public List<String> media() {
        return media;
    }

    public List<AgentContact> agents() {
        return agents;
    }

    public List<PriceEvent> priceHistory() {
        return priceHistory;
    }

    public List<String> similarUrls() {
        return similarUrls;
    }

    public List<String> amenities() {
        return amenities;
    }

    /**
     * Returns an unmodifiable view of every scalar value that is set.
     */
    public Map<ListingField, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Stamps the stable identity and derived metrics computed by the normalizer.
     * @throws IllegalStateException if the record was already normalized
     */
    void markNormalized(String listingId, String propertyId, String locationId, BigDecimal pricePerUnitArea) {
        if (normalized) throw new IllegalStateException("Record for " + sourceUrl + " is already normalized");
        this.listingId = listingId;
        this.propertyId = propertyId;
        this.locationId = locationId;
        this.pricePerUnitArea = pricePerUnitArea;
        this.normalized = true;
    }

    public boolean isNormalized() {
        return normalized;
    }

    public String listingId() {
        return listingId;
    }

    public String propertyId() {
        return propertyId;
    }

    public String locationId() {
        return locationId;
    }

    /**
     * Returns the derived price per unit of interior area, or null when it could not be computed.
     */
    public BigDecimal pricePerUnitArea() {
        return pricePerUnitArea;
    }

    /**
     * Returns a copy of this record whose media list is replaced by the resolved one.
     * Identity and every other value are carried over unchanged.
     */
    public CanonicalRecord withMedia(List<String> resolved) {
        CanonicalRecord copy = new CanonicalRecord(sourceUrl, sourceId);
        copy.values.putAll(values);
        copy.media = resolved == null ? List.of() : List.copyOf(resolved);
        copy.agents = agents;
        copy.priceHistory = priceHistory;
        copy.similarUrls = similarUrls;
        copy.amenities = amenities;
        copy.listingId = listingId;
        copy.propertyId = propertyId;
        copy.locationId = locationId;
        copy.pricePerUnitArea = pricePerUnitArea;
        copy.normalized = normalized;
        return copy;
    }

    @Override
    public String toString() {
        return "CanonicalRecord{" + sourceId.code() + " " + sourceUrl + " " + values
            + ", media=" + media.size() + ", agents=" + agents.size() + "}";
    }
}
