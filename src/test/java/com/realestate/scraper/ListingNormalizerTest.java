package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for value coercion, vocabulary mapping and stable identity.
 */
public class ListingNormalizerTest {
    private final ListingNormalizer normalizer = new ListingNormalizer(TestDocuments.config());

    private static CanonicalRecord zillowRecord() {
        CanonicalRecord raw = new CanonicalRecord(TestDocuments.ZILLOW_URL, SourceId.ZILLOW);
        raw.offer(ListingField.EXTERNAL_ID, "12345");
        raw.offer(ListingField.LIST_PRICE, "$450,000");
        raw.offer(ListingField.INTERIOR_AREA, "1,500 sqft");
        raw.offer(ListingField.BEDS, "3 bd");
        raw.offer(ListingField.BATHS, "2.50");
        raw.offer(ListingField.STREET, "123  Main St");
        raw.offer(ListingField.CITY, "Seattle");
        raw.offer(ListingField.STATE, "wa");
        raw.offer(ListingField.POSTAL_CODE, "98101-1234");
        raw.offer(ListingField.LATITUDE, "47.6062");
        raw.offer(ListingField.STATUS, "FOR_SALE");
        raw.offer(ListingField.PROPERTY_TYPE, "Single Family Residence");
        raw.offer(ListingField.LIST_DATE, "March 5, 2024");
        return raw;
    }

    @Test
    void testValuesAreCoerced() {
        CanonicalRecord record = normalizer.normalize(zillowRecord());

        assertEquals(0, new BigDecimal("450000").compareTo(record.decimal(ListingField.LIST_PRICE)));
        assertEquals(0, new BigDecimal("1500").compareTo(record.decimal(ListingField.INTERIOR_AREA)));
        assertEquals(3, record.integer(ListingField.BEDS));
        assertEquals("2.5", record.text(ListingField.BATHS));
        assertEquals("123 Main St", record.text(ListingField.STREET));
        assertEquals("WA", record.text(ListingField.STATE));
        assertEquals("98101", record.text(ListingField.POSTAL_CODE));
        assertEquals(0, new BigDecimal("47.6062").compareTo(record.decimal(ListingField.LATITUDE)));
        assertEquals(ListingStatus.ACTIVE, record.status());
        assertEquals(PropertyType.SINGLE_FAMILY, record.propertyType());
        assertEquals("2024-03-05", record.text(ListingField.LIST_DATE));
        assertEquals("450000", record.text(ListingField.LIST_PRICE));
    }

    @Test
    void testPricePerUnitArea() {
        CanonicalRecord record = normalizer.normalize(zillowRecord());
        assertEquals(0, new BigDecimal("300").compareTo(record.pricePerUnitArea()));

        CanonicalRecord odd = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        odd.offer(ListingField.LIST_PRICE, "500000");
        odd.offer(ListingField.INTERIOR_AREA, "1234");
        assertEquals(new BigDecimal("405.19"), normalizer.normalize(odd).pricePerUnitArea());

        CanonicalRecord zeroArea = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        zeroArea.offer(ListingField.LIST_PRICE, "500000");
        zeroArea.offer(ListingField.INTERIOR_AREA, "0");
        assertNull(normalizer.normalize(zeroArea).pricePerUnitArea());
    }

    @Test
    void testIdentityIsStableAndIdempotent() {
        CanonicalRecord first = normalizer.normalize(zillowRecord());
        CanonicalRecord second = normalizer.normalize(zillowRecord());

        assertEquals(IdentityHasher.hash("zillow", "12345"), first.listingId());
        assertEquals(IdentityHasher.hash("property", "zillow", "12345"), first.propertyId());
        assertNotEquals(first.listingId(), first.propertyId());
        assertEquals(first.listingId(), second.listingId());
        assertEquals(first.locationId(), second.locationId());
        assertSame(first, normalizer.normalize(first));
    }

    @Test
    void testIdentityFallsBackToNormalizedUrl() {
        CanonicalRecord a = new CanonicalRecord("HTTPS://Listings.Example.com/property/42/?utm_source=x#photos",
            SourceId.UNKNOWN);
        CanonicalRecord b = new CanonicalRecord("https://listings.example.com/property/42", SourceId.UNKNOWN);

        String id = normalizer.normalize(a).listingId();
        assertEquals(id, normalizer.normalize(b).listingId());
        assertEquals(IdentityHasher.hash("unknown", "https://listings.example.com/property/42"), id);
    }

    @Test
    void testIdentityIgnoresIdsReadFromPageContent() {
        CanonicalRecord withPageId = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        withPageId.offer(ListingField.EXTERNAL_ID, "L-778");
        CanonicalRecord bare = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);

        CanonicalRecord normalized = normalizer.normalize(withPageId);
        assertEquals(normalizer.normalize(bare).listingId(), normalized.listingId());
        assertEquals(normalizer.normalize(bare).propertyId(), normalized.propertyId());
        assertEquals("L-778", normalized.text(ListingField.EXTERNAL_ID));

        String zillowSearchUrl = "https://www.zillow.com/homedetails/123-Main-St-Seattle-WA-98101/";
        CanonicalRecord zillow = new CanonicalRecord(zillowSearchUrl, SourceId.ZILLOW);
        zillow.offer(ListingField.EXTERNAL_ID, "99999");
        assertEquals(IdentityHasher.hash("zillow", "https://www.zillow.com/homedetails/123-Main-St-Seattle-WA-98101"),
            normalizer.normalize(zillow).listingId());
    }

    @Test
    void testLocationIdIgnoresCaseAccentsAndPunctuation() {
        CanonicalRecord a = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        a.offer(ListingField.STREET, "12 Rue St. Denis");
        a.offer(ListingField.CITY, "Montr\u00E9al");
        CanonicalRecord b = new CanonicalRecord("https://listings.example.com/property/43", SourceId.UNKNOWN);
        b.offer(ListingField.STREET, "12 RUE ST DENIS");
        b.offer(ListingField.CITY, "Montreal");

        String location = normalizer.normalize(a).locationId();
        assertNotNull(location);
        assertEquals(location, normalizer.normalize(b).locationId());

        CanonicalRecord none = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        none.offer(ListingField.LATITUDE, "47.6");
        assertNull(normalizer.normalize(none).locationId());
    }

    @Test
    void testPropertyTypeVocabulary() {
        assertEquals(PropertyType.CONDO, normalizer.propertyType("CONDO"));
        assertEquals(PropertyType.CONDO, normalizer.propertyType("Condo/Co-op"));
        assertEquals(PropertyType.MULTI_FAMILY, normalizer.propertyType("MULTI_FAMILY"));
        assertEquals(PropertyType.LAND, normalizer.propertyType("Lots/Land"));
        assertEquals(PropertyType.MANUFACTURED, normalizer.propertyType("Mobile Home"));
        assertEquals(PropertyType.TOWNHOUSE, normalizer.propertyType("Townhouse"));
        assertEquals(PropertyType.OTHER, normalizer.propertyType("Houseboat"));
        assertNull(normalizer.propertyType(" "));
    }

    @Test
    void testUncoercibleValuesAreDropped() {
        CanonicalRecord raw = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        raw.offer(ListingField.BEDS, "studio");
        raw.offer(ListingField.LIST_PRICE, "Contact agent");

        CanonicalRecord record = normalizer.normalize(raw);
        assertFalse(record.has(ListingField.BEDS));
        assertFalse(record.has(ListingField.LIST_PRICE));
        assertNull(record.pricePerUnitArea());
    }

    @Test
    void testAgentsAndEventsNormalized() {
        CanonicalRecord raw = new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN);
        raw.offerAgents(List.of(
            new AgentContact("Jane  Doe", "206-555-0100", "Acme Realty", "Jane@Acme.COM"),
            new AgentContact("Jane Doe", "206-555-0100", "Acme Realty", "jane@acme.com")));
        raw.offerPriceHistory(List.of(
            new PriceEvent("Mar 5, 2024", "Listed for sale", new BigDecimal("450000.00"), null),
            new PriceEvent("2020-01-10", "Sold", new BigDecimal("380000"), " Public record ")));

        CanonicalRecord record = normalizer.normalize(raw);
        assertEquals(List.of(new AgentContact("Jane Doe", "206-555-0100", "Acme Realty", "jane@acme.com")),
            record.agents());
        assertEquals(List.of(
            new PriceEvent("2024-03-05", "listed", new BigDecimal("450000"), null),
            new PriceEvent("2020-01-10", "sold", new BigDecimal("380000"), "Public record")), record.priceHistory());
    }

    @Test
    void testClassifyEvent() {
        assertEquals("listed", ListingNormalizer.classifyEvent("Listed for sale"));
        assertEquals("sold", ListingNormalizer.classifyEvent("Sold (public records)"));
        assertEquals("price_change", ListingNormalizer.classifyEvent("Price change"));
        assertEquals("pending", ListingNormalizer.classifyEvent("Pending sale"));
        assertEquals("withdrawn", ListingNormalizer.classifyEvent("Listing removed"));
        assertEquals("other", ListingNormalizer.classifyEvent("Open house"));
        assertEquals("other", ListingNormalizer.classifyEvent(null));
    }
}
