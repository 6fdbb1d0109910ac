package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the relational projection of a normalized record.
 */
public class TableProjectorTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final ListingNormalizer normalizer = new ListingNormalizer(TestDocuments.config());
    private final TableProjector projector = new TableProjector(Clock.fixed(NOW, ZoneOffset.UTC));

    private CanonicalRecord normalizedListing() {
        CanonicalRecord raw = new CanonicalRecord(TestDocuments.ZILLOW_URL, SourceId.ZILLOW);
        raw.offer(ListingField.EXTERNAL_ID, "12345");
        raw.offer(ListingField.LIST_PRICE, "450000");
        raw.offer(ListingField.INTERIOR_AREA, "1500");
        raw.offer(ListingField.STREET, "123 Main St");
        raw.offer(ListingField.CITY, "Seattle");
        raw.offer(ListingField.STATE, "WA");
        raw.offer(ListingField.POSTAL_CODE, "98101");
        raw.offer(ListingField.STATUS, "For sale");
        raw.offer(ListingField.HOA_FEE, "$50");
        raw.offerMedia(List.of("https://photos.example.com/a.jpg", "https://photos.example.com/b.jpg"));
        raw.offerAgents(List.of(new AgentContact("Jane Doe", "206-555-0100", "Acme Realty", null)));
        raw.offerPriceHistory(List.of(new PriceEvent("2024-03-05", "Listed for sale", new BigDecimal("450000"), null)));
        raw.offerSimilarUrls(List.of("https://www.zillow.com/homedetails/456-Oak-Ave/2_zpid/"));
        return normalizer.normalize(raw);
    }

    @Test
    void testEveryTableIsPresentInOrder() {
        RowSet rows = projector.project(normalizedListing());

        assertEquals(List.of("listings", "properties", "media", "agents", "price_history", "locations", "engagement",
            "financials", "community_attributes", "similar_properties"), List.copyOf(rows.asTables().keySet()));
    }

    @Test
    void testListingAndPropertyRows() {
        CanonicalRecord record = normalizedListing();
        RowSet rows = projector.project(record);

        assertEquals(1, rows.listings().size());
        ListingRow listing = rows.listings().get(0);
        assertEquals(record.listingId(), listing.listingId());
        assertEquals(record.propertyId(), listing.propertyId());
        assertEquals("zillow", listing.sourceId());
        assertEquals("12345", listing.externalId());
        assertEquals("active", listing.status());
        assertEquals(0, new BigDecimal("300").compareTo(listing.pricePerUnitArea()));
        assertEquals("2024-06-01T12:00:00Z", listing.scrapedTimestamp());

        assertEquals(1, rows.properties().size());
        PropertyRow property = rows.properties().get(0);
        assertEquals(record.propertyId(), property.propertyId());
        assertEquals(record.locationId(), property.locationId());
        assertEquals("98101", property.postalCode());
    }

    @Test
    void testChildRowsCarryListingId() {
        CanonicalRecord record = normalizedListing();
        RowSet rows = projector.project(record);

        assertEquals(2, rows.media().size());
        assertTrue(rows.media().get(0).isPrimary());
        assertFalse(rows.media().get(1).isPrimary());
        assertEquals(1, rows.media().get(1).displayOrder());
        assertEquals("image", rows.media().get(0).mediaType());
        assertEquals(1, rows.agents().size());
        assertEquals(1, rows.priceHistory().size());
        assertEquals("listed", rows.priceHistory().get(0).eventType());
        assertEquals(1, rows.similarProperties().size());
        rows.media().forEach(m -> assertEquals(record.listingId(), m.listingId()));
        assertEquals(record.listingId(), rows.agents().get(0).listingId());
        assertEquals(record.listingId(), rows.similarProperties().get(0).listingId());
    }

    @Test
    void testOptionalRowsOnlyWithData() {
        RowSet rows = projector.project(normalizedListing());

        assertEquals(1, rows.locations().size());
        assertEquals(1, rows.financials().size());
        assertEquals("USD", rows.financials().get(0).currency());
        assertEquals(0, new BigDecimal("50").compareTo(rows.financials().get(0).hoaFee()));
        assertTrue(rows.engagement().isEmpty());
        assertTrue(rows.communityAttributes().isEmpty());
    }

    @Test
    void testBareRecordProjectsCoreRowsOnly() {
        CanonicalRecord bare = normalizer.normalize(new CanonicalRecord(TestDocuments.GENERIC_URL, SourceId.UNKNOWN));
        RowSet rows = projector.project(bare);

        assertEquals(1, rows.listings().size());
        assertEquals(1, rows.properties().size());
        assertNull(rows.listings().get(0).locationId());
        assertTrue(rows.locations().isEmpty());
        assertTrue(rows.media().isEmpty());
        assertTrue(rows.financials().isEmpty());
    }

    @Test
    void testUnnormalizedRecordRefused() {
        CanonicalRecord raw = new CanonicalRecord(TestDocuments.ZILLOW_URL, SourceId.ZILLOW);
        assertThrows(IllegalStateException.class, () -> projector.project(raw));
    }
}
