package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the write-once canonical record and its stage-result container.
 */
public class CanonicalRecordTest {
    private static final String URL = TestDocuments.ZILLOW_URL;

    @Test
    void testOfferIsWriteOnce() {
        CanonicalRecord record = new CanonicalRecord(URL, SourceId.ZILLOW);
        assertTrue(record.offer(ListingField.LIST_PRICE, "450000"));
        assertFalse(record.offer(ListingField.LIST_PRICE, "999999"));
        assertEquals("450000", record.get(ListingField.LIST_PRICE));
    }

    @Test
    void testBlankAndNullOffersAreRefused() {
        CanonicalRecord record = new CanonicalRecord(URL, SourceId.ZILLOW);
        assertFalse(record.offer(ListingField.TITLE, "  "));
        assertFalse(record.offer(ListingField.TITLE, null));
        assertFalse(record.has(ListingField.TITLE));
        assertTrue(record.offer(ListingField.TITLE, "123 Main St"));
    }

    @Test
    void testAbsorbFillsOnlyEmptyFields() {
        CanonicalRecord record = new CanonicalRecord(URL, SourceId.ZILLOW);
        PartialFieldMap first = new PartialFieldMap();
        first.put(ListingField.BEDS, "3");
        first.put(ListingField.CITY, "Seattle");
        first.addMedia("https://photos.example.com/a.jpg");
        assertEquals(3, record.absorb(first));

        PartialFieldMap second = new PartialFieldMap();
        second.put(ListingField.BEDS, "9");
        second.put(ListingField.BATHS, "2");
        second.addMedia("https://photos.example.com/b.jpg");
        assertEquals(1, record.absorb(second));

        assertEquals("3", record.get(ListingField.BEDS));
        assertEquals("2", record.get(ListingField.BATHS));
        assertEquals(List.of("https://photos.example.com/a.jpg"), record.media());
    }

    @Test
    void testPartialFieldMapKeepsFirstValueAndCollapsesWhitespace() {
        PartialFieldMap partial = new PartialFieldMap();
        assertTrue(partial.put(ListingField.STREET, "  123   Main\nSt "));
        assertFalse(partial.put(ListingField.STREET, "456 Oak Ave"));
        assertFalse(partial.put(ListingField.CITY, " "));
        partial.addAmenity("Pool");
        partial.addAmenity("Pool");
        assertEquals("123 Main St", partial.get(ListingField.STREET));
        assertEquals(List.of("Pool"), partial.amenities());
        assertEquals(2, partial.size());
    }

    @Test
    void testBlankSourceUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CanonicalRecord(" ", SourceId.ZILLOW));
        assertEquals(SourceId.UNKNOWN, new CanonicalRecord(URL, null).sourceId());
    }

    @Test
    void testTypedAccessors() {
        CanonicalRecord record = new CanonicalRecord(URL, SourceId.ZILLOW);
        record.offer(ListingField.LIST_PRICE, new BigDecimal("450000"));
        record.offer(ListingField.BEDS, 3);
        record.offer(ListingField.STATUS, ListingStatus.ACTIVE);
        assertEquals("450000", record.text(ListingField.LIST_PRICE));
        assertEquals("active", record.text(ListingField.STATUS));
        assertEquals(3, record.integer(ListingField.BEDS));
        assertNull(record.decimal(ListingField.BEDS));
        assertTrue(record.hasAny(ListingField.Group.COMMERCIAL));
        assertFalse(record.hasAny(ListingField.Group.ENGAGEMENT));
    }

    @Test
    void testMarkNormalizedOnlyOnce() {
        CanonicalRecord record = new CanonicalRecord(URL, SourceId.ZILLOW);
        record.markNormalized("l", "p", null, null);
        assertTrue(record.isNormalized());
        assertThrows(IllegalStateException.class, () -> record.markNormalized("l2", "p2", null, null));
    }

    @Test
    void testWithMediaKeepsIdentity() {
        CanonicalRecord record = new CanonicalRecord(URL, SourceId.ZILLOW);
        record.offer(ListingField.BEDS, 3);
        record.offerMedia(List.of("a", "b", "c"));
        record.markNormalized("listing", "property", "location", BigDecimal.TEN);

        CanonicalRecord copy = record.withMedia(List.of("b"));
        assertEquals(List.of("b"), copy.media());
        assertEquals(List.of("a", "b", "c"), record.media());
        assertEquals("listing", copy.listingId());
        assertEquals("location", copy.locationId());
        assertEquals(3, copy.integer(ListingField.BEDS));
        assertTrue(copy.isNormalized());
    }
}
