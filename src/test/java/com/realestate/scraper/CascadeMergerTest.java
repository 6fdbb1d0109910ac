package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for stage priority, write-once merging and the blocked-page short circuit.
 */
public class CascadeMergerTest {
    private final CascadeMerger merger = new CascadeMerger(TestDocuments.config(), TestDocuments.registry());

    @Test
    void testEmbeddedStateBeatsHeuristics() {
        String html = TestDocuments.page("", """
            <script id="__NEXT_DATA__" type="application/json">
            {"props": {"pageProps": {"property": {"price": 450000, "bedrooms": 3}}}}
            </script>
            """);
        String rendered = TestDocuments.rendered("""
            Price $999,999
            5 bd 2 ba
            Walk Score: 88
            """);
        CanonicalRecord record = merger.merge(TestDocuments.ZILLOW_URL, html, rendered);

        assertEquals(SourceId.ZILLOW, record.sourceId());
        assertEquals("450000", record.get(ListingField.LIST_PRICE));
        assertEquals("3", record.get(ListingField.BEDS));
        assertEquals("2", record.get(ListingField.BATHS));
        assertEquals("88", record.get(ListingField.WALK_SCORE));
        assertEquals("12345", record.get(ListingField.EXTERNAL_ID));
    }

    @Test
    void testHeuristicPriceIgnoresMonthlyFigure() {
        String rendered = TestDocuments.rendered("""
            Est. payment $1,200/mo
            $450,000
            """);
        CanonicalRecord record = merger.merge(TestDocuments.GENERIC_URL, "", rendered);

        assertEquals("450000", record.get(ListingField.LIST_PRICE));
    }

    @Test
    void testBlockedDocumentKeepsOnlyUrlFacts() {
        String html = "<html><body><div id=\"px-captcha\">Press &amp; Hold</div><p>3 bd $999,999</p></body></html>";
        CanonicalRecord record = merger.merge(TestDocuments.ZILLOW_URL, html, null);

        assertEquals("blocked", record.get(ListingField.STATUS));
        assertEquals("12345", record.get(ListingField.EXTERNAL_ID));
        assertEquals("123 Main St", record.get(ListingField.STREET));
        assertEquals("Seattle", record.get(ListingField.CITY));
        assertEquals("WA", record.get(ListingField.STATE));
        assertEquals("98101", record.get(ListingField.POSTAL_CODE));
        assertFalse(record.has(ListingField.BEDS));
        assertFalse(record.has(ListingField.LIST_PRICE));
    }

    @Test
    void testShortDocumentIgnoresItsStructuredData() {
        String html = """
            <html><head><script type="application/ld+json">
            {"@type": "House", "numberOfBedrooms": 4, "offers": {"price": 510000}}
            </script></head><body></body></html>""";
        CanonicalRecord record = merger.merge(TestDocuments.GENERIC_URL, html, null);

        assertTrue(html.length() < TestDocuments.config().blockedMinLength());
        assertEquals("blocked", record.get(ListingField.STATUS));
        assertFalse(record.has(ListingField.BEDS));
        assertFalse(record.has(ListingField.LIST_PRICE));
        assertFalse(record.has(ListingField.PROPERTY_TYPE));
    }

    @Test
    void testListingIdComesFromCanonicalLinkNotNeighbourLinks() {
        String url = "https://www.zillow.com/homedetails/123-Main-St-Seattle-WA-98101/";
        String neighbour = "<a href=\"https://www.zillow.com/homedetails/456-Oak-Ave/67890_zpid/\">456 Oak Ave</a>";

        CanonicalRecord withCanonical = merger.merge(url, TestDocuments.page(
            "<link rel=\"canonical\" href=\"https://www.zillow.com/homedetails/123-Main-St/12345_zpid/\">",
            neighbour), null);
        CanonicalRecord withoutCanonical = merger.merge(url, TestDocuments.page("", neighbour), null);

        assertEquals("12345", withCanonical.get(ListingField.EXTERNAL_ID));
        assertFalse(withoutCanonical.has(ListingField.EXTERNAL_ID));
    }

    @Test
    void testEmptyDocumentYieldsBareRecord() {
        CanonicalRecord record = merger.merge(TestDocuments.ZILLOW_URL, "", null);

        assertEquals(TestDocuments.ZILLOW_URL, record.sourceUrl());
        assertEquals(SourceId.ZILLOW, record.sourceId());
        assertTrue(record.values().isEmpty());
        assertTrue(record.media().isEmpty());
    }

    @Test
    void testInvalidSourceUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> merger.merge(null, "<html></html>", null));
        assertThrows(IllegalArgumentException.class, () -> merger.merge("  ", "<html></html>", null));
        assertThrows(IllegalArgumentException.class, () -> merger.merge("not a url", "<html></html>", null));
        assertThrows(IllegalArgumentException.class, () -> merger.merge("/homedetails/1_zpid/", "<html></html>", null));
    }

    @Test
    void testPlaceholderTitleLeavesTitleForLaterStage() {
        String html = TestDocuments.page("""
            <script type="application/ld+json">{"@type": "House", "name": "About This Home"}</script>
            <meta property="og:title" content="123 Main St, Seattle, WA 98101">
            """, "");
        CanonicalRecord record = merger.merge(TestDocuments.ZILLOW_URL, html, null);

        assertEquals("123 Main St, Seattle, WA 98101", record.get(ListingField.TITLE));
    }

    @Test
    void testUrlAddressFillsMissingComponents() {
        String html = TestDocuments.page("", """
            <script id="__NEXT_DATA__" type="application/json">
            {"property": {"address": {"city": "Seattle Downtown"}}}
            </script>
            """);
        CanonicalRecord record = merger.merge(TestDocuments.ZILLOW_URL, html, null);

        assertEquals("Seattle Downtown", record.get(ListingField.CITY));
        assertEquals("123 Main St", record.get(ListingField.STREET));
        assertEquals("WA", record.get(ListingField.STATE));
        assertEquals("98101", record.get(ListingField.POSTAL_CODE));
    }

    @Test
    void testIsPlaceholderTitle() {
        assertTrue(merger.isPlaceholderTitle("Zillow"));
        assertTrue(merger.isPlaceholderTitle("Home details:"));
        assertTrue(merger.isPlaceholderTitle(" "));
        assertFalse(merger.isPlaceholderTitle("123 Main St"));
        assertFalse(merger.isPlaceholderTitle(null));
    }
}
