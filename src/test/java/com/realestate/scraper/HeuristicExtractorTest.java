package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the text and DOM heuristics.
 */
public class HeuristicExtractorTest {
    private final HeuristicExtractor extractor = new HeuristicExtractor(TestDocuments.config());

    private static final String MARKDOWN = """
        # 123 Main St, Seattle, WA 98101
        For sale
        $450,000
        Est. payment $2,900/mo
        3 bd 2.5 ba 1,500 sqft
        Built in 1999
        Single Family Residence
        Lot size: 0.25 acres
        12 days on Zillow | 345 views | 20 saves
        Walk Score\u00AE 92
        Transit Score: 70

        ![Front](https://photos.example.com/p/abc-small.jpg)

        ## What's special
        Sunny craftsman with a remodeled kitchen, original hardwood floors and a large backyard.

        ## Monthly cost
        Principal & interest $2,100
        Mortgage insurance $150
        Property taxes $400
        Home insurance $120
        HOA fees $50
        Utilities: Not included

        ## Price history
        Mar 5, 2024 Listed for sale $450,000
        Jan 10, 2020 Sold $380,000

        ## Nearby homes
        [456 Oak Ave](https://www.zillow.com/homedetails/456-Oak-Ave-Seattle-WA-98102/67890_zpid/)
        [This home](https://www.zillow.com/homedetails/123-Main-St-Seattle-WA-98101/12345_zpid/)

        ## Agent information
        Listed by: Acme Realty 206-555-0100 Jane Doe
        """;

    private PartialFieldMap extractRendered(String rendered) {
        return extractor.extract(TestDocuments.document(TestDocuments.ZILLOW_URL, TestDocuments.page("", ""),
            TestDocuments.rendered(rendered)));
    }

    @Test
    void testRenderedListingFacts() {
        PartialFieldMap out = extractRendered(MARKDOWN);

        assertEquals("450000", out.get(ListingField.LIST_PRICE));
        assertEquals("3", out.get(ListingField.BEDS));
        assertEquals("2.5", out.get(ListingField.BATHS));
        assertEquals("1,500", out.get(ListingField.INTERIOR_AREA));
        assertEquals("10890", out.get(ListingField.LOT_SIZE));
        assertEquals("123 Main St", out.get(ListingField.STREET));
        assertEquals("Seattle", out.get(ListingField.CITY));
        assertEquals("WA", out.get(ListingField.STATE));
        assertEquals("98101", out.get(ListingField.POSTAL_CODE));
        assertEquals("1999", out.get(ListingField.YEAR_BUILT));
        assertEquals("Single Family Residence", out.get(ListingField.PROPERTY_TYPE));
        assertEquals("For sale", out.get(ListingField.STATUS));
        assertTrue(out.get(ListingField.DESCRIPTION).startsWith("Sunny craftsman"));
        assertEquals("12", out.get(ListingField.DAYS_ON_MARKET));
        assertEquals("345", out.get(ListingField.VIEWS));
        assertEquals("20", out.get(ListingField.SAVES));
        assertEquals("92", out.get(ListingField.WALK_SCORE));
        assertEquals("70", out.get(ListingField.TRANSIT_SCORE));
    }

    @Test
    void testMonthlyCostSection() {
        PartialFieldMap out = extractRendered(MARKDOWN);

        assertEquals("2,100", out.get(ListingField.PRINCIPAL_INTEREST));
        assertEquals("150", out.get(ListingField.MORTGAGE_INSURANCE));
        assertEquals("120", out.get(ListingField.HOME_INSURANCE));
        assertEquals("50", out.get(ListingField.HOA_FEE));
        assertEquals("4800", out.get(ListingField.ANNUAL_PROPERTY_TAX));
        assertEquals("Not included", out.get(ListingField.UTILITIES));
    }

    @Test
    void testStatedAnnualTaxWinsOverMonthlyFigure() {
        PartialFieldMap out = extractRendered("""
            Annual tax amount: $5,123
            ## Monthly cost
            Property taxes $400
            """);

        assertEquals("5,123", out.get(ListingField.ANNUAL_PROPERTY_TAX));
    }

    @Test
    void testPriceHistoryEvents() {
        PartialFieldMap out = extractRendered(MARKDOWN);

        List<PriceEvent> events = out.priceHistory();
        assertEquals(2, events.size());
        assertEquals("2024-03-05", events.get(0).eventDate());
        assertEquals("Listed for sale", events.get(0).eventType());
        assertEquals(0, new BigDecimal("450000").compareTo(events.get(0).price()));
        assertEquals("2020-01-10", events.get(1).eventDate());
        assertEquals("Sold", events.get(1).eventType());
        assertEquals(0, new BigDecimal("380000").compareTo(events.get(1).price()));
    }

    @Test
    void testAgentMediaAndSimilarListings() {
        PartialFieldMap out = extractRendered(MARKDOWN);

        assertEquals(List.of(new AgentContact("Jane Doe", "206-555-0100", "Acme Realty", null)), out.agents());
        assertEquals(List.of("https://photos.example.com/p/abc-small.jpg"), out.media());
        assertEquals(List.of("https://www.zillow.com/homedetails/456-Oak-Ave-Seattle-WA-98102/67890_zpid/"),
            out.similarUrls());
    }

    @Test
    void testDomImagesAndAgentContainer() {
        String body = """
            <div class="listing-agent-card">Listed by: Acme Realty - Jane Doe</div>
            <img src="/photos/a.jpg" srcset="/photos/a-640.jpg 640w, /photos/a-1280.jpg 1280w">
            <img data-src="https://photos.example.com/b.jpg" src="data:image/gif;base64,R0lGOD">
            <p>Listed at $525,000 with a $1,200/mo HOA.</p>
            """;
        PartialFieldMap out = extractor.extract(
            TestDocuments.document(TestDocuments.GENERIC_URL, TestDocuments.page("", body), null));

        assertEquals("525000", out.get(ListingField.LIST_PRICE));
        assertEquals(List.of(
            "https://listings.example.com/photos/a.jpg",
            "https://listings.example.com/photos/a-640.jpg",
            "https://listings.example.com/photos/a-1280.jpg",
            "https://photos.example.com/b.jpg"), out.media());
        assertEquals(1, out.agents().size());
        assertEquals("Acme Realty", out.agents().get(0).brokerage());
        assertEquals("Jane Doe", out.agents().get(0).name());
    }

    @Test
    void testMaxPricePrefersLargestAmount() {
        assertEquals("450000", HeuristicExtractor.maxPrice("Rent estimate $1,200/mo, price $450,000"));
        assertNull(HeuristicExtractor.maxPrice("Contact for price"));
    }

    @Test
    void testParseAgentLineSplitsOnPhone() {
        AgentContact contact = HeuristicExtractor.parseAgentLine(
            "Listing by: Acme Realty (206) 555-0100 Jane Doe jane@acme.com");
        assertEquals("Acme Realty", contact.brokerage());
        assertEquals("(206) 555-0100", contact.phone());
        assertEquals("Jane Doe", contact.name());
        assertEquals("jane@acme.com", contact.email());

        assertNull(HeuristicExtractor.parseAgentLine("  "));
    }

    @Test
    void testStatusKeywordOnlyTrustedNearTop() {
        String late = "Nice home\n" + "Quiet street. ".repeat(200) + "\nSold homes nearby";
        assertFalse(extractRendered(late).has(ListingField.STATUS));

        String labelled = "Nice home\n" + "Quiet street. ".repeat(200) + "\nStatus: Pending";
        assertEquals("Pending", extractRendered(labelled).get(ListingField.STATUS));
    }
}
