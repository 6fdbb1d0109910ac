package com.realestate.sitegrammar;

import com.realestate.scraper.ExtractionConfig;
import com.realestate.scraper.ListingField;
import com.realestate.scraper.PartialFieldMap;
import com.realestate.scraper.SourceId;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Zillow URL, id and image rules.
 */
public class ZillowGrammarTest {
    private final ZillowGrammar grammar = new ZillowGrammar(ExtractionConfig.defaults());

    @Test
    void testDetectByHost() {
        assertTrue(grammar.detect("https://www.zillow.com/homedetails/x/1_zpid/"));
        assertTrue(grammar.detect("https://zillow.com/b/"));
        assertFalse(grammar.detect("https://www.notzillow.com/homedetails/x/1_zpid/"));
        assertFalse(grammar.detect(null));
        assertEquals(SourceId.ZILLOW, grammar.sourceId());
    }

    @Test
    void testUrlAddressWithUnit() {
        PartialFieldMap address = grammar.extractUrlAddress(
            "https://www.zillow.com/homedetails/500-Pine-St-Apt-4B-Seattle-WA-98101/48749425_zpid/");

        assertEquals("500 Pine St", address.get(ListingField.STREET));
        assertEquals("Apt 4B", address.get(ListingField.UNIT));
        assertEquals("Seattle", address.get(ListingField.CITY));
        assertEquals("WA", address.get(ListingField.STATE));
        assertEquals("98101", address.get(ListingField.POSTAL_CODE));
    }

    @Test
    void testUrlAddressWithMultiWordCity() {
        PartialFieldMap address = grammar.extractUrlAddress(
            "https://www.zillow.com/homedetails/77-Ocean-Ave-Santa-Monica-CA-90401/20449300_zpid/");

        assertEquals("77 Ocean Ave", address.get(ListingField.STREET));
        assertEquals("Santa Monica", address.get(ListingField.CITY));
        assertEquals("CA", address.get(ListingField.STATE));
        assertFalse(address.has(ListingField.UNIT));
    }

    @Test
    void testUrlWithoutSlugYieldsNothing() {
        assertTrue(grammar.extractUrlAddress("https://www.zillow.com/seattle-wa/").isEmpty());
    }

    @Test
    void testExternalIdAndListingUrl() {
        assertEquals(Optional.of("48749425"),
            grammar.externalId("https://www.zillow.com/homedetails/500-Pine-St/48749425_zpid/"));
        assertTrue(grammar.externalId("https://www.zillow.com/seattle-wa/").isEmpty());
        assertTrue(grammar.isListingUrl("https://www.zillow.com/homedetails/500-Pine-St/48749425_zpid/?x=1"));
        assertFalse(grammar.isListingUrl("https://www.zillow.com/seattle-wa/"));
        assertFalse(grammar.isListingUrl("https://www.redfin.com/homedetails/500-Pine-St/48749425_zpid/"));
    }

    @Test
    void testUpgradeImage() {
        assertEquals("https://photos.zillowstatic.com/fp/abc-uncropped_scaled_within_1536_1152.webp",
            grammar.upgradeImage("https://photos.zillowstatic.com/fp/abc-cc_ft_576.webp"));
        assertEquals("https://photos.zillowstatic.com/fp/abc-p_e.jpg",
            grammar.upgradeImage("https://photos.zillowstatic.com/fp/abc-p_e.jpg"));
    }
}
