package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for configuration defaults, overrides and the alias registry.
 */
public class ExtractionConfigTest {
    @Test
    void testDefaultsLoadedFromResource() {
        ExtractionConfig config = ExtractionConfig.defaults();

        assertEquals(1024, config.blockedMinLength());
        assertTrue(config.blockedMarkers().contains("px-captcha"));
        assertTrue(config.placeholderTitles().contains("about this home"));
        assertEquals(20, config.maxSimilarUrls());
        assertTrue(config.embeddedStatePayloads().contains("__NEXT_DATA__"));
        assertTrue(config.propertyTypeSynonyms().get(PropertyType.CONDO).contains("condominium"));
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty("similar.max-urls", "5");
        try {
            assertEquals(5, ExtractionConfig.load().maxSimilarUrls());
        } finally {
            System.clearProperty("similar.max-urls");
        }
    }

    @Test
    void testNonNumericValueRejected() {
        Properties props = new Properties();
        props.setProperty("blocked.min-length", "large");
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.fromProperties(props));
    }

    @Test
    void testMissingKeysFallBackToDefaults() {
        ExtractionConfig config = ExtractionConfig.fromProperties(new Properties());

        assertEquals(1024, config.blockedMinLength());
        assertEquals(160, config.priceHistoryWindow());
        assertTrue(config.blockedMarkers().isEmpty());
        assertNull(config.aliases().fieldFor("price"));
    }

    @Test
    void testAliasRegistryLookups() {
        FieldAliasRegistry aliases = ExtractionConfig.defaults().aliases();

        assertEquals(ListingField.POSTAL_CODE, aliases.fieldFor("zipcode"));
        assertEquals(ListingField.EXTERNAL_ID, aliases.fieldFor("ZPID"));
        assertEquals(ListingField.LIST_PRICE, aliases.fieldFor("price"));
        assertNull(aliases.fieldFor("photos"));
        assertEquals(FieldAliasRegistry.MEDIA, aliases.collectionFor("responsivePhotos"));
        assertEquals(FieldAliasRegistry.PRICE_HISTORY, aliases.collectionFor("priceHistory"));
        assertTrue(aliases.isAlias(FieldAliasRegistry.AGENT_NAME, "agentName"));
        assertTrue(aliases.aliasesOf(ListingField.POSTAL_CODE).contains("zipcode"));
    }

    @Test
    void testFirstDeclaredFieldKeepsSharedAlias() {
        Properties props = new Properties();
        props.setProperty("alias.hoa_fee", "price");
        props.setProperty("alias.list_price", "price");
        FieldAliasRegistry aliases = FieldAliasRegistry.fromProperties(props);

        assertEquals(ListingField.LIST_PRICE, aliases.fieldFor("price"));
    }
}
