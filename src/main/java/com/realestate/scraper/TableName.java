package com.realestate.scraper;

import java.util.List;

/**
 * The relational tables a listing projects into, with their persisted column names in order.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public enum TableName {
    LISTINGS("listings", List.of("listing_id", "property_id", "location_id", "source_id", "source_url",
        "external_id", "title", "description", "status", "list_date", "days_on_market", "list_price",
        "price_per_unit_area", "scraped_timestamp")),
    PROPERTIES("properties", List.of("property_id", "location_id", "street_address", "unit_number", "city",
        "state", "postal_code", "latitude", "longitude", "beds", "baths", "interior_area", "lot_size",
        "year_built", "property_type", "property_subtype", "condition")),
    MEDIA("media", List.of("listing_id", "media_url", "media_type", "display_order", "is_primary")),
    AGENTS("agents", List.of("listing_id", "agent_name", "phone", "brokerage", "email")),
    PRICE_HISTORY("price_history", List.of("listing_id", "event_date", "event_type", "price", "notes")),
    LOCATIONS("locations", List.of("location_id", "street_address", "unit_number", "city", "state",
        "postal_code", "latitude", "longitude")),
    ENGAGEMENT("engagement", List.of("listing_id", "views", "saves", "shares")),
    FINANCIALS("financials", List.of("listing_id", "hoa_fee", "annual_property_tax", "principal_interest",
        "mortgage_insurance", "home_insurance", "utilities", "currency")),
    COMMUNITY_ATTRIBUTES("community_attributes", List.of("listing_id", "walk_score", "transit_score",
        "bike_score", "amenities")),
    SIMILAR_PROPERTIES("similar_properties", List.of("listing_id", "similar_url"));

    private final String tableName;
    private final List<String> columns;

    TableName(String tableName, List<String> columns) {
        this.tableName = tableName;
        this.columns = columns;
    }

    public String tableName() {
        return tableName;
    }

    public List<String> columns() {
        return columns;
    }
}
