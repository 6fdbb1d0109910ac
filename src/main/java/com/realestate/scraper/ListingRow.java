package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Row of the {@code listings} table: one per extracted document.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
@JsonPropertyOrder({"listing_id", "property_id", "location_id", "source_id", "source_url", "external_id", "title",
    "description", "status", "list_date", "days_on_market", "list_price", "price_per_unit_area", "scraped_timestamp"})
public record ListingRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("property_id") String propertyId,
    @JsonProperty("location_id") String locationId,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("external_id") String externalId,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("status") String status,
    @JsonProperty("list_date") String listDate,
    @JsonProperty("days_on_market") Integer daysOnMarket,
    @JsonProperty("list_price") BigDecimal listPrice,
    @JsonProperty("price_per_unit_area") BigDecimal pricePerUnitArea,
    @JsonProperty("scraped_timestamp") String scrapedTimestamp
) {}
