package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Row of the {@code price_history} table.
 */
@JsonPropertyOrder({"listing_id", "event_date", "event_type", "price", "notes"})
public record PriceHistoryRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("event_date") String eventDate,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("notes") String notes
) {}
