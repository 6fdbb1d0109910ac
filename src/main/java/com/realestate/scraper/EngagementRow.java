package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the {@code engagement} table.
 */
@JsonPropertyOrder({"listing_id", "views", "saves", "shares"})
public record EngagementRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("views") Integer views,
    @JsonProperty("saves") Integer saves,
    @JsonProperty("shares") Integer shares
) {}
