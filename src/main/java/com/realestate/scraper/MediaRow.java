package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the {@code media} table. {@code displayOrder} is 0-based; only order 0 is primary.
 */
@JsonPropertyOrder({"listing_id", "media_url", "media_type", "display_order", "is_primary"})
public record MediaRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("media_url") String mediaUrl,
    @JsonProperty("media_type") String mediaType,
    @JsonProperty("display_order") int displayOrder,
    @JsonProperty("is_primary") boolean isPrimary
) {}
