package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the {@code similar_properties} table.
 */
@JsonPropertyOrder({"listing_id", "similar_url"})
public record SimilarPropertyRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("similar_url") String similarUrl
) {}
