package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Row of the {@code community_attributes} table.
 */
@JsonPropertyOrder({"listing_id", "walk_score", "transit_score", "bike_score", "amenities"})
public record CommunityRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("walk_score") Integer walkScore,
    @JsonProperty("transit_score") Integer transitScore,
    @JsonProperty("bike_score") Integer bikeScore,
    @JsonProperty("amenities") List<String> amenities
) {}
