package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Row of the {@code locations} table. Listings at the same normalized address share one location id.
 */
@JsonPropertyOrder({"location_id", "street_address", "unit_number", "city", "state", "postal_code", "latitude",
    "longitude"})
public record LocationRow(
    @JsonProperty("location_id") String locationId,
    @JsonProperty("street_address") String streetAddress,
    @JsonProperty("unit_number") String unitNumber,
    @JsonProperty("city") String city,
    @JsonProperty("state") String state,
    @JsonProperty("postal_code") String postalCode,
    @JsonProperty("latitude") BigDecimal latitude,
    @JsonProperty("longitude") BigDecimal longitude
) {}
