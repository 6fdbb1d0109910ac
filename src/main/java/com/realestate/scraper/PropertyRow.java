package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Row of the {@code properties} table: the physical facts of the listed home.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
@JsonPropertyOrder({"property_id", "location_id", "street_address", "unit_number", "city", "state", "postal_code",
    "latitude", "longitude", "beds", "baths", "interior_area", "lot_size", "year_built", "property_type",
    "property_subtype", "condition"})
public record PropertyRow(
    @JsonProperty("property_id") String propertyId,
    @JsonProperty("location_id") String locationId,
    @JsonProperty("street_address") String streetAddress,
    @JsonProperty("unit_number") String unitNumber,
    @JsonProperty("city") String city,
    @JsonProperty("state") String state,
    @JsonProperty("postal_code") String postalCode,
    @JsonProperty("latitude") BigDecimal latitude,
    @JsonProperty("longitude") BigDecimal longitude,
    @JsonProperty("beds") Integer beds,
    @JsonProperty("baths") BigDecimal baths,
    @JsonProperty("interior_area") BigDecimal interiorArea,
    @JsonProperty("lot_size") BigDecimal lotSize,
    @JsonProperty("year_built") Integer yearBuilt,
    @JsonProperty("property_type") String propertyType,
    @JsonProperty("property_subtype") String propertySubtype,
    @JsonProperty("condition") String condition
) {}
