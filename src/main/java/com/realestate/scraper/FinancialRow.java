package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Row of the {@code financials} table. Monthly figures except {@code annualPropertyTax}.
 */
@JsonPropertyOrder({"listing_id", "hoa_fee", "annual_property_tax", "principal_interest", "mortgage_insurance",
    "home_insurance", "utilities", "currency"})
public record FinancialRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("hoa_fee") BigDecimal hoaFee,
    @JsonProperty("annual_property_tax") BigDecimal annualPropertyTax,
    @JsonProperty("principal_interest") BigDecimal principalInterest,
    @JsonProperty("mortgage_insurance") BigDecimal mortgageInsurance,
    @JsonProperty("home_insurance") BigDecimal homeInsurance,
    @JsonProperty("utilities") String utilities,
    @JsonProperty("currency") String currency
) {}
