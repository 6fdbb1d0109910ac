package com.realestate.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the {@code agents} table.
 */
@JsonPropertyOrder({"listing_id", "agent_name", "phone", "brokerage", "email"})
public record AgentRow(
    @JsonProperty("listing_id") String listingId,
    @JsonProperty("agent_name") String agentName,
    @JsonProperty("phone") String phone,
    @JsonProperty("brokerage") String brokerage,
    @JsonProperty("email") String email
) {}
