package com.realestate.scraper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The relational rows projected from one listing. Every table is always present; a table without data is an
 * empty list, never null.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public record RowSet(
    List<ListingRow> listings,
    List<PropertyRow> properties,
    List<MediaRow> media,
    List<AgentRow> agents,
    List<PriceHistoryRow> priceHistory,
    List<LocationRow> locations,
    List<EngagementRow> engagement,
    List<FinancialRow> financials,
    List<CommunityRow> communityAttributes,
    List<SimilarPropertyRow> similarProperties
) {
    public RowSet {
        listings = copy(listings);
        properties = copy(properties);
        media = copy(media);
        agents = copy(agents);
        priceHistory = copy(priceHistory);
        locations = copy(locations);
        engagement = copy(engagement);
        financials = copy(financials);
        communityAttributes = copy(communityAttributes);
        similarProperties = copy(similarProperties);
    }

    /**
     * Returns the rows of one table.
     */
    public List<?> rows(TableName table) {
        return switch (table) {
            case LISTINGS -> listings;
            case PROPERTIES -> properties;
            case MEDIA -> media;
            case AGENTS -> agents;
            case PRICE_HISTORY -> priceHistory;
            case LOCATIONS -> locations;
            case ENGAGEMENT -> engagement;
            case FINANCIALS -> financials;
            case COMMUNITY_ATTRIBUTES -> communityAttributes;
            case SIMILAR_PROPERTIES -> similarProperties;
        };
    }

    /**
     * Returns every table keyed by its persisted name, in {@link TableName} order.
     */
    public Map<String, List<?>> asTables() {
        Map<String, List<?>> tables = new LinkedHashMap<>();
        for (TableName table : TableName.values()) tables.put(table.tableName(), rows(table));
        return tables;
    }

    private static <T> List<T> copy(List<T> rows) {
        return rows == null ? List.of() : List.copyOf(rows);
    }
}
