package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands one normalized record into the relational row set.
 * <p>
 * Invariants:
 * <ul>
 *   <li>Exactly one listing row and one property row per record.</li>
 *   <li>One media row per resolved image, in order; only the first is primary.</li>
 *   <li>Location, engagement, financial and community rows exist only when the record holds data for them.</li>
 *   <li>Foreign keys are copied from the record's identity; the projector never recomputes identity and
 *   refuses records that were not normalized.</li>
 * </ul>
 * The only clock read is the non-functional {@code scraped_timestamp}.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class TableProjector {
    private static final Logger logger = LoggerFactory.getLogger(TableProjector.class);

    static final String MEDIA_TYPE_IMAGE = "image";
    static final String CURRENCY = "USD";

    private final Clock clock;

    public TableProjector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Projects a normalized record.
     * @param record normalized record
     * @return the row set, every table present
     * @throws IllegalStateException if the record has not been normalized
     */
    public RowSet project(CanonicalRecord record) {
        if (!record.isNormalized()) {
            logger.warn("Refusing to project unnormalized record for {}", record.sourceUrl());
            throw new IllegalStateException("Record for " + record.sourceUrl() + " has no identity; normalize it first");
        }
        String listingId = record.listingId();
        String scrapedAt = Instant.now(clock).toString();

        ListingRow listing = new ListingRow(
            listingId,
            record.propertyId(),
            record.locationId(),
            record.sourceId().code(),
            record.sourceUrl(),
            record.text(ListingField.EXTERNAL_ID),
            record.text(ListingField.TITLE),
            record.text(ListingField.DESCRIPTION),
            record.status() == null ? null : record.status().code(),
            record.text(ListingField.LIST_DATE),
            record.integer(ListingField.DAYS_ON_MARKET),
            record.decimal(ListingField.LIST_PRICE),
            record.pricePerUnitArea(),
            scrapedAt);

        PropertyRow property = new PropertyRow(
            record.propertyId(),
            record.locationId(),
            record.text(ListingField.STREET),
            record.text(ListingField.UNIT),
            record.text(ListingField.CITY),
            record.text(ListingField.STATE),
            record.text(ListingField.POSTAL_CODE),
            record.decimal(ListingField.LATITUDE),
            record.decimal(ListingField.LONGITUDE),
            record.integer(ListingField.BEDS),
            record.decimal(ListingField.BATHS),
            record.decimal(ListingField.INTERIOR_AREA),
            record.decimal(ListingField.LOT_SIZE),
            record.integer(ListingField.YEAR_BUILT),
            record.propertyType() == null ? null : record.propertyType().code(),
            record.text(ListingField.PROPERTY_SUBTYPE),
            record.text(ListingField.CONDITION));

        List<MediaRow> media = new ArrayList<>();
        for (int i = 0; i < record.media().size(); i++) {
            media.add(new MediaRow(listingId, record.media().get(i), MEDIA_TYPE_IMAGE, i, i == 0));
        }

        List<AgentRow> agents = record.agents().stream()
            .map(a -> new AgentRow(listingId, a.name(), a.phone(), a.brokerage(), a.email()))
            .toList();

        List<PriceHistoryRow> history = record.priceHistory().stream()
            .map(e -> new PriceHistoryRow(listingId, e.eventDate(), e.eventType(), e.price(), e.notes()))
            .toList();

        List<LocationRow> locations = new ArrayList<>();
        if (record.locationId() != null) {
            locations.add(new LocationRow(
                record.locationId(),
                record.text(ListingField.STREET),
                record.text(ListingField.UNIT),
                record.text(ListingField.CITY),
                record.text(ListingField.STATE),
                record.text(ListingField.POSTAL_CODE),
                record.decimal(ListingField.LATITUDE),
                record.decimal(ListingField.LONGITUDE)));
        }

        List<EngagementRow> engagement = new ArrayList<>();
        if (record.hasAny(ListingField.Group.ENGAGEMENT)) {
            engagement.add(new EngagementRow(listingId,
                record.integer(ListingField.VIEWS),
                record.integer(ListingField.SAVES),
                record.integer(ListingField.SHARES)));
        }

        List<FinancialRow> financials = new ArrayList<>();
        if (record.hasAny(ListingField.Group.FINANCIAL)) {
            financials.add(new FinancialRow(listingId,
                record.decimal(ListingField.HOA_FEE),
                record.decimal(ListingField.ANNUAL_PROPERTY_TAX),
                record.decimal(ListingField.PRINCIPAL_INTEREST),
                record.decimal(ListingField.MORTGAGE_INSURANCE),
                record.decimal(ListingField.HOME_INSURANCE),
                record.text(ListingField.UTILITIES),
                CURRENCY));
        }

        List<CommunityRow> community = new ArrayList<>();
        if (record.hasAny(ListingField.Group.COMMUNITY) || !record.amenities().isEmpty()) {
            community.add(new CommunityRow(listingId,
                record.integer(ListingField.WALK_SCORE),
                record.integer(ListingField.TRANSIT_SCORE),
                record.integer(ListingField.BIKE_SCORE),
                record.amenities()));
        }

        List<SimilarPropertyRow> similar = record.similarUrls().stream()
            .map(url -> new SimilarPropertyRow(listingId, url))
            .toList();

        RowSet rows = new RowSet(List.of(listing), List.of(property), media, agents, history, locations,
            engagement, financials, community, similar);
        logger.debug("Projected {}: {} media, {} agent(s), {} event(s)", listingId, media.size(), agents.size(),
            history.size());
        return rows;
    }
}
