package com.realestate.scraper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scalar fields of a canonical listing record.
 * <p>
 * Each field carries the {@link Kind} that decides how the normalizer coerces its raw value, and the
 * {@link Group} it belongs to in the record layout. List-valued data (media, agents, price events,
 * similar listings, amenities) is held separately by {@link CanonicalRecord}.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public enum ListingField {
    STREET(Kind.TEXT, Group.ADDRESS),
    UNIT(Kind.TEXT, Group.ADDRESS),
    CITY(Kind.TEXT, Group.ADDRESS),
    STATE(Kind.TEXT, Group.ADDRESS),
    POSTAL_CODE(Kind.POSTAL, Group.ADDRESS),
    LATITUDE(Kind.COORDINATE, Group.ADDRESS),
    LONGITUDE(Kind.COORDINATE, Group.ADDRESS),

    BEDS(Kind.INTEGER, Group.PHYSICAL),
    BATHS(Kind.DECIMAL, Group.PHYSICAL),
    INTERIOR_AREA(Kind.DECIMAL, Group.PHYSICAL),
    LOT_SIZE(Kind.DECIMAL, Group.PHYSICAL),
    YEAR_BUILT(Kind.INTEGER, Group.PHYSICAL),
    PROPERTY_TYPE(Kind.PROPERTY_TYPE, Group.PHYSICAL),
    PROPERTY_SUBTYPE(Kind.TEXT, Group.PHYSICAL),
    CONDITION(Kind.TEXT, Group.PHYSICAL),

    LIST_PRICE(Kind.DECIMAL, Group.COMMERCIAL),
    STATUS(Kind.STATUS, Group.COMMERCIAL),
    LIST_DATE(Kind.DATE, Group.COMMERCIAL),
    DAYS_ON_MARKET(Kind.INTEGER, Group.COMMERCIAL),

    TITLE(Kind.TEXT, Group.NARRATIVE),
    DESCRIPTION(Kind.TEXT, Group.NARRATIVE),

    EXTERNAL_ID(Kind.TEXT, Group.IDENTITY),

    VIEWS(Kind.INTEGER, Group.ENGAGEMENT),
    SAVES(Kind.INTEGER, Group.ENGAGEMENT),
    SHARES(Kind.INTEGER, Group.ENGAGEMENT),

    HOA_FEE(Kind.DECIMAL, Group.FINANCIAL),
    ANNUAL_PROPERTY_TAX(Kind.DECIMAL, Group.FINANCIAL),
    PRINCIPAL_INTEREST(Kind.DECIMAL, Group.FINANCIAL),
    MORTGAGE_INSURANCE(Kind.DECIMAL, Group.FINANCIAL),
    HOME_INSURANCE(Kind.DECIMAL, Group.FINANCIAL),
    UTILITIES(Kind.TEXT, Group.FINANCIAL),

    WALK_SCORE(Kind.INTEGER, Group.COMMUNITY),
    TRANSIT_SCORE(Kind.INTEGER, Group.COMMUNITY),
    BIKE_SCORE(Kind.INTEGER, Group.COMMUNITY);

    /** How a raw value is coerced during normalization. */
    public enum Kind {
        TEXT, DECIMAL, COORDINATE, INTEGER, DATE, POSTAL, PROPERTY_TYPE, STATUS
    }

    /** Record section a field belongs to. */
    public enum Group {
        ADDRESS, PHYSICAL, COMMERCIAL, NARRATIVE, IDENTITY, ENGAGEMENT, FINANCIAL, COMMUNITY
    }

    private final Kind kind;
    private final Group group;

    ListingField(Kind kind, Group group) {
        this.kind = kind;
        this.group = group;
    }

    public Kind kind() {
        return kind;
    }

    public Group group() {
        return group;
    }

    /**
     * Returns the snake_case key used for this field in configuration files.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns all fields of one group, in declaration order.
     */
    public static List<ListingField> inGroup(Group group) {
        List<ListingField> fields = new ArrayList<>();
        for (ListingField f : values()) if (f.group == group) fields.add(f);
        return fields;
    }

    /**
     * Returns the field whose {@link #key()} equals the given key, or null if not found.
     */
    public static ListingField fromKey(String key) {
        if (key == null) return null;
        for (ListingField f : values()) if (f.key().equalsIgnoreCase(key.trim())) return f;
        return null;
    }
}
