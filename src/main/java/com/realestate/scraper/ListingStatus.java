package com.realestate.scraper;

import java.util.Locale;

/**
 * Controlled vocabulary for the market status of a listing.
 * <p>
 * {@link #BLOCKED} is only ever assigned by the blocked-page detector; free text never maps onto it.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public enum ListingStatus {
    ACTIVE("active"),
    PENDING("pending"),
    CONTINGENT("contingent"),
    SOLD("sold"),
    WITHDRAWN("withdrawn"),
    BLOCKED("blocked"),
    UNKNOWN("unknown");

    private final String code;

    ListingStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Maps a free-text or site-specific status value onto the vocabulary.
     * <ul>
     *   <li>"FOR_SALE", "For sale", "Active", "Coming soon", "New" map to {@link #ACTIVE}.</li>
     *   <li>"Under contract", "Contingent" map to {@link #CONTINGENT}; "Pending" to {@link #PENDING}.</li>
     *   <li>"Sold", "Recently sold", "Closed" map to {@link #SOLD}.</li>
     *   <li>"Off market", "Withdrawn", "Cancelled", "Expired" map to {@link #WITHDRAWN}.</li>
     * </ul>
     * @param text raw status text (may be null)
     * @return the matching status, or {@link #UNKNOWN}
     */
    public static ListingStatus fromText(String text) {
        if (text == null || text.isBlank()) return UNKNOWN;
        String s = text.toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ').trim();
        for (ListingStatus status : values()) {
            if (status.code.equals(s)) return status;
        }
        if (s.contains("contingent") || s.contains("under contract")) return CONTINGENT;
        if (s.contains("pending")) return PENDING;
        if (s.contains("sold") || s.contains("closed")) return SOLD;
        if (s.contains("off market") || s.contains("withdrawn") || s.contains("cancel") || s.contains("expired")) {
            return WITHDRAWN;
        }
        if (s.contains("for sale") || s.contains("active") || s.contains("coming soon") || s.equals("new")) {
            return ACTIVE;
        }
        return UNKNOWN;
    }
}
