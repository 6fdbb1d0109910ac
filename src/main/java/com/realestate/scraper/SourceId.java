package com.realestate.scraper;

/**
 * Identifies the site a listing document came from.
 * <p>
 * The value is always inferred from the URL host by a site grammar, never from page content.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public enum SourceId {
    ZILLOW("zillow"),
    REDFIN("redfin"),
    UNKNOWN("unknown");

    private final String code;

    SourceId(String code) {
        this.code = code;
    }

    /**
     * Returns the lower-case code written into the listing rows.
     */
    public String code() {
        return code;
    }
}
