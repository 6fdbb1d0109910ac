package com.realestate.scraper;

/**
 * Controlled vocabulary for property types. Unrecognized free text maps to {@link #OTHER}.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public enum PropertyType {
    SINGLE_FAMILY("single_family"),
    CONDO("condo"),
    TOWNHOUSE("townhouse"),
    MULTI_FAMILY("multi_family"),
    APARTMENT("apartment"),
    LAND("land"),
    MANUFACTURED("manufactured"),
    OTHER("other");

    private final String code;

    PropertyType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Returns the type with the given code, or null when the code is not part of the vocabulary.
     */
    public static PropertyType fromCode(String code) {
        if (code == null) return null;
        for (PropertyType t : values()) {
            if (t.code.equalsIgnoreCase(code.trim())) return t;
        }
        return null;
    }
}
