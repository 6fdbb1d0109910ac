package com.realestate.scraper;

/**
 * Interface for the listing extraction pipeline: one fetched document in, a typed record or relational rows out.
 * <p>
 * Implementations perform no I/O and hold no per-document state, so one instance may serve any number of
 * documents concurrently.
 */
public interface ListingExtractionServiceInterface {
    /**
     * Runs the extraction cascade, normalization and media resolution for one document.
     * @param sourceUrl absolute listing URL (required)
     * @param html raw document markup (may be null or empty)
     * @param renderedText optional rendered text or markdown companion (may be null)
     * @return the normalized record with resolved media
     * @throws IllegalArgumentException if the source URL is missing or not an absolute URL
     */
    CanonicalRecord extract(String sourceUrl, String html, String renderedText);

    /**
     * Runs {@link #extract(String, String, String)} and projects the record into relational rows.
     * @param sourceUrl absolute listing URL (required)
     * @param html raw document markup (may be null or empty)
     * @param renderedText optional rendered text or markdown companion (may be null)
     * @return all ten tables, possibly empty
     * @throws IllegalArgumentException if the source URL is missing or not an absolute URL
     */
    RowSet process(String sourceUrl, String html, String renderedText);
}
