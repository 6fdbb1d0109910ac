package com.realestate.scraper;

/**
 * One stage of the extraction cascade.
 * <p>
 * Implementations must be total over their input: a malformed block, an unexpected tag layout or a failed
 * probe reduces what the stage returns, it never raises.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public interface FieldExtractor {
    /**
     * Extracts whatever this stage can find in the document.
     * @param document parsed listing document
     * @return fields found, possibly empty, never null
     */
    PartialFieldMap extract(ListingDocument document);

    /**
     * Short stage name used in log lines.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
