package com.realestate.sitegrammar;

import com.realestate.scraper.ListingDocument;
import com.realestate.scraper.PartialFieldMap;
import com.realestate.scraper.SourceId;

import java.util.List;
import java.util.Optional;

/**
 * Everything that is specific to one listing site: how its URLs look, where its pages keep their embedded
 * state, how its listing ids and image URLs are shaped.
 * <p>
 * New sites are supported by adding an implementation and registering it in {@link SiteGrammarRegistry};
 * site-agnostic code never branches on host names.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public interface SiteGrammar {
    /**
     * Returns the source this grammar identifies.
     */
    SourceId sourceId();

    /**
     * Returns true when the URL's host belongs to this site.
     * @param url absolute URL (may be null)
     */
    boolean detect(String url);

    /**
     * Extracts fields from the site's script-embedded state objects.
     * Never throws for malformed payloads; a payload that cannot be parsed contributes nothing.
     * @param document parsed listing document
     * @return fields found, possibly empty
     */
    PartialFieldMap extractStructured(ListingDocument document);

    /**
     * Decodes address components from the URL path. Pure function of the URL string.
     * @param url listing URL (may be null)
     * @return address fields found, possibly empty
     */
    PartialFieldMap extractUrlAddress(String url);

    /**
     * Finds the site-native listing id in a URL or document text.
     */
    Optional<String> externalId(String text);

    /**
     * Returns true when the URL points at a single listing of this site.
     */
    boolean isListingUrl(String url);

    /**
     * CSS selectors of script tags that carry this site's embedded state, in priority order.
     */
    List<String> stateScriptSelectors();

    /**
     * Rewrites a low-resolution image URL to the highest resolution variant the site serves.
     * @return the upgraded URL, or the input when no rule applies
     */
    default String upgradeImage(String url) {
        return url;
    }
}
