package com.realestate.scraper;

import org.jsoup.parser.Parser;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes bot-challenge and block pages, whose boilerplate must not be mistaken for listing data.
 * <p>
 * A document is blocked when it is shorter than the configured minimum length or when it contains one of
 * the configured marker phrases (case-insensitive, after HTML entities are decoded).
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class BlockedPageDetector {
    private final ExtractionConfig config;

    public BlockedPageDetector(ExtractionConfig config) {
        this.config = config;
    }

    /**
     * Checks a raw document.
     * @param html raw markup (may be null)
     * @return the reason the document is considered blocked, or empty when it looks like a real page
     */
    public Optional<String> detect(String html) {
        int length = html == null ? 0 : html.length();
        if (length < config.blockedMinLength()) {
            return Optional.of("document length " + length + " below minimum " + config.blockedMinLength());
        }
        String lower = Parser.unescapeEntities(html, false).toLowerCase(Locale.ROOT);
        for (String marker : config.blockedMarkers()) {
            if (lower.contains(marker)) return Optional.of("marker '" + marker + "'");
        }
        return Optional.empty();
    }
}
