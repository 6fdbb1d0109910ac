package com.realestate.scraper;

import com.realestate.sitegrammar.SiteGrammar;
import com.realestate.sitegrammar.SiteGrammarRegistry;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs the extraction cascade for one document and merges the stage results into one canonical record.
 * <p>
 * Workflow:
 * <ul>
 *   <li>The source URL is validated and its site grammar resolved from the host.</li>
 *   <li>An empty document yields a record carrying only the source URL and source id.</li>
 *   <li>A blocked document (too short, or showing a challenge marker) is tagged {@code status=blocked}; every
 *   content stage is skipped and only URL-derived facts (listing id, address) are kept.</li>
 *   <li>Otherwise the stages run in fixed priority order: embedded state, linked data, meta tags, heuristics.
 *   Each stage result is absorbed with write-once semantics, so a lower-priority stage only ever fills
 *   fields that are still empty.</li>
 *   <li>Placeholder titles are dropped from a stage result before it is absorbed, leaving the title free for
 *   a later stage.</li>
 *   <li>Finally a listing id still missing is looked up in the page's own canonical link and {@code og:url},
 *   never in arbitrary page links, and the URL address grammar fills any address component still missing.</li>
 * </ul>
 * A failing stage is logged at debug level and contributes nothing; the cascade never raises for document
 * content. Only a missing or unparseable source URL raises.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class CascadeMerger {
    private static final Logger logger = LoggerFactory.getLogger(CascadeMerger.class);

    private static final List<ListingField> ADDRESS_CORE =
        List.of(ListingField.STREET, ListingField.CITY, ListingField.STATE, ListingField.POSTAL_CODE);

    private record Stage(String name, FieldExtractor extractor) {}

    private final ExtractionConfig config;
    private final SiteGrammarRegistry registry;
    private final BlockedPageDetector blockedPageDetector;
    private final List<Stage> contentStages;

    public CascadeMerger(ExtractionConfig config, SiteGrammarRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.blockedPageDetector = new BlockedPageDetector(config);
        this.contentStages = List.of(
            new Stage("embedded-state", document -> document.grammar().extractStructured(document)),
            new Stage("linked-data", new LinkedDataExtractor()),
            new Stage("meta-tags", new MetaTagExtractor()),
            new Stage("heuristic", new HeuristicExtractor(config)));
    }

    /**
     * Merges one fetched document into a canonical record.
     * @param sourceUrl absolute listing URL (required)
     * @param html raw document markup (may be null or empty)
     * @param renderedText optional rendered text or markdown companion (may be null)
     * @return the merged, not yet normalized record
     * @throws IllegalArgumentException if the source URL is null, blank or not an absolute URL
     */
    public CanonicalRecord merge(String sourceUrl, String html, String renderedText) {
        requireValidUrl(sourceUrl);
        String url = sourceUrl.trim();
        SiteGrammar grammar = registry.resolve(url);
        CanonicalRecord record = new CanonicalRecord(url, grammar.sourceId());

        if (TextUtils.isBlank(html) && TextUtils.isBlank(renderedText)) {
            logger.debug("Empty document for {}; returning bare record", url);
            return record;
        }

        grammar.externalId(url).ifPresent(id -> record.offer(ListingField.EXTERNAL_ID, id));

        String inspected = TextUtils.isBlank(html) ? renderedText : html;
        Optional<String> blocked = blockedPageDetector.detect(inspected);
        if (blocked.isPresent()) {
            logger.warn("Blocked document for {}: {}", url, blocked.get());
            record.offer(ListingField.STATUS, ListingStatus.BLOCKED.code());
            record.absorb(grammar.extractUrlAddress(url));
            return record;
        }

        ListingDocument document = ListingDocument.of(url, grammar, html, renderedText);
        for (Stage stage : contentStages) {
            PartialFieldMap partial;
            try {
                partial = stage.extractor().extract(document);
            } catch (RuntimeException e) {
                logger.debug("Stage {} failed for {}: {}", stage.name(), url, e.getMessage());
                continue;
            }
            scrubPlaceholderTitle(partial);
            int filled = record.absorb(partial);
            logger.debug("Stage {} filled {} of {} field(s) for {}", stage.name(), filled, partial.size(), url);
        }

        if (!record.has(ListingField.EXTERNAL_ID)) {
            selfUrls(document).stream()
                .map(grammar::externalId)
                .flatMap(Optional::stream)
                .findFirst()
                .ifPresent(id -> record.offer(ListingField.EXTERNAL_ID, id));
        }
        if (ADDRESS_CORE.stream().anyMatch(f -> !record.has(f))) {
            int filled = record.absorb(grammar.extractUrlAddress(url));
            logger.debug("URL address fallback filled {} field(s) for {}", filled, url);
        }
        return record;
    }

    /**
     * Returns true when a title is one of the configured generic captions.
     */
    boolean isPlaceholderTitle(String title) {
        if (title == null) return false;
        String t = title.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\p{Punct}]+$", "");
        return t.isEmpty() || config.placeholderTitles().contains(t);
    }

    private void scrubPlaceholderTitle(PartialFieldMap partial) {
        String title = partial.get(ListingField.TITLE);
        if (title != null && isPlaceholderTitle(title)) {
            logger.debug("Dropping placeholder title '{}'", title);
            partial.remove(ListingField.TITLE);
        }
    }

    /**
     * URLs the page declares for itself: canonical link and {@code og:url}.
     */
    static List<String> selfUrls(ListingDocument document) {
        List<String> urls = new ArrayList<>();
        for (Element link : document.dom().select("link[rel=canonical][href]")) urls.add(link.attr("href"));
        for (Element meta : document.dom().select("meta[property=og:url][content]")) urls.add(meta.attr("content"));
        return urls;
    }

    static void requireValidUrl(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            logger.warn("Extraction requested without a source URL");
            throw new IllegalArgumentException("sourceUrl cannot be null or blank");
        }
        try {
            URI uri = URI.create(sourceUrl.trim());
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new IllegalArgumentException("sourceUrl must be an absolute URL with a host: " + sourceUrl);
            }
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid source URL '{}': {}", sourceUrl, e.getMessage());
            throw new IllegalArgumentException("Invalid sourceUrl: " + sourceUrl, e);
        }
    }
}
