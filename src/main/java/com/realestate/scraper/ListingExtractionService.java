package com.realestate.scraper;

import com.realestate.sitegrammar.SiteGrammarRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Entry point of the extraction engine.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link CascadeMerger} runs the extraction stages in priority order into one record.</li>
 *   <li>{@link ListingNormalizer} coerces values and computes the stable identifiers.</li>
 *   <li>{@link ImageQualityResolver} filters, upgrades and deduplicates the media list.</li>
 *   <li>{@link TableProjector} expands the record into the relational row set.</li>
 * </ul>
 * Fetching documents and persisting rows belong to the caller; see {@link TableExportService} for writing
 * a row set to disk.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class ListingExtractionService implements ListingExtractionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ListingExtractionService.class);

    private final SiteGrammarRegistry registry;
    private final CascadeMerger merger;
    private final ListingNormalizer normalizer;
    private final ImageQualityResolver mediaResolver;
    private final TableProjector projector;

    /**
     * Creates a service configured from the bundled defaults plus environment and system property overrides.
     */
    public ListingExtractionService() {
        this(ExtractionConfig.load(), Clock.systemUTC());
    }

    public ListingExtractionService(ExtractionConfig config, Clock clock) {
        this.registry = new SiteGrammarRegistry(config);
        this.merger = new CascadeMerger(config, registry);
        this.normalizer = new ListingNormalizer(config, registry);
        this.mediaResolver = new ImageQualityResolver(config);
        this.projector = new TableProjector(clock);
    }

    @Override
    public CanonicalRecord extract(String sourceUrl, String html, String renderedText) {
        CanonicalRecord merged = merger.merge(sourceUrl, html, renderedText);
        CanonicalRecord normalized = normalizer.normalize(merged);
        CanonicalRecord resolved = normalized.withMedia(
            mediaResolver.resolve(normalized.media(), registry.resolve(normalized.sourceUrl())));
        logger.info("Extracted {} listing {} ({} field(s), {} image(s))", resolved.sourceId().code(),
            resolved.listingId(), resolved.values().size(), resolved.media().size());
        return resolved;
    }

    @Override
    public RowSet process(String sourceUrl, String html, String renderedText) {
        return projector.project(extract(sourceUrl, html, renderedText));
    }
}
