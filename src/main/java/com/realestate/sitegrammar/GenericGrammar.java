package com.realestate.sitegrammar;

import com.realestate.scraper.EmbeddedStateExtractor;
import com.realestate.scraper.ExtractionConfig;
import com.realestate.scraper.ListingDocument;
import com.realestate.scraper.PartialFieldMap;
import com.realestate.scraper.SourceId;

import java.util.List;
import java.util.Optional;

/**
 * Fallback grammar for hosts no registered grammar claims.
 * <p>
 * It still looks for the common named state payloads, but has no URL address grammar, no id pattern and no
 * image upgrade rules.
 */
public class GenericGrammar implements SiteGrammar {
    private final EmbeddedStateExtractor embeddedState;

    public GenericGrammar(ExtractionConfig config) {
        this.embeddedState = new EmbeddedStateExtractor(config);
    }

    @Override
    public SourceId sourceId() {
        return SourceId.UNKNOWN;
    }

    @Override
    public boolean detect(String url) {
        return true;
    }

    @Override
    public PartialFieldMap extractStructured(ListingDocument document) {
        return embeddedState.extract(document, stateScriptSelectors());
    }

    @Override
    public PartialFieldMap extractUrlAddress(String url) {
        return new PartialFieldMap();
    }

    @Override
    public Optional<String> externalId(String text) {
        return Optional.empty();
    }

    @Override
    public boolean isListingUrl(String url) {
        return false;
    }

    @Override
    public List<String> stateScriptSelectors() {
        return List.of();
    }
}
