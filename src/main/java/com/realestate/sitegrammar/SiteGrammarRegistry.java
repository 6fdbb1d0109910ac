package com.realestate.sitegrammar;

import com.realestate.scraper.ExtractionConfig;

import java.util.List;

/**
 * Resolves the grammar for a listing URL from its host. Content is never consulted.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class SiteGrammarRegistry {
    private final List<SiteGrammar> grammars;
    private final SiteGrammar fallback;

    public SiteGrammarRegistry(ExtractionConfig config) {
        this(List.of(new ZillowGrammar(config), new RedfinGrammar(config)), new GenericGrammar(config));
    }

    public SiteGrammarRegistry(List<SiteGrammar> grammars, SiteGrammar fallback) {
        this.grammars = List.copyOf(grammars);
        this.fallback = fallback;
    }

    /**
     * Returns the first registered grammar that claims the URL, or the generic fallback.
     */
    public SiteGrammar resolve(String url) {
        for (SiteGrammar grammar : grammars) {
            if (grammar.detect(url)) return grammar;
        }
        return fallback;
    }

    public List<SiteGrammar> grammars() {
        return grammars;
    }
}
