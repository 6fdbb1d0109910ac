package com.realestate.sitegrammar;

import com.realestate.scraper.EmbeddedStateExtractor;
import com.realestate.scraper.ExtractionConfig;
import com.realestate.scraper.ListingDocument;
import com.realestate.scraper.PartialFieldMap;
import com.realestate.scraper.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared behavior of host-based site grammars: host matching, id lookup by pattern and embedded-state
 * extraction through the site's script selectors.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public abstract class AbstractSiteGrammar implements SiteGrammar {
    private static final Logger logger = LoggerFactory.getLogger(AbstractSiteGrammar.class);

    private final EmbeddedStateExtractor embeddedState;

    protected AbstractSiteGrammar(ExtractionConfig config) {
        this.embeddedState = new EmbeddedStateExtractor(config);
    }

    /**
     * Registrable domain of the site, e.g. {@code example.com}.
     */
    protected abstract String domain();

    /**
     * Pattern whose first group captures the listing id.
     */
    protected abstract Pattern idPattern();

    @Override
    public boolean detect(String url) {
        String host = TextUtils.hostOf(url);
        return host != null && (host.equals(domain()) || host.endsWith("." + domain()));
    }

    @Override
    public PartialFieldMap extractStructured(ListingDocument document) {
        return embeddedState.extract(document, stateScriptSelectors());
    }

    @Override
    public Optional<String> externalId(String text) {
        if (text == null) return Optional.empty();
        Matcher m = idPattern().matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Splits a URL path into decoded, non-empty segments.
     */
    protected static List<String> pathSegments(String url) {
        List<String> segments = new ArrayList<>();
        for (String raw : TextUtils.pathOf(url).split("/")) {
            if (raw.isEmpty()) continue;
            try {
                segments.add(URLDecoder.decode(raw, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                logger.debug("Keeping undecodable path segment '{}': {}", raw, e.getMessage());
                segments.add(raw);
            }
        }
        return segments;
    }

    /**
     * Joins dash-delimited tokens into a space separated phrase.
     */
    protected static String words(List<String> tokens) {
        return TextUtils.safe(String.join(" ", tokens));
    }
}
