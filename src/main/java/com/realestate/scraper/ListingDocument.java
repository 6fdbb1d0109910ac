package com.realestate.scraper;

import com.realestate.sitegrammar.SiteGrammar;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * One fetched listing document, parsed once and shared by every extraction stage of a run.
 *
 * @param sourceUrl the listing URL the document was fetched from
 * @param grammar the site grammar resolved from the URL host
 * @param renderedText optional pre-rendered text or markdown companion (may be null)
 * @param dom jsoup tree of the raw markup, with {@code sourceUrl} as base URI
 * @param text line-structured text used by the heuristic probes
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public record ListingDocument(
    String sourceUrl,
    SiteGrammar grammar,
    String renderedText,
    Document dom,
    String text
) {
    private static final String BLOCK_TAGS =
        "br, p, div, li, ul, ol, h1, h2, h3, h4, h5, h6, tr, section, article, header, footer, dt, dd";

    /**
     * Parses the markup and derives the heuristic text.
     * <p>
     * The rendered companion is preferred as text source when present; otherwise the body text is used with
     * a line break after each block element.
     */
    public static ListingDocument of(String sourceUrl, SiteGrammar grammar, String html, String renderedText) {
        String markup = html == null ? "" : html;
        Document dom = Jsoup.parse(markup, sourceUrl);
        String text = TextUtils.isBlank(renderedText) ? blockText(dom) : renderedText;
        return new ListingDocument(sourceUrl, grammar, renderedText, dom, text);
    }

    private static String blockText(Document dom) {
        Element body = dom.body().clone();
        body.select("script, style, noscript, template").remove();
        for (Element e : body.select(BLOCK_TAGS)) {
            e.after(new TextNode("\n"));
        }
        return body.wholeText()
            .replace('\u00A0', ' ')
            .replaceAll("[ \\t\\x0B\\f\\r]+", " ")
            .replaceAll(" *\\n[ \\n]*", "\n")
            .trim();
    }
}
