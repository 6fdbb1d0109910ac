package com.realestate.scraper;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-resort source of title, description and primary image, read from Open Graph and Twitter card meta
 * tags and the document title.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class MetaTagExtractor implements FieldExtractor {
    private static final Logger logger = LoggerFactory.getLogger(MetaTagExtractor.class);

    @Override
    public PartialFieldMap extract(ListingDocument document) {
        Document doc = document.dom();
        PartialFieldMap out = new PartialFieldMap();
        out.put(ListingField.TITLE, TextUtils.firstNonBlank(
            meta(doc, "property", "og:title"),
            meta(doc, "name", "twitter:title"),
            doc.title()));
        out.put(ListingField.DESCRIPTION, TextUtils.firstNonBlank(
            meta(doc, "property", "og:description"),
            meta(doc, "name", "twitter:description"),
            meta(doc, "name", "description")));
        String image = TextUtils.firstNonBlank(
            meta(doc, "property", "og:image"),
            meta(doc, "property", "og:image:url"),
            meta(doc, "name", "twitter:image"),
            link(doc, "image_src"));
        out.addMedia(TextUtils.resolveAgainst(document.sourceUrl(), image));
        logger.debug("Meta tags: {} field(s) for {}", out.size(), document.sourceUrl());
        return out;
    }

    private static String meta(Document doc, String attr, String key) {
        Element el = doc.selectFirst("meta[" + attr + "='" + key + "']");
        if (el == null) return null;
        return TextUtils.safe(el.attr("content"));
    }

    private static String link(Document doc, String rel) {
        Element el = doc.selectFirst("link[rel='" + rel + "']");
        if (el == null) return null;
        return TextUtils.safe(el.attr("href"));
    }
}
