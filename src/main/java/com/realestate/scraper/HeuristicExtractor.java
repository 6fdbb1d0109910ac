package com.realestate.scraper;

import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction from rendered text and DOM for pages without usable structured data.
 * <p>
 * Probes run in a fixed order and each one is isolated: a probe that fails is logged at debug level and
 * contributes nothing. Text probes read the rendered companion when one was supplied, otherwise the body
 * text with one line per block element.
 * <p>
 * Notable policies:
 * <ul>
 *   <li>Price: the largest currency amount on the page wins, since smaller amounts are usually monthly or
 *   fee figures.</li>
 *   <li>Status keywords are only trusted near the top of the page; an explicit "Status:" label is trusted
 *   anywhere.</li>
 *   <li>A monthly property-tax figure is annualized when no annual amount is stated.</li>
 * </ul>
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class HeuristicExtractor implements FieldExtractor {
    private static final Logger logger = LoggerFactory.getLogger(HeuristicExtractor.class);

    private static final int STATUS_SCAN_LIMIT = 2000;
    private static final int DESCRIPTION_MIN_LENGTH = 40;
    private static final BigDecimal SQFT_PER_ACRE = new BigDecimal("43560");
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private static final Pattern PRICE = Pattern.compile("\\$\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d{2})?");
    private static final Pattern BEDS = Pattern.compile(
        "(\\d+(?:\\.\\d+)?)\\s*\\**\\s*(?:beds?|bd|bedrooms?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BATHS = Pattern.compile(
        "(\\d+(?:\\.\\d+)?)\\s*\\**\\s*(?:baths?|ba|bathrooms?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AREA = Pattern.compile(
        "(\\d{1,3}(?:,\\d{3})+|\\d+)\\s*\\**\\s*(?:sq\\.?\\s?ft|square feet)\\b(?!\\s*lot)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOT = Pattern.compile(
        "(?:lot size\\s*:?\\s*\\**\\s*([\\d,.]+)\\s*(acres?|sq\\.?\\s?ft))|(?:([\\d,.]+)\\s*(acres?|sq\\.?\\s?ft)\\s+lot)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern ADDRESS = Pattern.compile(
        "(\\d+[ \\t]+[A-Za-z0-9 .#\\-]+?),[ \\t]*([A-Za-z .'\\-]+?),[ \\t]*([A-Z]{2})[ \\t]+(\\d{5})(?:-\\d{4})?\\b");
    private static final Pattern UNIT_SUFFIX = Pattern.compile(
        "^(.*?)\\s+((?:apt|unit|ste|suite)\\.?\\s*[\\w-]+|#\\s*[\\w-]+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BUILT = Pattern.compile("Built in\\s*\\**\\s*(\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROPERTY_TYPE = Pattern.compile(
        "\\b(Single Family Residence|Single[- ]Family|Condominium|Condo|Townhouse|Townhome|Multi[- ]?Family"
            + "|Apartment|Manufactured|Mobile Home|Vacant Land)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_LABEL = Pattern.compile(
        "(?:Listing status|Status)\\s*:\\s*\\**\\s*([A-Za-z][A-Za-z -]{2,30})", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_KEYWORD = Pattern.compile(
        "\\b(For sale|Active|Pending|Contingent|Under contract|Sold|Off market|Withdrawn|Coming soon)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern DESCRIPTION_SECTION = Pattern.compile(
        "##\\s*(?:What's special|Description|About this home|Overview)[^\\n]*\\n+([\\s\\S]+?)(?:\\n##|\\z)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern DAYS_ON = Pattern.compile(
        "(?:\\**([\\d,]+)\\**\\s*days?\\s+on\\s+(?:zillow|redfin|market|site))|(?:days on (?:market|zillow|redfin)\\s*:?\\s*\\**([\\d,]+))",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern VIEWS = Pattern.compile("\\**([\\d,]+)\\**\\s*views?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAVES = Pattern.compile(
        "\\**([\\d,]+)\\**\\s*(?:saves?|favorites?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHARES = Pattern.compile("\\**([\\d,]+)\\**\\s*shares?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOA = Pattern.compile(
        "HOA(?: fees?| dues)?\\s*:?\\s*\\**\\s*\\$\\s?([\\d,]+(?:\\.\\d{2})?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANNUAL_TAX = Pattern.compile(
        "(?:Annual tax amount|Property taxes? \\(annual\\)|Annual property tax(?:es)?)\\s*:?\\s*\\**\\s*\\$\\s?([\\d,]+(?:\\.\\d{2})?)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTHLY_COST_SECTION = Pattern.compile(
        "##\\s*Monthly cost[\\s\\S]+?(?:\\n##|\\z)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UTILITIES = Pattern.compile("Utilities\\s*:?\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WALK_SCORE = score("Walk");
    private static final Pattern TRANSIT_SCORE = score("Transit");
    private static final Pattern BIKE_SCORE = score("Bike");
    private static final Pattern AGENT_LINE = Pattern.compile(
        "(?:^|\\n)\\s*(?:Listing by|Listed by)\\s*:?\\s*(.+?)(?:\\n|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGENT_SECTION = Pattern.compile(
        "##\\s*Agent information[\\s\\S]+?(?:\\n##|\\z)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile(
        "(?:\\+?1[\\s\\-.]?)?\\(?\\d{3}\\)?[\\s\\-.]?\\d{3}[\\s\\-.]?\\d{4}");
    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)+");
    private static final Pattern PRICE_HISTORY_SECTION = Pattern.compile(
        "##\\s*Price history[\\s\\S]+?(?:\\n##|\\z)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*\\]\\((\\S+?)(?:\\s+\"[^\"]*\")?\\)");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("(?<!!)\\[[^\\]]*\\]\\((https?://[^)\\s]+)\\)");
    private static final List<String> IMAGE_ATTRS = List.of("src", "data-src", "data-lazy-src", "data-original");

    private final ExtractionConfig config;

    public HeuristicExtractor(ExtractionConfig config) {
        this.config = config;
    }

    @Override
    public PartialFieldMap extract(ListingDocument document) {
        PartialFieldMap out = new PartialFieldMap();
        String text = document.text() == null ? "" : document.text();

        probe("price", document, () -> out.put(ListingField.LIST_PRICE, maxPrice(text)));
        probe("beds", document, () -> out.put(ListingField.BEDS, group(BEDS, text, 1)));
        probe("baths", document, () -> out.put(ListingField.BATHS, group(BATHS, text, 1)));
        probe("area", document, () -> out.put(ListingField.INTERIOR_AREA, group(AREA, text, 1)));
        probe("lot", document, () -> out.put(ListingField.LOT_SIZE, lotSize(text)));
        probe("address", document, () -> address(text, out));
        probe("built", document, () -> out.put(ListingField.YEAR_BUILT, group(BUILT, text, 1)));
        probe("type", document, () -> out.put(ListingField.PROPERTY_TYPE, group(PROPERTY_TYPE, text, 1)));
        probe("status", document, () -> out.put(ListingField.STATUS, status(text)));
        probe("description", document, () -> out.put(ListingField.DESCRIPTION, description(document, text)));
        probe("days", document, () -> out.put(ListingField.DAYS_ON_MARKET, daysOnMarket(text)));
        probe("engagement", document, () -> {
            out.put(ListingField.VIEWS, group(VIEWS, text, 1));
            out.put(ListingField.SAVES, group(SAVES, text, 1));
            out.put(ListingField.SHARES, group(SHARES, text, 1));
        });
        probe("annual-tax", document, () -> out.put(ListingField.ANNUAL_PROPERTY_TAX, group(ANNUAL_TAX, text, 1)));
        probe("monthly-cost", document, () -> monthlyCosts(text, out));
        probe("hoa", document, () -> out.put(ListingField.HOA_FEE, group(HOA, text, 1)));
        probe("scores", document, () -> {
            out.put(ListingField.WALK_SCORE, group(WALK_SCORE, text, 1));
            out.put(ListingField.TRANSIT_SCORE, group(TRANSIT_SCORE, text, 1));
            out.put(ListingField.BIKE_SCORE, group(BIKE_SCORE, text, 1));
        });
        probe("agent", document, () -> out.addAgent(agent(document, text)));
        probe("price-history", document, () -> priceHistory(text).forEach(out::addPriceEvent));
        probe("images", document, () -> images(document).forEach(out::addMedia));
        probe("similar", document, () -> similar(document).forEach(out::addSimilarUrl));

        logger.debug("Heuristics: {} field(s) for {}", out.size(), document.sourceUrl());
        return out;
    }

    private static void probe(String name, ListingDocument document, Runnable probe) {
        try {
            probe.run();
        } catch (RuntimeException e) {
            logger.debug("Heuristic probe '{}' failed for {}: {}", name, document.sourceUrl(), e.getMessage());
        }
    }

    /**
     * Returns the largest currency amount in the text, as a plain number string.
     */
    static String maxPrice(String text) {
        BigDecimal best = null;
        Matcher m = PRICE.matcher(text);
        while (m.find()) {
            BigDecimal value = ValueCoercion.toDecimal(m.group(1));
            if (value != null && (best == null || value.compareTo(best) > 0)) best = value;
        }
        return best == null ? null : best.toPlainString();
    }

    private static String lotSize(String text) {
        Matcher m = LOT.matcher(text);
        if (!m.find()) return null;
        String amount = m.group(1) != null ? m.group(1) : m.group(3);
        String unit = m.group(2) != null ? m.group(2) : m.group(4);
        BigDecimal value = ValueCoercion.toDecimal(amount);
        if (value == null) return null;
        if (unit.toLowerCase(Locale.ROOT).startsWith("acre")) value = value.multiply(SQFT_PER_ACRE);
        return value.stripTrailingZeros().toPlainString();
    }

    private static void address(String text, PartialFieldMap out) {
        Matcher m = ADDRESS.matcher(text);
        if (!m.find()) return;
        String street = TextUtils.collapseWhitespace(m.group(1));
        Matcher unit = UNIT_SUFFIX.matcher(street);
        if (unit.matches()) {
            out.put(ListingField.STREET, unit.group(1));
            out.put(ListingField.UNIT, unit.group(2));
        } else {
            out.put(ListingField.STREET, street);
        }
        out.put(ListingField.CITY, m.group(2));
        out.put(ListingField.STATE, m.group(3));
        out.put(ListingField.POSTAL_CODE, m.group(4));
    }

    private static String status(String text) {
        String labelled = group(STATUS_LABEL, text, 1);
        if (labelled != null && ListingStatus.fromText(labelled) != ListingStatus.UNKNOWN) return labelled;
        String head = text.length() > STATUS_SCAN_LIMIT ? text.substring(0, STATUS_SCAN_LIMIT) : text;
        return group(STATUS_KEYWORD, head, 1);
    }

    private String description(ListingDocument document, String text) {
        String section = group(DESCRIPTION_SECTION, text, 1);
        if (section != null) return section;
        for (String selector : config.descriptionSelectors()) {
            Element el = document.dom().selectFirst(selector);
            if (el == null) continue;
            String value = TextUtils.collapseWhitespace(el.text());
            if (value != null && value.length() >= DESCRIPTION_MIN_LENGTH) return value;
        }
        return null;
    }

    private static String daysOnMarket(String text) {
        Matcher m = DAYS_ON.matcher(text);
        if (!m.find()) return null;
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    private static void monthlyCosts(String text, PartialFieldMap out) {
        Matcher section = MONTHLY_COST_SECTION.matcher(text);
        if (!section.find()) return;
        String block = section.group();
        out.put(ListingField.PRINCIPAL_INTEREST, labelledAmount(block, "Principal (?:&|and) interest"));
        out.put(ListingField.MORTGAGE_INSURANCE, labelledAmount(block, "Mortgage insurance"));
        out.put(ListingField.HOME_INSURANCE, labelledAmount(block, "Home(?:owners)? insurance"));
        out.put(ListingField.HOA_FEE, labelledAmount(block, "HOA fees?"));
        if (!out.has(ListingField.ANNUAL_PROPERTY_TAX)) {
            BigDecimal monthly = ValueCoercion.toDecimal(labelledAmount(block, "Property taxes"));
            if (monthly != null) out.put(ListingField.ANNUAL_PROPERTY_TAX, monthly.multiply(MONTHS_PER_YEAR).toPlainString());
        }
        String utilities = group(UTILITIES, block, 1);
        if (utilities != null && !utilities.contains("$")) out.put(ListingField.UTILITIES, utilities);
    }

    private static String labelledAmount(String block, String label) {
        Matcher m = Pattern.compile(label + "\\s*:?\\s*\\**\\s*\\$\\s?([\\d,]+(?:\\.\\d{2})?)", Pattern.CASE_INSENSITIVE)
            .matcher(block);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Locates the agent text, from agent containers first, then a "Listed by" line, then an
     * "Agent information" section.
     */
    private AgentContact agent(ListingDocument document, String text) {
        for (String selector : config.agentSelectors()) {
            for (Element el : document.dom().select(selector)) {
                AgentContact contact = parseAgentLine(el.text());
                if (contact != null) return contact;
            }
        }
        Matcher line = AGENT_LINE.matcher(text);
        if (line.find()) return parseAgentLine(line.group(1));
        Matcher section = AGENT_SECTION.matcher(text);
        if (section.find()) {
            for (String ln : section.group().split("\\n")) {
                String trimmed = ln.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("##")) return parseAgentLine(trimmed);
            }
        }
        return null;
    }

    /**
     * Splits one agent line into brokerage (left of the phone number) and agent name (right of it). Without a
     * phone number the line is split on a dash or pipe delimiter instead.
     * @param raw agent text (may be null)
     * @return the contact, or null if the text carries nothing
     */
    static AgentContact parseAgentLine(String raw) {
        String line = TextUtils.collapseWhitespace(raw);
        if (line == null) return null;
        line = line.replaceFirst("(?i)^(?:Listing by|Listed by)\\s*:?\\s*", "");
        String email = group(EMAIL, line, 0);
        if (email != null) line = line.replace(email, " ");
        String brokerage;
        String name = null;
        String phone = group(PHONE, line, 0);
        if (phone != null) {
            int at = line.indexOf(phone);
            brokerage = trimDecoration(line.substring(0, at));
            name = trimDecoration(line.substring(at + phone.length()));
            phone = TextUtils.safe(phone);
        } else {
            String[] chunks = line.split("\\s[-\u2013|]\\s");
            brokerage = trimDecoration(chunks[0]);
            if (chunks.length > 1) name = trimDecoration(chunks[1]);
        }
        if (brokerage != null) brokerage = TextUtils.safe(brokerage.replaceFirst("(?i)^(?:at|with|from)\\s+", ""));
        AgentContact contact = new AgentContact(name, phone, brokerage, email);
        return contact.isEmpty() ? null : contact;
    }

    private static String trimDecoration(String s) {
        if (s == null) return null;
        return TextUtils.safe(s.replaceAll("^[\\s\\-\u2013|\u2022()\u00b7,]+|[\\s\\-\u2013|\u2022()\u00b7,]+$", ""));
    }

    /**
     * Pairs each long-form date with the first currency amount that follows it within the configured window
     * and before the next date. The text between the date and the amount is kept as the raw event type.
     */
    List<PriceEvent> priceHistory(String text) {
        Matcher section = PRICE_HISTORY_SECTION.matcher(text);
        String scope = section.find() ? section.group() : text;
        List<PriceEvent> events = new ArrayList<>();
        Matcher date = ValueCoercion.LONG_DATE.matcher(scope);
        List<int[]> spans = new ArrayList<>();
        List<String> dates = new ArrayList<>();
        while (date.find()) {
            String iso;
            try {
                iso = ValueCoercion.fromLongDateMatch(date);
            } catch (RuntimeException e) {
                logger.debug("Skipping invalid history date '{}': {}", date.group(), e.getMessage());
                continue;
            }
            spans.add(new int[] {date.start(), date.end()});
            dates.add(iso);
        }
        for (int i = 0; i < spans.size(); i++) {
            int from = spans.get(i)[1];
            int limit = Math.min(scope.length(), from + config.priceHistoryWindow());
            if (i + 1 < spans.size()) limit = Math.min(limit, spans.get(i + 1)[0]);
            String window = scope.substring(from, limit);
            Matcher price = PRICE.matcher(window);
            if (!price.find()) continue;
            String kind = TextUtils.collapseWhitespace(window.substring(0, price.start()).replaceAll("[*|#]", " "));
            events.add(new PriceEvent(dates.get(i), kind, ValueCoercion.toDecimal(price.group(1)), null));
        }
        return events;
    }

    private List<String> images(ListingDocument document) {
        List<String> urls = new ArrayList<>();
        for (Element el : document.dom().select("img, source")) {
            for (String attr : IMAGE_ATTRS) addImage(urls, document.sourceUrl(), el.attr(attr));
            String srcset = el.attr("srcset");
            if (!srcset.isBlank()) {
                for (String candidate : srcset.split(",")) {
                    addImage(urls, document.sourceUrl(), candidate.trim().split("\\s+")[0]);
                }
            }
        }
        if (!TextUtils.isBlank(document.renderedText())) {
            Matcher m = MARKDOWN_IMAGE.matcher(document.renderedText());
            while (m.find()) addImage(urls, document.sourceUrl(), m.group(1));
        }
        return urls.size() > config.maxImageCandidates() ? urls.subList(0, config.maxImageCandidates()) : urls;
    }

    private static void addImage(List<String> urls, String base, String raw) {
        if (TextUtils.isBlank(raw) || raw.startsWith("data:")) return;
        String url = TextUtils.resolveAgainst(base, raw);
        if (url != null && url.startsWith("http") && !urls.contains(url)) urls.add(url);
    }

    private List<String> similar(ListingDocument document) {
        List<String> urls = new ArrayList<>();
        String self = stripQuery(document.sourceUrl());
        List<String> hrefs = new ArrayList<>();
        for (Element a : document.dom().select("a[href]")) hrefs.add(a.attr("href"));
        if (!TextUtils.isBlank(document.renderedText())) {
            Matcher m = MARKDOWN_LINK.matcher(document.renderedText());
            while (m.find()) hrefs.add(m.group(1));
        }
        for (String href : hrefs) {
            if (urls.size() >= config.maxSimilarUrls()) break;
            String url = TextUtils.resolveAgainst(document.sourceUrl(), href);
            if (url == null || !document.grammar().isListingUrl(url)) continue;
            if (stripQuery(url).equals(self) || urls.contains(url)) continue;
            urls.add(url);
        }
        return urls;
    }

    private static String stripQuery(String url) {
        String s = url.replaceAll("[?#].*$", "");
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String group(Pattern pattern, String text, int group) {
        if (text == null) return null;
        Matcher m = pattern.matcher(text);
        return m.find() ? TextUtils.safe(m.group(group)) : null;
    }

    private static Pattern score(String label) {
        return Pattern.compile(label + "\\s*Score[\u00ae\u2122]?\\s*:?\\s*\\**\\s*(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE);
    }
}
