package com.realestate.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts listing fields from serialized state objects embedded in script tags.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Scripts are visited in document order. A script is a payload when it matches one of the site's
 *   state selectors, when its id is a configured payload name, or when it assigns a configured payload name
 *   ({@code window.__INITIAL_STATE__ = {...}}); in the last case the balanced object after the assignment is
 *   sliced out.</li>
 *   <li>Each payload is repaired and parsed with {@link LenientJson}. A payload that does not parse is skipped
 *   and logged at debug level.</li>
 *   <li>Every parsed tree is walked depth-first. Keys known to {@link FieldAliasRegistry} fill the matching
 *   field, and the first occurrence of a field wins. String values that hold serialized JSON are parsed and
 *   walked in place.</li>
 *   <li>Collection keys (photos, agents, price events, similar homes, amenities) are consumed as a unit and
 *   not descended into, so the facts of neighbouring homes never leak into this listing. The first collection
 *   of each kind wins.</li>
 * </ul>
 * Scalar values pass a plausibility gate before they are accepted, so that an unrelated key sharing an alias
 * (an HTTP {@code status: 200}, a two-word {@code state}) does not claim the field.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class EmbeddedStateExtractor implements FieldExtractor {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddedStateExtractor.class);

    private static final int MAX_DEPTH = 128;
    private static final int DESCRIPTION_MIN_LENGTH = 40;
    private static final List<String> WRAPPED_VALUE_KEYS = List.of("value", "amount", "number", "text");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");

    private final ExtractionConfig config;
    private final FieldAliasRegistry aliases;

    public EmbeddedStateExtractor(ExtractionConfig config) {
        this.config = config;
        this.aliases = config.aliases();
    }

    /**
     * Extracts using the state selectors of the document's site grammar.
     */
    @Override
    public PartialFieldMap extract(ListingDocument document) {
        return extract(document, document.grammar().stateScriptSelectors());
    }

    /**
     * Extracts from every payload found with the given selectors or the configured payload names.
     * @param document parsed listing document
     * @param selectors CSS selectors of site-specific state scripts
     * @return fields found, possibly empty
     */
    public PartialFieldMap extract(ListingDocument document, List<String> selectors) {
        PartialFieldMap out = new PartialFieldMap();
        List<JsonNode> payloads = locatePayloads(document, selectors);
        for (JsonNode root : payloads) {
            walk(root, out, document.sourceUrl(), 0);
        }
        logger.debug("Embedded state: {} payload(s), {} field(s) for {}", payloads.size(), out.size(),
            document.sourceUrl());
        return out;
    }

    private List<JsonNode> locatePayloads(ListingDocument document, List<String> selectors) {
        List<JsonNode> roots = new ArrayList<>();
        int index = 0;
        for (Element script : document.dom().select("script")) {
            index++;
            if ("application/ld+json".equalsIgnoreCase(script.attr("type").trim())) continue;
            String data = script.data();
            if (data.isBlank()) continue;
            String origin = describe(script, index);
            if (isStateScript(script, selectors)) {
                Optional<JsonNode> node = LenientJson.tryParse(data, origin);
                if (node.isEmpty()) node = assignedObject(data, null, origin);
                node.ifPresent(roots::add);
                continue;
            }
            for (String name : config.embeddedStatePayloads()) {
                if (data.contains(name)) {
                    assignedObject(data, name, origin).ifPresent(roots::add);
                    break;
                }
            }
        }
        return roots;
    }

    private boolean isStateScript(Element script, List<String> selectors) {
        if (!script.id().isEmpty() && config.embeddedStatePayloads().contains(script.id())) return true;
        for (String selector : selectors) {
            try {
                if (script.is(selector)) return true;
            } catch (Selector.SelectorParseException e) {
                logger.warn("Ignoring invalid state selector '{}': {}", selector, e.getMessage());
            }
        }
        return false;
    }

    /**
     * Slices the object literal assigned to {@code name}, or to the first assignment when name is null.
     */
    private Optional<JsonNode> assignedObject(String data, String name, String origin) {
        int from;
        if (name == null) {
            from = data.indexOf('=');
        } else {
            Matcher m = Pattern.compile(Pattern.quote(name) + "[\"'\\]]*\\s*=").matcher(data);
            from = m.find() ? m.end() : -1;
        }
        if (from < 0) return Optional.empty();
        int start = -1;
        for (int i = from; i < data.length(); i++) {
            char c = data.charAt(i);
            if (c == '{' || c == '[') {
                start = i;
                break;
            }
            if (!Character.isWhitespace(c) && c != '=') break;
        }
        String literal = LenientJson.balancedSlice(data, start);
        if (literal == null) {
            logger.debug("No balanced object literal after assignment in {}", origin);
            return Optional.empty();
        }
        return LenientJson.tryParse(literal, origin);
    }

    private void walk(JsonNode node, PartialFieldMap out, String baseUrl, int depth) {
        if (node == null || depth > MAX_DEPTH) return;
        if (node.isArray()) {
            for (JsonNode item : node) walk(item, out, baseUrl, depth + 1);
            return;
        }
        if (node.isTextual() && LenientJson.looksLikeJson(node.asText())) {
            LenientJson.tryParse(node.asText(), "nested string value")
                .ifPresent(nested -> walk(nested, out, baseUrl, depth + 1));
            return;
        }
        if (!node.isObject()) return;

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (value == null || value.isNull()) continue;

            String collection = aliases.collectionFor(key);
            if (collection != null && (value.isContainerNode() || value.isTextual())) {
                consumeCollection(collection, value, out, baseUrl);
                continue;
            }
            ListingField field = aliases.fieldFor(key);
            if (field != null) {
                String scalar = scalarText(value);
                if (scalar != null) {
                    if (!out.has(field) && plausible(field, scalar)) out.put(field, scalar);
                    continue;
                }
            }
            if (value.isContainerNode() || value.isTextual()) walk(value, out, baseUrl, depth + 1);
        }
    }

    private void consumeCollection(String collection, JsonNode value, PartialFieldMap out, String baseUrl) {
        switch (collection) {
            case FieldAliasRegistry.MEDIA -> {
                if (!out.media().isEmpty()) return;
                for (JsonNode item : items(value)) {
                    String url = item.isTextual() ? item.asText() : findUrl(item, FieldAliasRegistry.MEDIA_URL, 0);
                    if (url != null && !url.isBlank()) out.addMedia(TextUtils.resolveAgainst(baseUrl, url));
                }
            }
            case FieldAliasRegistry.AGENTS -> {
                if (!out.agents().isEmpty()) return;
                for (JsonNode item : items(value)) {
                    if (item.isTextual()) {
                        out.addAgent(new AgentContact(item.asText(), null, null, null));
                    } else if (item.isObject()) {
                        out.addAgent(new AgentContact(
                            child(item, FieldAliasRegistry.AGENT_NAME),
                            child(item, FieldAliasRegistry.AGENT_PHONE),
                            child(item, FieldAliasRegistry.AGENT_BROKERAGE),
                            child(item, FieldAliasRegistry.AGENT_EMAIL)));
                    }
                }
            }
            case FieldAliasRegistry.PRICE_HISTORY -> {
                if (!out.priceHistory().isEmpty()) return;
                for (JsonNode item : items(value)) {
                    if (!item.isObject()) continue;
                    BigDecimal price = ValueCoercion.toDecimal(child(item, FieldAliasRegistry.EVENT_PRICE));
                    out.addPriceEvent(new PriceEvent(
                        child(item, FieldAliasRegistry.EVENT_DATE),
                        child(item, FieldAliasRegistry.EVENT_TYPE),
                        price,
                        child(item, FieldAliasRegistry.EVENT_NOTES)));
                }
            }
            case FieldAliasRegistry.SIMILAR -> {
                if (!out.similarUrls().isEmpty()) return;
                for (JsonNode item : items(value)) {
                    if (out.similarUrls().size() >= config.maxSimilarUrls()) break;
                    String url = item.isTextual() ? item.asText() : child(item, FieldAliasRegistry.SIMILAR_URL);
                    if (url != null) out.addSimilarUrl(TextUtils.resolveAgainst(baseUrl, url));
                }
            }
            case FieldAliasRegistry.AMENITIES -> {
                if (!out.amenities().isEmpty()) return;
                for (JsonNode item : items(value)) {
                    out.addAmenity(item.isObject() ? scalarText(item) : item.asText(null));
                }
            }
            default -> logger.debug("Unhandled collection group '{}'", collection);
        }
    }

    /**
     * Iterates array elements, object values, or a single value.
     */
    private static List<JsonNode> items(JsonNode value) {
        List<JsonNode> list = new ArrayList<>();
        if (value.isArray() || (value.isObject() && !looksLikeSingleItem(value))) {
            value.elements().forEachRemaining(list::add);
        } else {
            list.add(value);
        }
        return list;
    }

    private static boolean looksLikeSingleItem(JsonNode value) {
        Iterator<JsonNode> it = value.elements();
        while (it.hasNext()) {
            if (it.next().isValueNode()) return true;
        }
        return false;
    }

    /**
     * Returns the first scalar child under any key of the group, matched case-insensitively.
     */
    private String child(JsonNode item, String group) {
        for (String key : aliases.group(group)) {
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                if (!e.getKey().equalsIgnoreCase(key)) continue;
                String text = scalarText(e.getValue());
                if (text != null) return text;
            }
        }
        return null;
    }

    private String findUrl(JsonNode item, String group, int depth) {
        if (item == null || depth > 6) return null;
        if (item.isObject()) {
            String direct = child(item, group);
            if (direct != null) return direct;
        }
        if (item.isContainerNode()) {
            for (JsonNode nested : item) {
                String url = findUrl(nested, group, depth + 1);
                if (url != null) return url;
            }
        }
        return null;
    }

    /**
     * Returns the text of a scalar node, or of the wrapped scalar of a {"value": ...} style object.
     */
    private static String scalarText(JsonNode value) {
        if (value == null || value.isNull() || value.isBoolean()) return null;
        if (value.isTextual() || value.isNumber()) {
            String text = value.asText();
            return text.isBlank() ? null : text;
        }
        if (value.isObject()) {
            for (String key : WRAPPED_VALUE_KEYS) {
                JsonNode wrapped = value.get(key);
                if (wrapped != null && (wrapped.isTextual() || wrapped.isNumber())) return wrapped.asText();
            }
            JsonNode name = value.get("name");
            if (name != null && name.isTextual()) return name.asText();
        }
        return null;
    }

    private static boolean plausible(ListingField field, String raw) {
        String s = raw.trim();
        return switch (field) {
            case STATE -> s.matches("[A-Za-z]{2}");
            case POSTAL_CODE -> s.matches("\\d{3,5}(-\\d{4})?");
            case YEAR_BUILT -> {
                Integer year = ValueCoercion.toInteger(s);
                yield year != null && year >= 1700 && year <= 2100;
            }
            case LATITUDE -> inRange(ValueCoercion.toCoordinate(s), 90);
            case LONGITUDE -> inRange(ValueCoercion.toCoordinate(s), 180);
            case STATUS -> ListingStatus.fromText(s) != ListingStatus.UNKNOWN;
            case STREET, CITY, PROPERTY_TYPE, PROPERTY_SUBTYPE, CONDITION -> LETTER.matcher(s).find();
            case DESCRIPTION -> s.length() >= DESCRIPTION_MIN_LENGTH;
            case EXTERNAL_ID -> s.matches("[A-Za-z0-9_-]+");
            case LIST_DATE -> s.matches(".*\\d.*");
            default -> switch (field.kind()) {
                case DECIMAL, INTEGER -> {
                    BigDecimal d = ValueCoercion.toDecimal(s);
                    yield d != null && (d.signum() > 0 || field == ListingField.BEDS);
                }
                default -> true;
            };
        };
    }

    private static boolean inRange(BigDecimal coordinate, int bound) {
        return coordinate != null && coordinate.signum() != 0 && coordinate.abs().compareTo(BigDecimal.valueOf(bound)) <= 0;
    }

    private static String describe(Element script, int index) {
        return script.id().isEmpty() ? "script[" + index + "]" : "script#" + script.id();
    }
}
