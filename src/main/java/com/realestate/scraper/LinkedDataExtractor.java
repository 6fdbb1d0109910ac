package com.realestate.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extracts listing fields from {@code application/ld+json} blocks using the schema.org vocabulary.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every linked-data script is parsed on its own; a block that does not parse is skipped.</li>
 *   <li>Blocks are flattened: top-level arrays, {@code @graph} containers and nested {@code mainEntity},
 *   {@code itemOffered} and {@code about} objects all become separate nodes.</li>
 *   <li>Site chrome nodes (organization, web site, breadcrumbs) are ignored. Agent and person nodes become
 *   agent contacts; every other node contributes listing candidates.</li>
 *   <li>Candidates for the same field from different nodes are settled by {@link CandidateResolver}.</li>
 * </ul>
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class LinkedDataExtractor implements FieldExtractor {
    private static final Logger logger = LoggerFactory.getLogger(LinkedDataExtractor.class);

    private static final Set<String> IGNORED_TYPES = Set.of(
        "organization", "website", "webpage", "breadcrumblist", "searchaction", "sitenavigationelement",
        "imageobject", "videoobject", "faqpage");
    private static final Set<String> AGENT_TYPES = Set.of("realestateagent", "person");
    private static final Set<String> RESIDENCE_TYPES = Set.of(
        "singlefamilyresidence", "house", "apartment", "condominium", "townhouse", "residence", "mobilehome");
    private static final List<String> NESTED_ENTITY_KEYS = List.of("mainEntity", "itemOffered", "about");
    private static final BigDecimal SQFT_PER_ACRE = new BigDecimal("43560");

    private final CandidateResolver resolver;

    public LinkedDataExtractor() {
        this(new CandidateResolver());
    }

    public LinkedDataExtractor(CandidateResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public PartialFieldMap extract(ListingDocument document) {
        List<JsonNode> nodes = new ArrayList<>();
        int index = 0;
        for (Element script : document.dom().select("script[type=application/ld+json]")) {
            index++;
            LenientJson.tryParse(script.data(), "ld+json block " + index)
                .ifPresent(root -> flatten(root, nodes, 0));
        }

        Map<ListingField, List<String>> candidates = new EnumMap<>(ListingField.class);
        PartialFieldMap out = new PartialFieldMap();
        for (JsonNode node : nodes) {
            try {
                Set<String> types = types(node);
                if (types.stream().anyMatch(IGNORED_TYPES::contains)) continue;
                if (types.stream().anyMatch(AGENT_TYPES::contains)) {
                    out.addAgent(agentOf(node));
                    continue;
                }
                collectListing(node, types, candidates, out, document.sourceUrl());
            } catch (RuntimeException e) {
                logger.debug("Skipping ld+json node of {}: {}", document.sourceUrl(), e.getMessage());
            }
        }
        for (Map.Entry<ListingField, List<String>> e : candidates.entrySet()) {
            out.put(e.getKey(), resolver.resolve(e.getKey(), e.getValue()).value());
        }
        logger.debug("Linked data: {} node(s), {} field(s) for {}", nodes.size(), out.size(), document.sourceUrl());
        return out;
    }

    private static void flatten(JsonNode node, List<JsonNode> nodes, int depth) {
        if (node == null || depth > 8) return;
        if (node.isArray()) {
            for (JsonNode item : node) flatten(item, nodes, depth + 1);
            return;
        }
        if (!node.isObject()) return;
        JsonNode graph = node.get("@graph");
        if (graph != null) flatten(graph, nodes, depth + 1);
        if (node.has("@type")) nodes.add(node);
        for (String key : NESTED_ENTITY_KEYS) {
            JsonNode nested = node.get(key);
            if (nested != null && nested.isContainerNode()) flatten(nested, nodes, depth + 1);
        }
        for (JsonNode offer : asList(node.get("offers"))) {
            JsonNode item = offer.get("itemOffered");
            if (item != null && item.isContainerNode()) flatten(item, nodes, depth + 1);
        }
    }

    private static Set<String> types(JsonNode node) {
        JsonNode type = node.get("@type");
        List<String> names = new ArrayList<>();
        if (type != null && type.isArray()) {
            type.forEach(t -> names.add(t.asText()));
        } else if (type != null) {
            names.add(type.asText());
        }
        return Set.copyOf(names.stream().map(n -> n.toLowerCase(Locale.ROOT)).toList());
    }

    private void collectListing(JsonNode node, Set<String> types, Map<ListingField, List<String>> candidates,
                                PartialFieldMap out, String baseUrl) {
        JsonNode address = node.get("address");
        if (address != null && address.isObject()) {
            add(candidates, ListingField.STREET, text(address, "streetAddress"));
            add(candidates, ListingField.CITY, text(address, "addressLocality"));
            add(candidates, ListingField.STATE, text(address, "addressRegion"));
            add(candidates, ListingField.POSTAL_CODE, text(address, "postalCode"));
        }
        JsonNode geo = node.get("geo");
        if (geo != null && geo.isObject()) {
            add(candidates, ListingField.LATITUDE, text(geo, "latitude"));
            add(candidates, ListingField.LONGITUDE, text(geo, "longitude"));
        }

        add(candidates, ListingField.LIST_PRICE, text(node, "price"));
        for (JsonNode offer : asList(node.get("offers"))) {
            add(candidates, ListingField.LIST_PRICE, text(offer, "price"));
            JsonNode priceSpec = offer.get("priceSpecification");
            if (priceSpec != null) add(candidates, ListingField.LIST_PRICE, text(priceSpec, "price"));
            JsonNode seller = offer.get("seller");
            if (seller != null && seller.isObject()) out.addAgent(agentOf(seller));
        }

        String bedrooms = text(node, "numberOfBedrooms");
        add(candidates, ListingField.BEDS, bedrooms != null ? bedrooms : text(node, "numberOfRooms"));
        String baths = text(node, "numberOfBathroomsTotal");
        add(candidates, ListingField.BATHS, baths != null ? baths : text(node, "numberOfFullBathrooms"));
        add(candidates, ListingField.INTERIOR_AREA, quantity(node.get("floorSize"), false));
        add(candidates, ListingField.LOT_SIZE, quantity(node.get("lotSize"), true));
        add(candidates, ListingField.YEAR_BUILT, text(node, "yearBuilt"));
        add(candidates, ListingField.LIST_DATE, text(node, "datePosted"));
        add(candidates, ListingField.DESCRIPTION, text(node, "description"));
        add(candidates, ListingField.TITLE, text(node, "name"));
        add(candidates, ListingField.PROPERTY_TYPE, text(node, "accommodationCategory"));
        for (String type : types) {
            if (RESIDENCE_TYPES.contains(type)) add(candidates, ListingField.PROPERTY_TYPE, spaced(node, type));
        }

        for (JsonNode image : asList(node.get("image"))) {
            String url = image.isTextual() ? image.asText() : TextUtils.firstNonBlank(text(image, "url"),
                text(image, "contentUrl"));
            if (url != null) out.addMedia(TextUtils.resolveAgainst(baseUrl, url));
        }
        for (JsonNode amenity : asList(node.get("amenityFeature"))) {
            out.addAmenity(amenity.isTextual() ? amenity.asText() : text(amenity, "name"));
        }
        for (String key : List.of("seller", "agent", "broker", "provider")) {
            JsonNode contact = node.get(key);
            if (contact != null && contact.isObject()) out.addAgent(agentOf(contact));
        }
    }

    private static AgentContact agentOf(JsonNode node) {
        String brokerage = null;
        JsonNode worksFor = node.get("worksFor");
        if (worksFor != null && worksFor.isObject()) brokerage = text(worksFor, "name");
        else if (worksFor != null) brokerage = TextUtils.safe(worksFor.asText());
        if (brokerage == null) brokerage = text(node, "brokerage");
        return new AgentContact(text(node, "name"), text(node, "telephone"), brokerage, text(node, "email"));
    }

    /**
     * Reads a QuantitativeValue or plain value; lot sizes given in acres are converted to square feet.
     */
    private static String quantity(JsonNode node, boolean convertAcres) {
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) return TextUtils.safe(node.asText());
        String value = text(node, "value");
        String unit = TextUtils.firstNonBlank(text(node, "unitCode"), text(node, "unitText"));
        if (convertAcres && value != null && unit != null && unit.toLowerCase(Locale.ROOT).startsWith("ac")) {
            BigDecimal acres = ValueCoercion.toDecimal(value);
            return acres == null ? null : acres.multiply(SQFT_PER_ACRE).stripTrailingZeros().toPlainString();
        }
        return value;
    }

    /**
     * Turns a schema.org type such as {@code SingleFamilyResidence} into "Single Family Residence".
     */
    private static String spaced(JsonNode node, String lowerType) {
        for (JsonNode t : asList(node.get("@type"))) {
            if (t.asText().equalsIgnoreCase(lowerType)) return t.asText().replaceAll("(?<=[a-z])(?=[A-Z])", " ");
        }
        return lowerType;
    }

    private static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> list = new ArrayList<>();
        if (node == null || node.isNull()) return list;
        if (node.isArray()) node.forEach(list::add);
        else list.add(node);
        return list;
    }

    private static String text(JsonNode node, String key) {
        if (node == null || !node.isObject()) return null;
        JsonNode v = node.get(key);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        return TextUtils.safe(v.asText());
    }

    private static void add(Map<ListingField, List<String>> candidates, ListingField field, String value) {
        if (value != null) candidates.computeIfAbsent(field, f -> new ArrayList<>()).add(value);
    }
}
