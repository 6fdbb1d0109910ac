package com.realestate.scraper;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Registry of the key names under which sites publish listing facts in embedded state objects.
 * <p>
 * Two kinds of entries are held:
 * <ul>
 *   <li>Scalar aliases: a JSON key that maps directly onto one {@link ListingField} (e.g. {@code zipcode} to
 *   {@link ListingField#POSTAL_CODE}).</li>
 *   <li>Named groups: the keys that mark a collection (photos, agents, price events, similar listings,
 *   amenities) and the keys read inside one collection element.</li>
 * </ul>
 * Keys are matched case-insensitively. Entries are read from {@code alias.*} properties; when two fields
 * claim the same key the first declared field keeps it.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public final class FieldAliasRegistry {
    public static final String MEDIA = "media";
    public static final String MEDIA_URL = "media.url";
    public static final String AGENTS = "agents";
    public static final String AGENT_NAME = "agent.name";
    public static final String AGENT_PHONE = "agent.phone";
    public static final String AGENT_BROKERAGE = "agent.brokerage";
    public static final String AGENT_EMAIL = "agent.email";
    public static final String PRICE_HISTORY = "price-history";
    public static final String EVENT_DATE = "event.date";
    public static final String EVENT_TYPE = "event.type";
    public static final String EVENT_PRICE = "event.price";
    public static final String EVENT_NOTES = "event.notes";
    public static final String SIMILAR = "similar";
    public static final String SIMILAR_URL = "similar.url";
    public static final String AMENITIES = "amenities";

    private static final String PREFIX = "alias.";

    private final Map<String, ListingField> fieldByAlias;
    private final Map<ListingField, List<String>> aliasesByField;
    private final Map<String, List<String>> groups;

    private FieldAliasRegistry(Map<ListingField, List<String>> aliasesByField, Map<String, List<String>> groups) {
        Map<String, ListingField> byAlias = new LinkedHashMap<>();
        Map<ListingField, List<String>> fields = new EnumMap<>(ListingField.class);
        for (ListingField field : ListingField.values()) {
            List<String> aliases = aliasesByField.getOrDefault(field, List.of());
            for (String alias : aliases) byAlias.putIfAbsent(lower(alias), field);
            fields.put(field, List.copyOf(aliases));
        }
        Map<String, List<String>> named = new LinkedHashMap<>();
        groups.forEach((k, v) -> named.put(k, List.copyOf(v)));
        this.fieldByAlias = Collections.unmodifiableMap(byAlias);
        this.aliasesByField = Collections.unmodifiableMap(fields);
        this.groups = Collections.unmodifiableMap(named);
    }

    /**
     * Builds the registry from {@code alias.<field-or-group>=key1,key2} entries.
     * Entries whose suffix is a {@link ListingField#key()} become scalar aliases; every other suffix is a group.
     * @param props properties holding alias entries (other keys are ignored)
     * @return the registry
     */
    public static FieldAliasRegistry fromProperties(Properties props) {
        Map<ListingField, List<String>> fields = new EnumMap<>(ListingField.class);
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (!name.startsWith(PREFIX)) continue;
            String suffix = name.substring(PREFIX.length());
            List<String> keys = ExtractionConfig.splitList(props.getProperty(name));
            ListingField field = ListingField.fromKey(suffix);
            if (field != null) {
                fields.put(field, keys);
            } else {
                groups.put(suffix, keys);
            }
        }
        return new FieldAliasRegistry(fields, groups);
    }

    /**
     * Returns the field a JSON key maps onto, or null if the key is not a scalar alias.
     */
    public ListingField fieldFor(String key) {
        return key == null ? null : fieldByAlias.get(lower(key));
    }

    /**
     * Returns the declared aliases of a field, in declaration order.
     */
    public List<String> aliasesOf(ListingField field) {
        return aliasesByField.getOrDefault(field, List.of());
    }

    /**
     * Returns true when the key belongs to the named group.
     */
    public boolean isAlias(String group, String key) {
        if (key == null) return false;
        String k = lower(key);
        for (String alias : groups.getOrDefault(group, List.of())) {
            if (lower(alias).equals(k)) return true;
        }
        return false;
    }

    /**
     * Returns the keys of a named group, in declaration order.
     */
    public List<String> group(String group) {
        return groups.getOrDefault(group, List.of());
    }

    /**
     * Returns the names of every collection group that the walker consumes instead of descending into.
     */
    public Set<String> collectionGroups() {
        return new LinkedHashSet<>(List.of(MEDIA, AGENTS, PRICE_HISTORY, SIMILAR, AMENITIES));
    }

    /**
     * Returns the group name of the collection a key introduces, or null when it introduces none.
     */
    public String collectionFor(String key) {
        for (String group : collectionGroups()) {
            if (isAlias(group, key)) return group;
        }
        return null;
    }

    private static String lower(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
