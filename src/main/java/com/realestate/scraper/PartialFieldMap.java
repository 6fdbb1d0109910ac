package com.realestate.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The raw output of one extraction stage: field values as found on the page plus collected lists.
 * <p>
 * Within a stage the first value put for a field is kept and later ones are ignored, which gives the
 * depth-first "first occurrence wins" walk order its meaning. Blank values are never stored. List entries are
 * deduplicated while keeping first-seen order.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class PartialFieldMap {
    private final Map<ListingField, String> values = new EnumMap<>(ListingField.class);
    private final Set<String> media = new LinkedHashSet<>();
    private final Set<AgentContact> agents = new LinkedHashSet<>();
    private final Set<PriceEvent> priceHistory = new LinkedHashSet<>();
    private final Set<String> similarUrls = new LinkedHashSet<>();
    private final Set<String> amenities = new LinkedHashSet<>();

    /**
     * Stores a value unless the field already has one or the value is blank.
     * @return true if the value was stored
     */
    public boolean put(ListingField field, String value) {
        String v = TextUtils.collapseWhitespace(value);
        if (field == null || v == null || values.containsKey(field)) return false;
        values.put(field, v);
        return true;
    }

    public String get(ListingField field) {
        return values.get(field);
    }

    public boolean has(ListingField field) {
        return values.containsKey(field);
    }

    /**
     * Drops a value that a later gate decided carries no information.
     */
    public void remove(ListingField field) {
        values.remove(field);
    }

    public void addMedia(String url) {
        String u = TextUtils.safe(url);
        if (u != null) media.add(u);
    }

    public void addAgent(AgentContact agent) {
        if (agent != null && !agent.isEmpty()) agents.add(agent);
    }

    public void addPriceEvent(PriceEvent event) {
        if (event != null && (event.eventDate() != null || event.price() != null)) priceHistory.add(event);
    }

    public void addSimilarUrl(String url) {
        String u = TextUtils.safe(url);
        if (u != null) similarUrls.add(u);
    }

    public void addAmenity(String amenity) {
        String a = TextUtils.collapseWhitespace(amenity);
        if (a != null) amenities.add(a);
    }

    public Map<ListingField, String> values() {
        return Collections.unmodifiableMap(values);
    }

    public List<String> media() {
        return new ArrayList<>(media);
    }

    public List<AgentContact> agents() {
        return new ArrayList<>(agents);
    }

    public List<PriceEvent> priceHistory() {
        return new ArrayList<>(priceHistory);
    }

    public List<String> similarUrls() {
        return new ArrayList<>(similarUrls);
    }

    public List<String> amenities() {
        return new ArrayList<>(amenities);
    }

    /**
     * Returns the number of scalar values plus the number of non-empty lists.
     */
    public int size() {
        int n = values.size();
        if (!media.isEmpty()) n++;
        if (!agents.isEmpty()) n++;
        if (!priceHistory.isEmpty()) n++;
        if (!similarUrls.isEmpty()) n++;
        if (!amenities.isEmpty()) n++;
        return n;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        return "PartialFieldMap" + values + " media=" + media.size() + " agents=" + agents.size()
            + " events=" + priceHistory.size();
    }
}
