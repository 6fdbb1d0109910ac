package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects one canonical value when several structured-data blocks of the same page disagree on a field.
 * <p>
 * Selection rules:
 * <ul>
 *   <li>Decimal and integer fields: the numerically largest candidate wins, so a sale price beats a
 *   per-month figure.</li>
 *   <li>Coordinates: the first candidate wins.</li>
 *   <li>Every other field: the longest candidate wins, the first one on a tie.</li>
 * </ul>
 * Disagreements are logged at debug level with every candidate for traceability.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public class CandidateResolver {
    private static final Logger logger = LoggerFactory.getLogger(CandidateResolver.class);

    /**
     * Outcome of one resolution: the selected value and whether all candidates agreed.
     */
    public record Resolution(String value, boolean unanimous) {}

    /**
     * Resolves the candidates collected for one field.
     * @param field field the candidates belong to
     * @param candidates raw candidate values in document order (may contain blanks)
     * @return the resolution; its value is null when no candidate is usable
     */
    public Resolution resolve(ListingField field, List<String> candidates) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String c : candidates) {
            String v = TextUtils.collapseWhitespace(c);
            if (v != null) distinct.add(v);
        }
        List<String> usable = List.copyOf(distinct);
        if (usable.isEmpty()) return new Resolution(null, true);

        String selected = switch (field.kind()) {
            case DECIMAL, INTEGER -> largest(usable);
            case COORDINATE -> usable.get(0);
            default -> longest(usable);
        };
        boolean unanimous = usable.size() == 1;
        if (!unanimous) {
            logger.debug("Structured-data disagreement for {}: {} -> '{}'", field, usable, selected);
        }
        return new Resolution(selected, unanimous);
    }

    private static String largest(List<String> values) {
        String best = null;
        BigDecimal bestValue = null;
        for (String v : values) {
            BigDecimal d = ValueCoercion.toDecimal(v);
            if (d != null && (bestValue == null || d.compareTo(bestValue) > 0)) {
                best = v;
                bestValue = d;
            }
        }
        return best != null ? best : values.get(0);
    }

    private static String longest(List<String> values) {
        String best = values.get(0);
        for (String v : values) {
            if (v.length() > best.length()) best = v;
        }
        return best;
    }
}
