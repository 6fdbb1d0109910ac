package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coerces loosely typed page values (currency strings, numbers with punctuation, mixed date formats)
 * into typed values.
 * <p>
 * Every method returns null when nothing usable remains. Numeric fields are never defaulted to zero.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public final class ValueCoercion {
    private static final Logger logger = LoggerFactory.getLogger(ValueCoercion.class);

    /** Long-form dates such as "March 5, 2024", "Sept. 12 2023" or "Jan 3rd, 2022". */
    public static final Pattern LONG_DATE = Pattern.compile(
        "\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern US_NUMERIC_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("^\\d{12,13}$");
    private static final Pattern SIGNED_NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final List<String> MONTHS = List.of(
        "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private ValueCoercion() {}

    /**
     * Parses a decimal after stripping every character that is not a digit or a decimal point.
     * <p>
     * "$1,200/mo" yields 1200, "2.5 baths" yields 2.5, "N/A" yields null.
     * @param raw raw text (may be null)
     * @return parsed value, or null when no digits remain or the digits do not form a number
     */
    public static BigDecimal toDecimal(String raw) {
        if (raw == null) return null;
        String digits = raw.replaceAll("[^0-9.]", "");
        digits = digits.replaceAll("^\\.+(?=\\.)", "").replaceAll("\\.+$", "");
        if (digits.chars().noneMatch(Character::isDigit)) return null;
        try {
            return new BigDecimal(digits);
        } catch (NumberFormatException e) {
            logger.debug("Discarding malformed number '{}': {}", raw, e.getMessage());
            return null;
        }
    }

    /**
     * Parses a latitude or longitude. Unlike {@link #toDecimal(String)} the sign is kept.
     */
    public static BigDecimal toCoordinate(String raw) {
        if (raw == null) return null;
        Matcher m = SIGNED_NUMBER.matcher(raw.replace(",", ""));
        if (!m.find()) return null;
        return new BigDecimal(m.group());
    }

    /**
     * Parses a whole number, truncating any fraction ("3.0" yields 3). Values outside the int range yield null.
     */
    public static Integer toInteger(String raw) {
        BigDecimal d = toDecimal(raw);
        if (d == null) return null;
        try {
            return d.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException e) {
            logger.debug("Discarding out-of-range integer '{}'", raw);
            return null;
        }
    }

    /**
     * Normalizes a date to ISO {@code YYYY-MM-DD}.
     * <p>
     * Recognized inputs:
     * <ul>
     *   <li>ISO dates and date-times (the date part is kept).</li>
     *   <li>Long-form "Month Day, Year" with full or abbreviated month names.</li>
     *   <li>US numeric "MM/DD/YYYY".</li>
     *   <li>Epoch milliseconds, interpreted in UTC.</li>
     * </ul>
     * Anything else is returned trimmed and unchanged, with no structural guarantee.
     * @param raw raw date text (may be null)
     * @return ISO date, the original text, or null for blank input
     */
    public static String toIsoDate(String raw) {
        String s = TextUtils.safe(raw);
        if (s == null) return null;
        try {
            Matcher iso = ISO_PREFIX.matcher(s);
            if (iso.find()) {
                return LocalDate.of(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)),
                    Integer.parseInt(iso.group(3))).toString();
            }
            Matcher longForm = LONG_DATE.matcher(s);
            if (longForm.find()) {
                return fromLongDateMatch(longForm);
            }
            Matcher numeric = US_NUMERIC_DATE.matcher(s);
            if (numeric.find()) {
                return LocalDate.of(Integer.parseInt(numeric.group(3)), Integer.parseInt(numeric.group(1)),
                    Integer.parseInt(numeric.group(2))).toString();
            }
            if (EPOCH_MILLIS.matcher(s).matches()) {
                return Instant.ofEpochMilli(Long.parseLong(s)).atZone(ZoneOffset.UTC).toLocalDate().toString();
            }
        } catch (DateTimeException | NumberFormatException e) {
            logger.debug("Date '{}' looked structured but is not a valid date: {}", s, e.getMessage());
        }
        return s;
    }

    /**
     * Converts a {@link #LONG_DATE} match into an ISO date.
     * @param m a matcher positioned on a successful {@link #LONG_DATE} match
     * @return ISO date
     * @throws DateTimeException if the day is not valid for the month
     */
    public static String fromLongDateMatch(Matcher m) {
        int month = MONTHS.indexOf(m.group(1).toLowerCase(Locale.ROOT)) + 1;
        return LocalDate.of(Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(2))).toString();
    }

    /**
     * Normalizes a postal code to a fixed-width five digit string.
     * <p>
     * "02134-1234" yields "02134"; a code that lost its leading zeros as a number ("2134") is left-padded.
     * @param raw raw postal code (may be null)
     * @return five digit code, or null when no digits are present
     */
    public static String toPostalCode(String raw) {
        if (raw == null) return null;
        Matcher m = DIGIT_RUN.matcher(raw);
        if (!m.find()) return null;
        String digits = m.group();
        if (digits.length() >= 5) return digits.substring(0, 5);
        return "0".repeat(5 - digits.length()) + digits;
    }
}
