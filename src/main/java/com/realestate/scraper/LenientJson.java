package com.realestate.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Tolerant JSON reader for script-embedded payloads that are JSON-like rather than JSON.
 * <p>
 * The mapper accepts single quotes, trailing commas, comments, unquoted keys and non-numeric numbers.
 * {@link #repair(String)} additionally removes artifacts the parser cannot be configured to accept:
 * HTML comment wrappers, {@code undefined} values, minified booleans ({@code !0}, {@code !1}) and a trailing
 * statement terminator.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public final class LenientJson {
    private static final Logger logger = LoggerFactory.getLogger(LenientJson.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_YAML_COMMENTS)
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .enable(JsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS)
        .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
        .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
        .build();

    private static final Pattern UNDEFINED_VALUE = Pattern.compile("(?<=[:\\[,])\\s*undefined\\b");
    private static final Pattern TRUE_SHORTHAND = Pattern.compile("(?<=[:\\[,])\\s*!0\\b");
    private static final Pattern FALSE_SHORTHAND = Pattern.compile("(?<=[:\\[,])\\s*!1\\b");

    private LenientJson() {}

    /**
     * Repairs and parses a payload.
     * @param raw payload text (may be null)
     * @return the parsed tree, or an empty {@code MissingNode} for blank input
     * @throws JsonProcessingException if the repaired text still does not parse
     */
    public static JsonNode parse(String raw) throws JsonProcessingException {
        return MAPPER.readTree(repair(raw));
    }

    /**
     * Repairs and parses a payload, logging and swallowing parse failures.
     * @param raw payload text (may be null)
     * @param origin short description of where the payload came from, for the log line
     * @return the parsed tree, or empty when the payload is blank or malformed
     */
    public static Optional<JsonNode> tryParse(String raw, String origin) {
        try {
            JsonNode node = parse(raw);
            if (node == null || node.isMissingNode()) return Optional.empty();
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            logger.debug("Skipping malformed payload from {}: {}", origin, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Removes non-JSON artifacts that the lenient parser does not accept on its own.
     */
    public static String repair(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("<!--")) s = s.substring(4);
        if (s.endsWith("-->")) s = s.substring(0, s.length() - 3);
        s = s.trim();
        while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
        s = UNDEFINED_VALUE.matcher(s).replaceAll(" null");
        s = TRUE_SHORTHAND.matcher(s).replaceAll(" true");
        s = FALSE_SHORTHAND.matcher(s).replaceAll(" false");
        return s;
    }

    /**
     * Returns the balanced object or array literal that starts at {@code start}.
     * <p>
     * Brackets inside single- or double-quoted strings are ignored, as are escaped quotes.
     * @param text text holding the literal
     * @param start index of the opening {@code '{'} or {@code '['}
     * @return the literal including its closing bracket, or null if it is not closed
     */
    public static String balancedSlice(String text, int start) {
        if (text == null || start < 0 || start >= text.length()) return null;
        char open = text.charAt(start);
        if (open != '{' && open != '[') return null;
        int depth = 0;
        char quote = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) return text.substring(start, i + 1);
                }
                default -> { }
            }
        }
        return null;
    }

    /**
     * Returns true when a string value looks like it holds a serialized object or array.
     */
    public static boolean looksLikeJson(String s) {
        if (s == null) return false;
        String t = s.trim();
        return t.length() > 1 && ((t.startsWith("{") && t.endsWith("}")) || (t.startsWith("[") && t.endsWith("]")));
    }
}
