package com.eainde.vocab.parse;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a {@code {"items": [...]}} structure from free-text generator replies.
 *
 * <p>Replies drift in predictable ways: prose around the payload, markdown fences,
 * smart quotes, unquoted keys, single-quoted strings, trailing commas, or a bare
 * top-level array. Repairs are applied one at a time and a strict Jackson parse is
 * attempted after each, so well-formed replies are never rewritten.</p>
 *
 * <h3>Repair order:</h3>
 * <ol>
 *   <li>Fenced code block, otherwise the largest top-level {@code {...}} or {@code [...]} span</li>
 *   <li>Typographic quotes and non-breaking spaces to ASCII</li>
 *   <li>Bare array wrapped as {@code {"items": [...]}}</li>
 *   <li>Bare object keys quoted</li>
 *   <li>Single-quoted strings converted to double-quoted</li>
 *   <li>Trailing commas removed</li>
 *   <li>Largest bracketed span of the repaired text re-extracted, one last try</li>
 * </ol>
 */
public class LenientJsonParser {

    private static final Logger log = LoggerFactory.getLogger(LenientJsonParser.class);

    public static final String ITEMS = "items";
    private static final String WORDS = "words";
    private static final String TERM = "term";
    private static final List<String> FIELDS = List.of("term", "reading", "meaning", "example", "jlpt");

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public LenientJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Parses a reply into an object node carrying an {@code items} array.
     *
     * @throws ReplyParseException when no repair yields valid JSON of a recognised shape
     */
    public JsonNode parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new ReplyParseException("Reply is empty", reply);
        }

        String current = extractPayload(stripBom(reply).strip());
        JsonNode parsed = tryParse(current);

        List<UnaryOperator<String>> repairs = List.of(
                LenientJsonParser::normalizeTypography,
                LenientJsonParser::wrapBareArray,
                LenientJsonParser::quoteBareKeys,
                LenientJsonParser::singleToDoubleQuotes,
                LenientJsonParser::removeTrailingCommas);

        for (int stage = 0; parsed == null && stage < repairs.size(); stage++) {
            current = repairs.get(stage).apply(current);
            parsed = tryParse(current);
            if (parsed != null) {
                log.debug("Reply recovered after repair stage {}", stage + 1);
            }
        }

        if (parsed == null) {
            String span = largestBracketSpan(current);
            if (span != null && !span.equals(current)) {
                parsed = tryParse(span);
            }
        }

        if (parsed == null) {
            throw new ReplyParseException("No valid JSON could be recovered from reply", reply);
        }
        return normalize(parsed, reply);
    }

    /**
     * Parses a reply into canonical rows.
     *
     * <p>Non-object items are ignored, rows without a term are dropped and only the first
     * row per (term, reading) key is kept.</p>
     *
     * @throws ReplyParseException when the reply cannot be parsed at all
     */
    public List<Row> parseRows(String reply) {
        JsonNode items = parse(reply).path(ITEMS);

        Map<RowKey, Row> unique = new LinkedHashMap<>();
        for (JsonNode item : items) {
            if (!item.isObject()) continue;

            List<String> fields = new ArrayList<>(FIELDS.size());
            for (String field : FIELDS) {
                fields.add(textOf(item, field));
            }
            Row row = RowCanonicalizer.canonicalize(fields);
            if (row.hasTerm()) {
                unique.putIfAbsent(row.key(), row);
            }
        }
        return new ArrayList<>(unique.values());
    }

    // =========================================================================
    //  Shape normalization
    // =========================================================================

    private JsonNode normalize(JsonNode root, String reply) {
        if (root.isArray()) {
            return wrapItems((ArrayNode) root);
        }
        if (root.isObject()) {
            if (root.path(ITEMS).isArray()) return root;
            if (root.path(WORDS).isArray()) return wrapItems((ArrayNode) root.get(WORDS));
            if (root.has(TERM)) {
                ArrayNode single = objectMapper.createArrayNode();
                single.add(root);
                return wrapItems(single);
            }
        }
        throw new ReplyParseException("Reply JSON has no items array", reply);
    }

    private ObjectNode wrapItems(ArrayNode items) {
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.set(ITEMS, items);
        return wrapper;
    }

    private static String textOf(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return "";
        return value.asText("");
    }

    // =========================================================================
    //  Strict parse
    // =========================================================================

    private JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return strictReader.readTree(text);
        } catch (Exception e) {
            log.trace("Strict parse failed: {}", e.getMessage());
            return null;
        }
    }

    // =========================================================================
    //  Payload location
    // =========================================================================

    static String extractPayload(String text) {
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            return fence.group(1).strip();
        }
        String span = largestBracketSpan(text);
        return span != null ? span : text;
    }

    /**
     * Returns the longer of the object span (first opening brace to last closing brace) and the
     * array span (first opening bracket to last closing bracket); on equal length the earlier one wins.
     */
    static String largestBracketSpan(String text) {
        int objStart = text.indexOf('{');
        int objEnd = text.lastIndexOf('}');
        int arrStart = text.indexOf('[');
        int arrEnd = text.lastIndexOf(']');

        int objLen = objStart >= 0 && objEnd > objStart ? objEnd - objStart + 1 : 0;
        int arrLen = arrStart >= 0 && arrEnd > arrStart ? arrEnd - arrStart + 1 : 0;

        if (objLen == 0 && arrLen == 0) return null;
        if (objLen > arrLen || (objLen == arrLen && objStart < arrStart)) {
            return text.substring(objStart, objEnd + 1);
        }
        return text.substring(arrStart, arrEnd + 1);
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    // =========================================================================
    //  Repairs
    // =========================================================================

    static String normalizeTypography(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '“', '”', '„', '‟' -> out.append('"');
                case '‘', '’', '‚', '‛' -> out.append('\'');
                case '\u00A0', '\u202F', '\u2007' -> out.append(' ');
                default -> out.append(ch);
            }
        }
        return out.toString();
    }

    static String wrapBareArray(String s) {
        String trimmed = s.strip();
        return trimmed.startsWith("[") ? "{\"" + ITEMS + "\": " + trimmed + "}" : s;
    }

    /**
     * Quotes identifiers that follow an opening brace or a comma and precede a colon, outside strings.
     */
    static String quoteBareKeys(String s) {
        StringBuilder out = new StringBuilder(s.length() + 16);
        char quote = 0;
        boolean escaped = false;
        char lastSignificant = 0;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (quote != 0) {
                out.append(ch);
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == quote) quote = 0;
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
                lastSignificant = ch;
                out.append(ch);
                continue;
            }
            if ((lastSignificant == '{' || lastSignificant == ',') && isIdentifierStart(ch)) {
                int end = i;
                while (end < s.length() && isIdentifierPart(s.charAt(end))) end++;
                int colon = end;
                while (colon < s.length() && Character.isWhitespace(s.charAt(colon))) colon++;
                if (colon < s.length() && s.charAt(colon) == ':') {
                    out.append('"').append(s, i, end).append('"');
                    lastSignificant = '"';
                    i = end - 1;
                    continue;
                }
            }
            if (!Character.isWhitespace(ch)) lastSignificant = ch;
            out.append(ch);
        }
        return out.toString();
    }

    /**
     * Rewrites {@code 'text'} as {@code "text"} outside double-quoted strings,
     * escaping embedded double quotes and unescaping {@code \'}.
     */
    static String singleToDoubleQuotes(String s) {
        StringBuilder out = new StringBuilder(s.length() + 8);
        boolean inDouble = false;
        boolean inSingle = false;
        boolean escaped = false;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (inDouble) {
                out.append(ch);
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == '"') inDouble = false;
                continue;
            }
            if (inSingle) {
                if (escaped) {
                    if (ch != '\'') out.append('\\');
                    out.append(ch);
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '\'') {
                    out.append('"');
                    inSingle = false;
                } else if (ch == '"') {
                    out.append("\\\"");
                } else {
                    out.append(ch);
                }
                continue;
            }
            if (ch == '"') {
                inDouble = true;
                out.append(ch);
            } else if (ch == '\'') {
                inSingle = true;
                out.append('"');
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    static String removeTrailingCommas(String s) {
        StringBuilder out = new StringBuilder(s.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (inString) {
                out.append(ch);
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }
            if (ch == '"') {
                inString = true;
                out.append(ch);
                continue;
            }
            if (ch == ',') {
                int next = i + 1;
                while (next < s.length() && Character.isWhitespace(s.charAt(next))) next++;
                if (next < s.length() && (s.charAt(next) == '}' || s.charAt(next) == ']')) continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_' || ch == '$';
    }

    private static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$' || ch == '-';
    }
}
