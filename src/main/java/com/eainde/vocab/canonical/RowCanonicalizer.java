package com.eainde.vocab.canonical;

import com.eainde.vocab.model.Row;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns any positional record of up to five fields into a canonical {@link Row}.
 *
 * <p>Pure and total: never throws, malformed values degrade to empty strings.</p>
 *
 * <pre>
 * RowCanonicalizer.canonicalize(List.of(" 日本 ", "にほん"))       → Row[日本, にほん, "", "", ""]
 * RowCanonicalizer.canonicalize(List.of("祭り", "", "", "", "jlpt n3")) → jlpt "N3"
 * </pre>
 */
public final class RowCanonicalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HYPHENS = Pattern.compile("[-‐‑–—－]");

    private RowCanonicalizer() {
    }

    public static Row canonicalize(List<String> fields) {
        if (fields == null) return new Row("", "", "", "", "");
        return new Row(
                normalize(field(fields, 0)),
                normalize(field(fields, 1)),
                normalize(field(fields, 2)),
                normalize(field(fields, 3)),
                normalizeJlpt(field(fields, 4)));
    }

    public static Row canonicalize(Row row) {
        if (row == null) return new Row("", "", "", "", "");
        return canonicalize(row.fields());
    }

    public static Row of(String... fields) {
        return canonicalize(fields != null ? Arrays.asList(fields) : null);
    }

    public static String normalize(String value) {
        return value != null ? value.strip() : "";
    }

    /**
     * Normalizes JLPT spellings such as {@code "n2"}, {@code " N-2 "}, {@code "JLPT N2"} or
     * {@code "Ｎ２"} to {@code "N2"}. Anything outside N5..N1 becomes empty.
     */
    public static String normalizeJlpt(String value) {
        if (value == null || value.isBlank()) return "";
        // NFKC folds full-width letters and digits to ASCII
        String s = Normalizer.normalize(value, Normalizer.Form.NFKC).toUpperCase(Locale.ROOT);
        s = WHITESPACE.matcher(s).replaceAll("");
        s = s.replace("JLPT", "");
        s = HYPHENS.matcher(s).replaceAll("");
        return JlptLevel.fromSymbol(s).map(Enum::name).orElse("");
    }

    private static String field(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : "";
    }
}
