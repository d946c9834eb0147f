package com.eainde.vocab.model;

import java.util.List;

/**
 * A single vocabulary entry of the table.
 *
 * <p>Fixed five-field shape. Absent values are empty strings, never null.
 * Rows are compared and indexed by {@link #key()}.</p>
 *
 * @param term    headword (kanji or kana)
 * @param reading kana reading, may be empty
 * @param meaning short English gloss, may be empty
 * @param example one Japanese sentence using the term, may be empty
 * @param jlpt    one of N5..N1, or empty
 */
public record Row(
        String term,
        String reading,
        String meaning,
        String example,
        String jlpt
) {

    public static final List<String> HEADERS = List.of("Term", "Reading", "Meaning", "Example", "JLPT");

    public Row {
        term = term != null ? term : "";
        reading = reading != null ? reading : "";
        meaning = meaning != null ? meaning : "";
        example = example != null ? example : "";
        jlpt = jlpt != null ? jlpt : "";
    }

    public static Row of(String term, String reading) {
        return new Row(term, reading, "", "", "");
    }

    public RowKey key() {
        return new RowKey(term, reading);
    }

    public boolean hasTerm() {
        return !term.isEmpty();
    }

    /**
     * @return 3 when example and jlpt are both empty, otherwise 5
     */
    public int width() {
        return example.isEmpty() && jlpt.isEmpty() ? 3 : 5;
    }

    public List<String> fields() {
        return List.of(term, reading, meaning, example, jlpt);
    }
}
