package com.eainde.vocab.model;

/**
 * Identity of a {@link Row}: the normalized (term, reading) pair.
 */
public record RowKey(String term, String reading) {

    public RowKey {
        term = term != null ? term : "";
        reading = reading != null ? reading : "";
    }

    /**
     * Renders the key as {@code term|reading}, the form used in exclusion lists sent to the generator.
     */
    public String render() {
        return term + "|" + reading;
    }

    @Override
    public String toString() {
        return render();
    }
}
