package com.eainde.vocab.merge;

import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one {@link MergeEngine#merge} call.
 *
 * @param rows      existing rows in their original order, then added rows in incoming order
 * @param added     number of rows appended
 * @param updated   number of existing rows whose resolved value changed
 * @param addedKeys keys of the appended rows, in append order
 */
public record MergeResult(
        List<Row> rows,
        int added,
        int updated,
        Set<RowKey> addedKeys
) {

    public MergeResult {
        rows = List.copyOf(rows);
        addedKeys = Collections.unmodifiableSet(new LinkedHashSet<>(addedKeys));
    }

    public boolean changed() {
        return added > 0 || updated > 0;
    }
}
