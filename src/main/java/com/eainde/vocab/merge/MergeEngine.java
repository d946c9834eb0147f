package com.eainde.vocab.merge;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles an existing row collection with incoming rows by (term, reading) key.
 *
 * <h3>Merge rules:</h3>
 * <ol>
 *   <li>Both sides are canonicalized first</li>
 *   <li>Unknown key: the incoming row is appended and its key recorded as added</li>
 *   <li>Known key: fields are resolved one by one with the {@link MergePolicy}</li>
 *   <li>A row counts as updated only when the resolved row differs from the stored one</li>
 *   <li>Rows are never deleted</li>
 * </ol>
 *
 * <p>Existing rows with an empty term stay where they are but are never matched.
 * Incoming rows with an empty term are skipped.</p>
 *
 * <p>Stateless. Callers sharing one table must serialize their merges.</p>
 */
public class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    public MergeResult merge(List<Row> existing, List<Row> incoming, MergePolicy policy) {
        MergePolicy effective = policy != null ? policy : MergePolicy.FILL_BLANK_ONLY;

        List<Row> merged = new ArrayList<>();
        Map<RowKey, Integer> index = new HashMap<>();
        for (Row row : nullSafe(existing)) {
            Row canonical = RowCanonicalizer.canonicalize(row);
            if (canonical.hasTerm()) {
                // first occurrence owns the key
                index.putIfAbsent(canonical.key(), merged.size());
            }
            merged.add(canonical);
        }

        int added = 0;
        int updated = 0;
        Set<RowKey> addedKeys = new LinkedHashSet<>();

        for (Row row : nullSafe(incoming)) {
            Row candidate = RowCanonicalizer.canonicalize(row);
            if (!candidate.hasTerm()) continue;

            RowKey key = candidate.key();
            Integer position = index.get(key);
            if (position == null) {
                index.put(key, merged.size());
                merged.add(candidate);
                addedKeys.add(key);
                added++;
                continue;
            }

            Row current = merged.get(position);
            Row resolved = resolve(current, candidate, effective);
            if (!resolved.equals(current)) {
                merged.set(position, resolved);
                updated++;
            }
        }

        log.debug("Merged {} incoming rows into {} existing: {} added, {} updated ({})",
                nullSafe(incoming).size(), nullSafe(existing).size(), added, updated, effective);
        return new MergeResult(merged, added, updated, addedKeys);
    }

    public MergeResult merge(List<Row> existing, List<Row> incoming) {
        return merge(existing, incoming, MergePolicy.FILL_BLANK_ONLY);
    }

    private static Row resolve(Row current, Row incoming, MergePolicy policy) {
        return new Row(
                current.term(),
                current.reading(),
                policy.resolve(current.meaning(), incoming.meaning()),
                policy.resolve(current.example(), incoming.example()),
                policy.resolve(current.jlpt(), incoming.jlpt()));
    }

    private static List<Row> nullSafe(List<Row> rows) {
        return rows != null ? rows : List.of();
    }
}
