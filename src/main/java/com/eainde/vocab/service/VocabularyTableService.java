package com.eainde.vocab.service;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.enrich.DictionaryLookup;
import com.eainde.vocab.extraction.CandidateExtractor;
import com.eainde.vocab.extraction.ExtractionOptions;
import com.eainde.vocab.generation.CancellationToken;
import com.eainde.vocab.generation.GenerationProgressListener;
import com.eainde.vocab.generation.GenerationRequest;
import com.eainde.vocab.generation.UniqueRowGenerator;
import com.eainde.vocab.merge.MergeEngine;
import com.eainde.vocab.merge.MergePolicy;
import com.eainde.vocab.merge.MergeResult;
import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;
import com.eainde.vocab.paste.GlossaryBlobParser;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the in-memory vocabulary table and funnels every source of rows through the merge engine.
 *
 * <h3>Sources:</h3>
 * <ul>
 *   <li>{@link #extractFromText}: candidates extracted from free text</li>
 *   <li>{@link #importPasted}: a pasted glossary blob</li>
 *   <li>{@link #generateFromTopic}: generated rows, produced on the injected executor</li>
 *   <li>{@link #enrichTable}: dictionary lookups for every row, also on the executor</li>
 * </ul>
 *
 * <p>Merges into the table are serialized on an internal lock; extraction, parsing,
 * generation and lookups run outside it.</p>
 */
@Slf4j
public class VocabularyTableService {

    static final String MDC_TASK_ID = "taskId";
    static final String MDC_TOPIC = "topic";
    static final String ENRICH_TOPIC = "jisho";

    private final CandidateExtractor extractor;
    private final GlossaryBlobParser blobParser;
    private final UniqueRowGenerator generator;
    private final DictionaryLookup dictionaryLookup;
    private final MergeEngine mergeEngine;
    private final Executor executor;
    private final MergePolicy defaultPolicy;

    private final Object lock = new Object();
    private List<Row> table = new ArrayList<>();

    public VocabularyTableService(CandidateExtractor extractor,
                                  GlossaryBlobParser blobParser,
                                  UniqueRowGenerator generator,
                                  DictionaryLookup dictionaryLookup,
                                  MergeEngine mergeEngine,
                                  Executor executor,
                                  MergePolicy defaultPolicy) {
        this.extractor = extractor;
        this.blobParser = blobParser;
        this.generator = generator;
        this.dictionaryLookup = dictionaryLookup;
        this.mergeEngine = mergeEngine;
        this.executor = executor;
        this.defaultPolicy = defaultPolicy != null ? defaultPolicy : MergePolicy.FILL_BLANK_ONLY;
    }

    // =========================================================================
    //  Synchronous sources
    // =========================================================================

    public MergeResult extractFromText(String text, ExtractionOptions options) {
        List<Row> rows = extractor.buildRows(text, options);
        MergeResult result = merge(rows, defaultPolicy);
        log.info("Extraction produced {} rows: {} added, {} updated", rows.size(), result.added(), result.updated());
        return result;
    }

    public MergeResult importPasted(String blob) {
        List<Row> rows = blobParser.parse(blob);
        MergeResult result = merge(rows, defaultPolicy);
        log.info("Pasted text produced {} rows: {} added, {} updated", rows.size(), result.added(), result.updated());
        return result;
    }

    public MergeResult merge(List<Row> rows, MergePolicy policy) {
        synchronized (lock) {
            MergeResult result = mergeEngine.merge(table, rows, policy);
            table = new ArrayList<>(result.rows());
            return result;
        }
    }

    // =========================================================================
    //  Background generation
    // =========================================================================

    /**
     * Starts generating {@code count} rows for {@code topic} on the executor.
     *
     * @param append when true the current keys are avoided and results merged in;
     *               when false the table is replaced by the generated rows
     */
    public GenerationTask generateFromTopic(String topic,
                                            int count,
                                            boolean gptOnly,
                                            boolean append,
                                            GenerationProgressListener listener) {
        String taskId = newTaskId();
        CancellationToken token = new CancellationToken();
        CompletableFuture<MergeResult> future = new CompletableFuture<>();
        GenerationProgressListener progress = listener != null ? listener : GenerationProgressListener.NOOP;
        Set<RowKey> avoid = append ? keys() : Set.of();
        GenerationRequest request = new GenerationRequest(topic, count, gptOnly, avoid);

        submit(taskId, request.topic(), future,
                "generation of " + count + " rows (append=" + append + ", gptOnly=" + gptOnly + ")",
                () -> runGeneration(request, append, token, progress, future));
        return new GenerationTask(taskId, request.topic(), future, token);
    }

    private void runGeneration(GenerationRequest request,
                               boolean append,
                               CancellationToken token,
                               GenerationProgressListener listener,
                               CompletableFuture<MergeResult> future) {
        try {
            List<Row> rows = generator.generate(request, token, listener);
            MergeResult result = append ? merge(rows, defaultPolicy) : replaceRows(rows);
            log.info("Generation finished: {} rows added", result.added());
            future.complete(result);
        } catch (RuntimeException e) {
            log.warn("Generation for topic '{}' failed: {}", request.topic(), e.getMessage());
            future.completeExceptionally(e);
        }
    }

    // =========================================================================
    //  Dictionary enrichment
    // =========================================================================

    /**
     * Looks up every row of the current table in the dictionary on the executor and merges
     * what it finds back by key. Term and reading are never changed.
     *
     * <p>Progress is reported once per row as {@code onRound(rowNumber, rowsWithAHit, rowCount)}.
     * A failed lookup is logged and leaves its row as it was. Cancelling stops before the next row;
     * the hits gathered so far are still merged.</p>
     *
     * @param onlyFillEmpty when true only empty meaning, example and jlpt fields are filled,
     *                      otherwise non-empty dictionary values replace the current ones
     */
    public GenerationTask enrichTable(boolean onlyFillEmpty, GenerationProgressListener listener) {
        String taskId = newTaskId();
        CancellationToken token = new CancellationToken();
        CompletableFuture<MergeResult> future = new CompletableFuture<>();
        GenerationProgressListener progress = listener != null ? listener : GenerationProgressListener.NOOP;
        MergePolicy policy = onlyFillEmpty ? MergePolicy.FILL_BLANK_ONLY : MergePolicy.PREFER_INCOMING;
        List<Row> snapshot = rows();

        submit(taskId, ENRICH_TOPIC, future,
                "dictionary lookup of " + snapshot.size() + " rows (onlyFillEmpty=" + onlyFillEmpty + ")",
                () -> runEnrichment(snapshot, policy, token, progress, future));
        return new GenerationTask(taskId, ENRICH_TOPIC, future, token);
    }

    private void runEnrichment(List<Row> snapshot,
                               MergePolicy policy,
                               CancellationToken token,
                               GenerationProgressListener listener,
                               CompletableFuture<MergeResult> future) {
        try {
            List<Row> found = new ArrayList<>();
            int total = snapshot.size();
            for (int i = 0; i < total; i++) {
                if (token.isCancelled()) {
                    log.info("Dictionary lookup cancelled after {}/{} rows", i, total);
                    break;
                }
                Row row = snapshot.get(i);
                if (row.hasTerm()) {
                    lookUp(row).ifPresent(found::add);
                }
                listener.onRound(i + 1, found.size(), total);
            }
            MergeResult result = merge(found, policy);
            log.info("Dictionary lookup finished: {} hits, {} rows updated", found.size(), result.updated());
            future.complete(result);
        } catch (RuntimeException e) {
            log.warn("Dictionary lookup failed: {}", e.getMessage());
            future.completeExceptionally(e);
        }
    }

    /**
     * @return the dictionary values under the row's own key, or empty when the lookup found nothing or failed
     */
    private Optional<Row> lookUp(Row row) {
        try {
            return dictionaryLookup.lookup(row.term(), row.reading())
                    .map(hit -> new Row(row.term(), row.reading(), hit.meaning(), hit.example(), hit.jlpt()));
        } catch (RuntimeException e) {
            log.warn("Dictionary lookup for '{}' failed, row kept as is: {}", row.term(), e.getMessage());
            return Optional.empty();
        }
    }

    // =========================================================================
    //  Submission
    // =========================================================================

    private static String newTaskId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Runs {@code work} on the executor with {@code taskId} and {@code topic} in the MDC,
     * restoring the caller's MDC afterwards. A rejected submission fails {@code future}.
     */
    private void submit(String taskId,
                        String topic,
                        CompletableFuture<MergeResult> future,
                        String description,
                        Runnable work) {
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        MDC.put(MDC_TASK_ID, taskId);
        MDC.put(MDC_TOPIC, topic);
        try {
            log.info("Submitting {}", description);
            executor.execute(work);
        } catch (RejectedExecutionException e) {
            log.error("Executor rejected task {}", taskId, e);
            future.completeExceptionally(e);
        } finally {
            if (callerMdc != null) {
                MDC.setContextMap(callerMdc);
            } else {
                MDC.clear();
            }
        }
    }

    // =========================================================================
    //  Table access
    // =========================================================================

    public List<Row> rows() {
        synchronized (lock) {
            return List.copyOf(table);
        }
    }

    public Set<RowKey> keys() {
        Set<RowKey> keys = new LinkedHashSet<>();
        for (Row row : rows()) {
            if (row.hasTerm()) keys.add(row.key());
        }
        return keys;
    }

    /**
     * Replaces the table with the canonical form of {@code rows}; every row with a term counts as added.
     */
    public MergeResult replaceRows(List<Row> rows) {
        List<Row> canonical = new ArrayList<>(rows.size());
        Set<RowKey> keys = new LinkedHashSet<>();
        for (Row row : rows) {
            Row c = RowCanonicalizer.canonicalize(row);
            canonical.add(c);
            if (c.hasTerm()) keys.add(c.key());
        }
        synchronized (lock) {
            table = canonical;
        }
        return new MergeResult(canonical, keys.size(), 0, keys);
    }
}
