package com.eainde.vocab.generation;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.enrich.DictionaryLookup;
import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;
import com.eainde.vocab.parse.LenientJsonParser;
import com.eainde.vocab.parse.ReplyParseException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Produces exactly {@code target} new rows for a topic, none of which collide with the
 * caller's avoid-set or with each other.
 *
 * <h3>Round loop:</h3>
 * <pre>
 *   COLLECTING ──(collected == target)────────────────▶ DONE
 *       │
 *       ├──(stallRounds rounds without new items)───▶ STALLED  → GenerationStalledException
 *       │
 *       └──(maxRounds spent)── final catch-up request ─▶ DONE | CAPPED → RoundCapExceededException
 * </pre>
 *
 * <ul>
 *   <li>Each round asks for {@code min(remaining + 8, max(remaining + 4, 24))} items</li>
 *   <li>Exclusions are the collected keys then the avoid-set, capped at {@code avoidLimit}</li>
 *   <li>A failed round (collaborator error, unparseable or empty reply) counts as no progress</li>
 *   <li>Backoff between rounds grows with the round number</li>
 *   <li>Cancellation is checked before every request</li>
 * </ul>
 *
 * <p>Rows are enriched through the {@link DictionaryLookup} unless the request is
 * {@code gptOnly}. Enrichment never changes a row's key and its failures are ignored.</p>
 */
@Slf4j
public class UniqueRowGenerator {

    private static final int SNIPPET_LENGTH = 240;

    private final VocabularyGenerator generator;
    private final LenientJsonParser parser;
    private final DictionaryLookup dictionary;
    private final GenerationGuidance guidance;
    private final GenerationSettings settings;
    private final RetryPolicy roundPolicy;
    private final RetryPolicy batchPolicy;
    private final Sleeper sleeper;

    public UniqueRowGenerator(VocabularyGenerator generator,
                              LenientJsonParser parser,
                              DictionaryLookup dictionary) {
        this(generator, parser, dictionary, new GenerationGuidance(), GenerationSettings.DEFAULTS,
                RetryPolicy.ROUNDS, RetryPolicy.BATCH, Sleeper.SYSTEM);
    }

    /**
     * @param dictionary optional, {@code null} disables enrichment
     */
    public UniqueRowGenerator(VocabularyGenerator generator,
                              LenientJsonParser parser,
                              DictionaryLookup dictionary,
                              GenerationGuidance guidance,
                              GenerationSettings settings,
                              RetryPolicy roundPolicy,
                              RetryPolicy batchPolicy,
                              Sleeper sleeper) {
        this.generator = generator;
        this.parser = parser;
        this.dictionary = dictionary;
        this.guidance = guidance;
        this.settings = settings;
        this.roundPolicy = roundPolicy;
        this.batchPolicy = batchPolicy;
        this.sleeper = sleeper;
    }

    public List<Row> generate(GenerationRequest request) {
        return generate(request, CancellationToken.none(), GenerationProgressListener.NOOP);
    }

    /**
     * @return exactly {@code request.target()} rows, or an empty list when the target is below 1
     * @throws GenerationStalledException    after too many rounds without new items
     * @throws RoundCapExceededException     when the round cap and final request fall short
     * @throws GenerationCancelledException  when the token fires or the thread is interrupted
     */
    public List<Row> generate(GenerationRequest request,
                              CancellationToken token,
                              GenerationProgressListener listener) {
        int target = request.target();
        if (target < 1) {
            listener.onState(GenerationState.DONE);
            return List.of();
        }

        String topic = request.topic();
        Set<RowKey> avoid = normalizeKeys(request.avoid());
        Map<RowKey, Row> collected = new LinkedHashMap<>();

        log.info("Generating {} rows for topic '{}' avoiding {} known keys", target, topic, avoid.size());
        listener.onState(GenerationState.COLLECTING);

        int round = 0;
        int idleRounds = 0;
        while (collected.size() < target && round < settings.maxRounds()) {
            checkCancelled(token, listener);
            round++;

            int remaining = target - collected.size();
            int askFor = Math.min(remaining + 8, Math.max(remaining + 4, 24));
            int gained = runRound(topic, askFor, round, target, collected, avoid);
            listener.onRound(round, collected.size(), target);

            if (gained == 0) {
                idleRounds++;
                if (idleRounds >= settings.stallRounds()) {
                    log.warn("Topic '{}' stalled at {}/{} after {} rounds", topic, collected.size(), target, round);
                    listener.onState(GenerationState.STALLED);
                    throw new GenerationStalledException(topic, round);
                }
            } else {
                idleRounds = 0;
            }

            if (collected.size() < target) {
                pause(round, listener);
            }
        }

        if (collected.size() < target) {
            checkCancelled(token, listener);
            int remaining = target - collected.size();
            log.info("Round cap reached for topic '{}' with {} missing, sending final request", topic, remaining);
            runRound(topic, remaining + settings.finalSlack(), round + 1, target, collected, avoid);
            listener.onRound(round + 1, collected.size(), target);
        }

        if (collected.size() < target) {
            int shortfall = target - collected.size();
            listener.onState(GenerationState.CAPPED);
            throw new RoundCapExceededException(topic, shortfall);
        }

        List<Row> rows = enrich(new ArrayList<>(collected.values()), request.gptOnly());
        listener.onState(GenerationState.DONE);
        log.info("Generated {} rows for topic '{}' in {} rounds", rows.size(), topic, round);
        return List.copyOf(rows.subList(0, target));
    }

    // =========================================================================
    //  Rounds
    // =========================================================================

    /**
     * @return number of new rows folded into {@code collected}
     */
    private int runRound(String topic, int askFor, int round, int target,
                         Map<RowKey, Row> collected, Set<RowKey> avoid) {
        GenerationPrompt prompt = new GenerationPrompt(topic, askFor, exclusions(collected, avoid),
                guidance.rulesFor(round));

        String reply = null;
        try {
            reply = batchPolicy.execute("Generator call for topic '" + topic + "'",
                    () -> generator.generate(prompt), sleeper);

            List<Row> batch = parser.parseRows(reply);
            if (batch.isEmpty()) {
                throw new EmptyYieldException(topic, round);
            }

            int gained = 0;
            for (Row row : batch) {
                if (collected.size() >= target) break;
                RowKey key = row.key();
                if (avoid.contains(key) || collected.containsKey(key)) continue;
                collected.put(key, row);
                gained++;
            }
            log.debug("Round {} for topic '{}': asked {}, parsed {}, kept {} ({} / {})",
                    round, topic, askFor, batch.size(), gained, collected.size(), target);
            return gained;

        } catch (GenerationCancelledException e) {
            throw e;
        } catch (ReplyParseException e) {
            log.warn("Round {} for topic '{}' returned unparseable reply: {}", round, topic, snippet(e.reply()));
            return 0;
        } catch (RuntimeException e) {
            log.warn("Round {} for topic '{}' failed: {} (reply: {})", round, topic, e.getMessage(), snippet(reply));
            return 0;
        }
    }

    private List<RowKey> exclusions(Map<RowKey, Row> collected, Set<RowKey> avoid) {
        Set<RowKey> keys = new LinkedHashSet<>(collected.keySet());
        keys.addAll(avoid);
        return keys.stream().limit(settings.avoidLimit()).toList();
    }

    private void pause(int round, GenerationProgressListener listener) {
        try {
            sleeper.pause(roundPolicy.backoff(round));
        } catch (GenerationCancelledException e) {
            listener.onState(GenerationState.CANCELLED);
            throw e;
        }
    }

    private static void checkCancelled(CancellationToken token, GenerationProgressListener listener) {
        if (token.isCancelled()) {
            listener.onState(GenerationState.CANCELLED);
            token.throwIfCancelled();
        }
    }

    // =========================================================================
    //  Enrichment
    // =========================================================================

    private List<Row> enrich(List<Row> rows, boolean gptOnly) {
        if (gptOnly || dictionary == null) return rows;

        List<Row> enriched = new ArrayList<>(rows.size());
        for (Row row : rows) {
            try {
                Optional<Row> found = dictionary.lookup(row.term(), row.reading());
                enriched.add(found.map(entry -> overlay(row, entry)).orElse(row));
            } catch (RuntimeException e) {
                log.debug("Dictionary enrichment skipped for {}: {}", row.key(), e.getMessage());
                enriched.add(row);
            }
        }
        return enriched;
    }

    /** Dictionary values win where present; the generated key is kept. */
    private static Row overlay(Row generated, Row entry) {
        return new Row(
                generated.term(),
                generated.reading(),
                prefer(RowCanonicalizer.normalize(entry.meaning()), generated.meaning()),
                prefer(RowCanonicalizer.normalize(entry.example()), generated.example()),
                prefer(RowCanonicalizer.normalizeJlpt(entry.jlpt()), generated.jlpt()));
    }

    private static String prefer(String incoming, String existing) {
        return incoming.isEmpty() ? existing : incoming;
    }

    private static Set<RowKey> normalizeKeys(Set<RowKey> keys) {
        Set<RowKey> normalized = new LinkedHashSet<>();
        for (RowKey key : keys) {
            normalized.add(new RowKey(RowCanonicalizer.normalize(key.term()),
                    RowCanonicalizer.normalize(key.reading())));
        }
        return normalized;
    }

    private static String snippet(String reply) {
        if (reply == null) return "";
        String flat = reply.replaceAll("\\s+", " ").strip();
        return flat.length() <= SNIPPET_LENGTH ? flat : flat.substring(0, SNIPPET_LENGTH) + "...";
    }
}
