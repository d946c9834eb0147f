package com.eainde.vocab.extraction;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.model.Candidate;
import com.eainde.vocab.model.CandidateOrigin;
import com.eainde.vocab.model.Morpheme;
import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;
import com.eainde.vocab.tokenizer.TokenizerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns unstructured Japanese text into ranked vocabulary and phrase candidates.
 *
 * <h3>Single words</h3>
 * <ul>
 *   <li>Nouns keep their surface form; verbs and adjectives collapse to their lemma</li>
 *   <li>Punctuation, stop terms and empty headwords are dropped</li>
 *   <li>Score = frequency + min(2, length / 2); reading = most frequent observed reading</li>
 * </ul>
 *
 * <h3>Phrases</h3>
 * <ul>
 *   <li>Maximal runs of two or more nouns</li>
 *   <li>Adjective + noun bigrams</li>
 *   <li>Windows of 2..maxNgramLen tokens holding at least two nouns</li>
 *   <li>Score = 2.0 + 0.4 per token + min(2, length / 3), plus 0.5 when combined</li>
 * </ul>
 *
 * <p>Output is fully deterministic: every map is insertion ordered and every sort is stable,
 * so ties always break by first-seen order.</p>
 *
 * <p>This class holds no mutable state and is safe to share across threads.</p>
 */
public class CandidateExtractor {

    private static final Logger log = LoggerFactory.getLogger(CandidateExtractor.class);

    /** Kana-only annotations in ASCII or full-width parentheses, e.g. 芸能(げいのう). */
    private static final Pattern FURIGANA = Pattern.compile("[（(][\\p{IsHiragana}\\p{IsKatakana}ー・\\s]+[）)]");

    private static final int MAX_LENGTH_BONUS = 2;
    private static final double PHRASE_BASE_SCORE = 2.0;
    private static final double PHRASE_TOKEN_SCORE = 0.4;
    private static final double PHRASE_COMBINE_BONUS = 0.5;
    private static final int MIN_TERM_LENGTH = 2;

    private static final Comparator<Candidate> BY_SCORE_DESC =
            Comparator.comparingDouble(Candidate::score).reversed();

    private final TokenizerAdapter tokenizer;

    public CandidateExtractor(TokenizerAdapter tokenizer) {
        this.tokenizer = tokenizer;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Extracts scored candidates, best first.
     *
     * @param text    raw text of any length; null or blank yields an empty list
     * @param options ranking options
     * @return at most {@code options.topK()} candidates with unique terms of length ≥ 2
     */
    public List<Candidate> extractCandidates(String text, ExtractionOptions options) {
        if (text == null || text.isBlank()) return List.of();

        List<Morpheme> tokens;
        try {
            tokens = tokenizer.tokenize(stripFurigana(text));
        } catch (RuntimeException e) {
            log.warn("Tokenizer rejected {} chars of input, returning no candidates", text.length(), e);
            return List.of();
        }
        if (tokens == null || tokens.isEmpty()) return List.of();

        List<Candidate> words = rankWords(tokens, options.minFreq());
        List<Candidate> phrases = options.allowPhrases()
                ? rankPhrases(withoutPunctuation(tokens), options.maxNgramLen())
                : List.of();

        List<Candidate> result = combine(words, phrases, options.topK());
        log.debug("Extracted {} candidates ({} words, {} phrases considered) with {}",
                result.size(), words.size(), phrases.size(), options);
        return result;
    }

    /**
     * @return the (term, reading) pairs of {@link #extractCandidates}, in rank order
     */
    public List<RowKey> extract(String text, ExtractionOptions options) {
        return extractCandidates(text, options).stream()
                .map(Candidate::key)
                .toList();
    }

    /**
     * @return canonical rows with empty meaning, example and JLPT, ready for enrichment or merge
     */
    public List<Row> buildRows(String text, ExtractionOptions options) {
        return extractCandidates(text, options).stream()
                .map(c -> RowCanonicalizer.of(c.term(), c.reading()))
                .toList();
    }

    // =========================================================================
    //  Single words
    // =========================================================================

    List<Candidate> rankWords(List<Morpheme> tokens, int minFreq) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        Map<String, Map<String, Integer>> readings = new LinkedHashMap<>();

        for (Morpheme token : tokens) {
            if (isPunctuation(token)) continue;
            if (!token.isNoun() && !token.isVerb() && !token.isAdjective()) continue;

            String headword = token.isNoun() ? token.surface() : token.lemma();
            if (headword == null || headword.isEmpty() || StopTerms.isStopTerm(headword)) continue;

            frequency.merge(headword, 1, Integer::sum);
            readings.computeIfAbsent(headword, k -> new LinkedHashMap<>())
                    .merge(nullToEmpty(token.reading()), 1, Integer::sum);
        }

        List<Candidate> ranked = new ArrayList<>();
        frequency.forEach((headword, count) -> {
            if (count < minFreq) return;
            double score = count + Math.min(MAX_LENGTH_BONUS, length(headword) / 2);
            ranked.add(new Candidate(headword, majorityReading(readings.get(headword)), score,
                    CandidateOrigin.WORD));
        });
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }

    private static String majorityReading(Map<String, Integer> histogram) {
        String best = "";
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : histogram.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    // =========================================================================
    //  Phrases
    // =========================================================================

    List<Candidate> rankPhrases(List<Morpheme> sequence, int maxNgramLen) {
        List<Candidate> phrases = new ArrayList<>();

        // Maximal noun runs
        List<Morpheme> run = new ArrayList<>();
        for (Morpheme token : sequence) {
            if (token.isNoun()) {
                run.add(token);
            } else {
                if (run.size() >= 2) phrases.add(scorePhrase(run));
                run = new ArrayList<>();
            }
        }
        if (run.size() >= 2) phrases.add(scorePhrase(run));

        // Adjective + noun
        for (int i = 0; i + 1 < sequence.size(); i++) {
            if (sequence.get(i).isAdjective() && sequence.get(i + 1).isNoun()) {
                phrases.add(scorePhrase(sequence.subList(i, i + 2)));
            }
        }

        // Noun-heavy n-grams
        for (int n = 2; n <= maxNgramLen; n++) {
            for (int i = 0; i + n <= sequence.size(); i++) {
                List<Morpheme> window = sequence.subList(i, i + n);
                if (window.stream().anyMatch(CandidateExtractor::isPunctuation)) continue;
                if (window.stream().filter(Morpheme::isNoun).count() >= 2) {
                    phrases.add(scorePhrase(window));
                }
            }
        }
        return phrases;
    }

    private static Candidate scorePhrase(List<Morpheme> tokens) {
        StringBuilder term = new StringBuilder();
        StringBuilder reading = new StringBuilder();
        for (Morpheme token : tokens) {
            term.append(token.surface());
            reading.append(nullToEmpty(token.reading()));
        }
        String phrase = term.toString();
        double score = PHRASE_BASE_SCORE
                + PHRASE_TOKEN_SCORE * tokens.size()
                + Math.min(MAX_LENGTH_BONUS, length(phrase) / 3);
        return new Candidate(phrase, reading.toString(), score, CandidateOrigin.PHRASE);
    }

    // =========================================================================
    //  Combine
    // =========================================================================

    private static List<Candidate> combine(List<Candidate> words, List<Candidate> phrases, int topK) {
        Map<String, Candidate> byTerm = new LinkedHashMap<>();
        for (Candidate word : words) {
            byTerm.putIfAbsent(word.term(), word);
        }
        for (Candidate phrase : phrases) {
            if (phrase.term().isEmpty() || StopTerms.isStopTerm(phrase.term())) continue;
            if (!byTerm.containsKey(phrase.term())) {
                byTerm.put(phrase.term(), phrase.withScore(phrase.score() + PHRASE_COMBINE_BONUS));
            }
        }

        List<Candidate> combined = new ArrayList<>(byTerm.values());
        combined.sort(BY_SCORE_DESC);

        return combined.stream()
                .filter(c -> length(c.term()) >= MIN_TERM_LENGTH)
                .limit(topK)
                .toList();
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    static String stripFurigana(String text) {
        return FURIGANA.matcher(text).replaceAll("");
    }

    private static List<Morpheme> withoutPunctuation(List<Morpheme> tokens) {
        return tokens.stream()
                .filter(token -> !isPunctuation(token))
                .toList();
    }

    private static boolean isPunctuation(Morpheme token) {
        return StopTerms.isPunctuation(token.surface()) || Morpheme.SYMBOL.equals(token.partOfSpeech());
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
