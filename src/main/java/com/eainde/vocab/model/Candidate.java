package com.eainde.vocab.model;

/**
 * A scored (term, reading) proposal from the extractor.
 *
 * @param term    headword or concatenated phrase
 * @param reading hiragana reading
 * @param score   ranking score, higher first
 * @param origin  single word or multi-token phrase
 */
public record Candidate(
        String term,
        String reading,
        double score,
        CandidateOrigin origin
) {

    public Candidate withScore(double newScore) {
        return new Candidate(term, reading, newScore, origin);
    }

    public RowKey key() {
        return new RowKey(term, reading);
    }
}
