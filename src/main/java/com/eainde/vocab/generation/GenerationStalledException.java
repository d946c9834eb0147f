package com.eainde.vocab.generation;

import com.eainde.vocab.error.VocabularyException;

/**
 * Too many consecutive rounds produced nothing new.
 */
public class GenerationStalledException extends VocabularyException {

    private final String topic;
    private final int rounds;

    public GenerationStalledException(String topic, int rounds) {
        super("Generation for topic '" + topic + "' stalled after " + rounds + " rounds without new items");
        this.topic = topic;
        this.rounds = rounds;
    }

    public String topic() {
        return topic;
    }

    public int rounds() {
        return rounds;
    }
}
