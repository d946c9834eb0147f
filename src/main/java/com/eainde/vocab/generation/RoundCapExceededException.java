package com.eainde.vocab.generation;

import com.eainde.vocab.error.VocabularyException;

/**
 * The round cap and the final catch-up request were spent without reaching the target.
 */
public class RoundCapExceededException extends VocabularyException {

    private final String topic;
    private final int shortfall;

    public RoundCapExceededException(String topic, int shortfall) {
        super("Generation for topic '" + topic + "' ended " + shortfall + " items short of the target");
        this.topic = topic;
        this.shortfall = shortfall;
    }

    public String topic() {
        return topic;
    }

    public int shortfall() {
        return shortfall;
    }
}
