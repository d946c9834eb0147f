package com.eainde.vocab.generation;

import com.eainde.vocab.error.VocabularyException;

/**
 * A reply parsed cleanly but held no usable items.
 */
public class EmptyYieldException extends VocabularyException {

    public EmptyYieldException(String topic, int round) {
        super("Round " + round + " for topic '" + topic + "' yielded no usable items");
    }
}
