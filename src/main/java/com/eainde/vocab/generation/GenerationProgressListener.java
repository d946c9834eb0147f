package com.eainde.vocab.generation;

/**
 * Receives progress from {@link UniqueRowGenerator}. Called on the generating thread.
 */
public interface GenerationProgressListener {

    GenerationProgressListener NOOP = (round, collected, target) -> { };

    void onRound(int round, int collected, int target);

    default void onState(GenerationState state) {
    }
}
