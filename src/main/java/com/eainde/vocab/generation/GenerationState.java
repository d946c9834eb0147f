package com.eainde.vocab.generation;

public enum GenerationState {
    COLLECTING,
    DONE,
    STALLED,
    CAPPED,
    CANCELLED
}
