package com.eainde.vocab.model;

public enum CandidateOrigin {
    WORD,
    PHRASE
}
