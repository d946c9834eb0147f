package com.eainde.vocab.generation;

import com.eainde.vocab.error.VocabularyException;

public class GenerationCancelledException extends VocabularyException {

    public GenerationCancelledException(String message) {
        super(message);
    }

    public GenerationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
