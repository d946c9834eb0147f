package com.eainde.vocab.error;

/**
 * Root of all failures raised by the vocabulary pipeline.
 */
public class VocabularyException extends RuntimeException {

    public VocabularyException(String message) {
        super(message);
    }

    public VocabularyException(String message, Throwable cause) {
        super(message, cause);
    }
}
