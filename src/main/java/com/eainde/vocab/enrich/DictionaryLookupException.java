package com.eainde.vocab.enrich;

import com.eainde.vocab.error.VocabularyException;

public class DictionaryLookupException extends VocabularyException {

    public DictionaryLookupException(String message) {
        super(message);
    }

    public DictionaryLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
