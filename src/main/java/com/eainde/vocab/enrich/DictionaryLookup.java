package com.eainde.vocab.enrich;

import com.eainde.vocab.model.Row;

import java.util.Optional;

/**
 * Best-effort dictionary source used to enrich generated rows.
 */
public interface DictionaryLookup {

    /**
     * @param term        headword to look up
     * @param readingHint kana reading tried when the term alone finds nothing, may be empty
     * @return a row with whatever the dictionary knows, or empty when nothing matched
     * @throws DictionaryLookupException on transport or response errors
     */
    Optional<Row> lookup(String term, String readingHint);
}
