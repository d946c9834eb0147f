package com.eainde.vocab.tokenizer;

import com.eainde.vocab.model.Morpheme;

import java.util.List;

/**
 * Morphological tokenizer seam used by the candidate extractor.
 */
public interface TokenizerAdapter {

    /**
     * @param text raw Japanese text, may be empty
     * @return morphemes in input order; empty for empty input, never null
     */
    List<Morpheme> tokenize(String text);
}
