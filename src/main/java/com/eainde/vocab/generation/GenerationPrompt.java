package com.eainde.vocab.generation;

import com.eainde.vocab.model.RowKey;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One structured request to the {@link VocabularyGenerator}.
 *
 * @param topic topic or theme of the requested vocabulary
 * @param count number of items to ask for
 * @param avoid (term, reading) pairs that must not appear in the reply
 * @param rules guidance lines for the generator
 */
public record GenerationPrompt(
        String topic,
        int count,
        List<RowKey> avoid,
        List<String> rules
) {

    public GenerationPrompt {
        avoid = List.copyOf(avoid);
        rules = List.copyOf(rules);
    }

    /**
     * @return avoid pairs rendered as {@code term|reading} joined with {@code "; "}
     */
    public String avoidPairs() {
        return avoid.stream().map(RowKey::render).collect(Collectors.joining("; "));
    }
}
