package com.eainde.vocab.generation;

import com.eainde.vocab.model.RowKey;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * @param topic   topic to generate for
 * @param target  exact number of unique rows wanted
 * @param gptOnly skip dictionary enrichment when true
 * @param avoid   keys the result must not contain, typically the current table
 */
public record GenerationRequest(
        String topic,
        int target,
        boolean gptOnly,
        Set<RowKey> avoid
) {

    public GenerationRequest {
        topic = topic != null ? topic.strip() : "";
        avoid = avoid != null ? new LinkedHashSet<>(avoid) : new LinkedHashSet<>();
    }

    public static GenerationRequest of(String topic, int target) {
        return new GenerationRequest(topic, target, false, Set.of());
    }
}
