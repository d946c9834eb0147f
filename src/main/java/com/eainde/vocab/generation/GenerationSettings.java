package com.eainde.vocab.generation;

/**
 * Loop limits for {@link UniqueRowGenerator}.
 *
 * @param maxRounds   regular rounds before the final catch-up request
 * @param stallRounds consecutive rounds without new items before giving up
 * @param avoidLimit  maximum avoid pairs sent per request
 * @param finalSlack  extra items requested in the final catch-up request
 */
public record GenerationSettings(int maxRounds, int stallRounds, int avoidLimit, int finalSlack) {

    public static final GenerationSettings DEFAULTS = new GenerationSettings(12, 5, 250, 10);

    public GenerationSettings {
        if (maxRounds < 1) throw new IllegalArgumentException("maxRounds must be >= 1");
        if (stallRounds < 1) throw new IllegalArgumentException("stallRounds must be >= 1");
        if (avoidLimit < 0) throw new IllegalArgumentException("avoidLimit must be >= 0");
        if (finalSlack < 0) throw new IllegalArgumentException("finalSlack must be >= 0");
    }
}
