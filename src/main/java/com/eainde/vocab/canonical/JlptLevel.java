package com.eainde.vocab.canonical;

import java.util.Arrays;
import java.util.Optional;

/**
 * JLPT proficiency tiers, N5 easiest to N1 hardest.
 */
public enum JlptLevel {
    N5, N4, N3, N2, N1;

    /**
     * @param symbol an already normalized symbol such as {@code "N3"}
     * @return the level, or empty when the symbol is not one of the five tiers
     */
    public static Optional<JlptLevel> fromSymbol(String symbol) {
        if (symbol == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(level -> level.name().equals(symbol))
                .findFirst();
    }
}
