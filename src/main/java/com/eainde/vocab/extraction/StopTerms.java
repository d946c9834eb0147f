package com.eainde.vocab.extraction;

import java.util.Set;

/**
 * Fixed vocabulary filters for extraction.
 */
public final class StopTerms {

    /** High-frequency function-like words that make poor vocabulary entries. */
    public static final Set<String> TERMS = Set.of(
            "する", "ある", "いる", "こと", "もの", "これ", "それ", "あれ", "ため", "よう",
            "さん", "できる", "なる", "及び", "また", "など", "ようだ", "ように", "そして");

    /** Japanese and ASCII punctuation plus whitespace, compared against whole token surfaces. */
    public static final Set<String> PUNCTUATION = Set.of(
            "。", "．", "、", "，", "・", "！", "？", "!", "?", "（", "）", "(", ")",
            "［", "］", "[", "]", "{", "}", "：", "；", "「", "」", "『", "』", "…", "—", "-",
            " ", "\n", "\t", "\r");

    private StopTerms() {
    }

    public static boolean isStopTerm(String term) {
        return TERMS.contains(term);
    }

    public static boolean isPunctuation(String surface) {
        return PUNCTUATION.contains(surface);
    }
}
