package com.eainde.vocab.generation;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule lines sent with every batch. Later rounds add rules that push the generator
 * towards less common items, so repeated requests stop returning the same words.
 */
public class GenerationGuidance {

    static final List<String> BASE_RULES = List.of(
            "Return unique items only; no duplicates within output.",
            "Do not include any pair present in 'avoid_pairs'.",
            "reading must be kana (hiragana/katakana).",
            "example must be 1 short-medium, natural Japanese sentence using the term.",
            "meaning should be brief English. Can have two or more meanings, or subtly different words "
                    + "e.g., Harm, damage.",
            "jlpt is one of N5,N4,N3,N2,N1 or empty if unknown.",
            "Try to create list of words based on knowledge base, however, can reference web articles "
                    + "and other reputable sources if needed for inspiration.",
            "If user states that they want a list of phrases, they will start topic with Phrases about.");

    static final String SPECIFIC = "Choose more specific or less common items still clearly within the topic.";
    static final String ADJACENT = "Consider adjacent subtopics to avoid repeats while staying relevant.";
    static final String DIVERSIFY = "Avoid very high-frequency duplicates; diversify parts of speech.";

    public List<String> rulesFor(int round) {
        List<String> rules = new ArrayList<>(BASE_RULES);
        if (round >= 3) rules.add(SPECIFIC);
        if (round >= 6) rules.add(ADJACENT);
        if (round >= 9) rules.add(DIVERSIFY);
        return rules;
    }
}
