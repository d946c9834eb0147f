package com.eainde.vocab.model;

/**
 * One token produced by the tokenizer.
 *
 * @param surface      text as it appears in the input
 * @param lemma        dictionary form; equals surface when the dictionary has none
 * @param partOfSpeech coarse tag, the first level only (e.g. 名詞, 動詞)
 * @param reading      hiragana reading; equals surface for unknown words
 */
public record Morpheme(
        String surface,
        String lemma,
        String partOfSpeech,
        String reading
) {

    public static final String NOUN = "名詞";
    public static final String VERB = "動詞";
    public static final String ADJECTIVE = "形容詞";
    public static final String SYMBOL = "記号";

    public boolean isNoun() {
        return NOUN.equals(partOfSpeech);
    }

    public boolean isVerb() {
        return VERB.equals(partOfSpeech);
    }

    public boolean isAdjective() {
        return ADJECTIVE.equals(partOfSpeech);
    }
}
