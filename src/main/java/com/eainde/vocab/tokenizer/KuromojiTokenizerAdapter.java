package com.eainde.vocab.tokenizer;

import com.atilika.kuromoji.ipadic.Token;
import com.atilika.kuromoji.ipadic.Tokenizer;
import com.eainde.vocab.model.Morpheme;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link TokenizerAdapter} backed by Kuromoji with the IPADIC dictionary.
 *
 * <p>IPADIC marks missing features with {@code "*"}; those fall back to the surface form.
 * The part-of-speech tag is reduced to its first level ({@code 名詞-一般} → {@code 名詞}).</p>
 *
 * <p>The underlying {@link Tokenizer} is thread-safe and expensive to build, so one instance
 * is created per adapter and shared.</p>
 */
public class KuromojiTokenizerAdapter implements TokenizerAdapter {

    private static final String UNKNOWN = "*";

    private final Tokenizer tokenizer;

    public KuromojiTokenizerAdapter() {
        this(new Tokenizer());
    }

    public KuromojiTokenizerAdapter(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public List<Morpheme> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<Token> tokens = tokenizer.tokenize(text);
        List<Morpheme> morphemes = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            morphemes.add(toMorpheme(token));
        }
        return morphemes;
    }

    private Morpheme toMorpheme(Token token) {
        String surface = token.getSurface();
        String lemma = orElse(token.getBaseForm(), surface);
        String pos = orElse(token.getPartOfSpeechLevel1(), "");
        String reading = KanaConverter.katakanaToHiragana(orElse(token.getReading(), surface));
        return new Morpheme(surface, lemma, pos, reading);
    }

    private static String orElse(String feature, String fallback) {
        return feature == null || feature.isEmpty() || UNKNOWN.equals(feature) ? fallback : feature;
    }
}
