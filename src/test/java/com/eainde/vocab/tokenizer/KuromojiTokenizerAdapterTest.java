package com.eainde.vocab.tokenizer;

import com.eainde.vocab.model.Morpheme;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KuromojiTokenizerAdapterTest {

    private static KuromojiTokenizerAdapter adapter;

    @BeforeAll
    static void setUp() {
        adapter = new KuromojiTokenizerAdapter();
    }

    @Test
    void mapsCoarsePosAndHiraganaReading() {
        List<Morpheme> morphemes = adapter.tokenize("猫が好きです");

        Morpheme cat = morphemes.get(0);
        assertThat(cat.surface()).isEqualTo("猫");
        assertThat(cat.partOfSpeech()).isEqualTo(Morpheme.NOUN);
        assertThat(cat.reading()).isEqualTo("ねこ");
        assertThat(cat.isNoun()).isTrue();
    }

    @Test
    void verbsCarryTheirDictionaryForm() {
        List<Morpheme> morphemes = adapter.tokenize("食べました");

        assertThat(morphemes.get(0).surface()).isEqualTo("食べ");
        assertThat(morphemes.get(0).lemma()).isEqualTo("食べる");
        assertThat(morphemes.get(0).isVerb()).isTrue();
    }

    @Test
    void emptyInputGivesEmptyList() {
        assertThat(adapter.tokenize("")).isEmpty();
        assertThat(adapter.tokenize(null)).isEmpty();
    }
}
