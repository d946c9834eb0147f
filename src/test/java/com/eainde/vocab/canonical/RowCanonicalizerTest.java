package com.eainde.vocab.canonical;

import com.eainde.vocab.model.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RowCanonicalizerTest {

    @Nested
    @DisplayName("normalizeJlpt")
    class Jlpt {

        @ParameterizedTest
        @ValueSource(strings = {"n2", " N-2 ", "JLPT N2", "jlpt-n2", "Ｎ２", "N２"})
        void acceptsCommonSpellings(String input) {
            assertThat(RowCanonicalizer.normalizeJlpt(input)).isEqualTo("N2");
        }

        @ParameterizedTest
        @ValueSource(strings = {"N6", "N0", "", "   ", "beginner", "2"})
        void rejectsAnythingElse(String input) {
            assertThat(RowCanonicalizer.normalizeJlpt(input)).isEmpty();
        }

        @Test
        void nullIsEmpty() {
            assertThat(RowCanonicalizer.normalizeJlpt(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("canonicalize")
    class Canonicalize {

        @Test
        void padsShortRecordsAndTrimsFields() {
            // Act
            Row row = RowCanonicalizer.canonicalize(List.of(" 日本 ", "にほん\t"));

            // Assert
            assertThat(row).isEqualTo(new Row("日本", "にほん", "", "", ""));
        }

        @Test
        void ignoresFieldsBeyondTheFifth() {
            Row row = RowCanonicalizer.canonicalize(List.of("祭り", "まつり", "festival", "", "n3", "extra"));

            assertThat(row).isEqualTo(new Row("祭り", "まつり", "festival", "", "N3"));
        }

        @Test
        void nullFieldsBecomeEmpty() {
            Row row = RowCanonicalizer.canonicalize(Arrays.asList("山", null, null));

            assertThat(row.reading()).isEmpty();
            assertThat(row.meaning()).isEmpty();
        }

        @Test
        void nullRecordGivesEmptyRow() {
            assertThat(RowCanonicalizer.canonicalize((List<String>) null))
                    .isEqualTo(new Row("", "", "", "", ""));
            assertThat(RowCanonicalizer.canonicalize((Row) null).hasTerm()).isFalse();
        }

        @Test
        void isIdempotent() {
            Row once = RowCanonicalizer.of("  文化 ", " ぶんか", " culture ", " 文化が好きです。 ", "jlpt n4");

            assertThat(RowCanonicalizer.canonicalize(once)).isEqualTo(once);
            assertThat(once.jlpt()).isEqualTo("N4");
        }

        @Test
        void keepsInnerWhitespace() {
            Row row = RowCanonicalizer.of("伝統 芸能", "", "traditional  arts");

            assertThat(row.term()).isEqualTo("伝統 芸能");
            assertThat(row.meaning()).isEqualTo("traditional  arts");
        }
    }
}
