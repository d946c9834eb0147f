package com.eainde.vocab.merge;

import com.eainde.vocab.model.Row;
import com.eainde.vocab.model.RowKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MergeEngineTest {

    private final MergeEngine engine = new MergeEngine();

    private static Row row(String term, String reading, String meaning, String example, String jlpt) {
        return new Row(term, reading, meaning, example, jlpt);
    }

    @Nested
    @DisplayName("Policies")
    class Policies {

        private final List<Row> existing = List.of(
                row("日本", "にほん", "Japan", "", ""),
                row("文化", "ぶんか", "", "", "N4"));

        private final List<Row> incoming = List.of(
                row("日本", "にほん", "Nippon", "日本に住んでいます。", "N5"),
                row("文化", "ぶんか", "culture", "", "N3"));

        @Test
        void fillBlankOnlyKeepsPopulatedFields() {
            // Act
            MergeResult result = engine.merge(existing, incoming, MergePolicy.FILL_BLANK_ONLY);

            // Assert
            assertThat(result.rows()).containsExactly(
                    row("日本", "にほん", "Japan", "日本に住んでいます。", "N5"),
                    row("文化", "ぶんか", "culture", "", "N4"));
            assertThat(result.added()).isZero();
            assertThat(result.updated()).isEqualTo(2);
        }

        @Test
        void preferIncomingOverwritesWithNonEmptyValues() {
            MergeResult result = engine.merge(existing, incoming, MergePolicy.PREFER_INCOMING);

            assertThat(result.rows()).containsExactly(
                    row("日本", "にほん", "Nippon", "日本に住んでいます。", "N5"),
                    row("文化", "ぶんか", "culture", "", "N3"));
            assertThat(result.updated()).isEqualTo(2);
        }

        @Test
        void preferIncomingNeverBlanksAField() {
            MergeResult result = engine.merge(
                    List.of(row("山", "やま", "mountain", "山に登る。", "N5")),
                    List.of(row("山", "やま", "", "", "")),
                    MergePolicy.PREFER_INCOMING);

            assertThat(result.rows()).containsExactly(row("山", "やま", "mountain", "山に登る。", "N5"));
            assertThat(result.updated()).isZero();
            assertThat(result.changed()).isFalse();
        }

        @Test
        void conflictAwareReplacesOnlyDifferingValues() {
            MergeResult result = engine.merge(
                    List.of(row("山", "やま", "mountain", "", "N5")),
                    List.of(row("山", "やま", "mountain", "山に登る。", "")),
                    MergePolicy.CONFLICT_AWARE);

            assertThat(result.rows()).containsExactly(row("山", "やま", "mountain", "山に登る。", "N5"));
            assertThat(result.updated()).isEqualTo(1);
        }

        @Test
        void nullPolicyMeansFillBlankOnly() {
            MergeResult result = engine.merge(existing, incoming, null);

            assertThat(result.rows().get(0).meaning()).isEqualTo("Japan");
        }
    }

    @Nested
    @DisplayName("Keys and ordering")
    class Keys {

        @Test
        void appendsUnknownKeysInIncomingOrder() {
            // Arrange
            List<Row> existing = List.of(row("日本", "にほん", "Japan", "", ""));
            List<Row> incoming = List.of(
                    row("祭り", "まつり", "festival", "", ""),
                    row("日本", "にっぽん", "Japan", "", ""),
                    row("地域", "ちいき", "region", "", ""));

            // Act
            MergeResult result = engine.merge(existing, incoming);

            // Assert
            assertThat(result.rows()).extracting(Row::term).containsExactly("日本", "祭り", "日本", "地域");
            assertThat(result.addedKeys()).containsExactly(
                    new RowKey("祭り", "まつり"), new RowKey("日本", "にっぽん"), new RowKey("地域", "ちいき"));
            assertThat(result.added()).isEqualTo(3);
        }

        @Test
        void duplicateIncomingKeysAreAddedOnce() {
            MergeResult result = engine.merge(List.of(), List.of(
                    row("祭り", "まつり", "", "", ""),
                    row(" 祭り ", "まつり", "festival", "", "")));

            assertThat(result.rows()).containsExactly(row("祭り", "まつり", "festival", "", ""));
            assertThat(result.added()).isEqualTo(1);
            assertThat(result.updated()).isEqualTo(1);
        }

        @Test
        void canonicalizesBeforeMatching() {
            MergeResult result = engine.merge(
                    List.of(row("日本 ", " にほん", "", "", "")),
                    List.of(row("日本", "にほん", "", "", "jlpt n5")));

            assertThat(result.rows()).containsExactly(row("日本", "にほん", "", "", "N5"));
            assertThat(result.added()).isZero();
        }

        @Test
        void emptyTermsAreKeptButNeverMatchedOrAdded() {
            MergeResult result = engine.merge(
                    List.of(row("", "", "orphan", "", "")),
                    List.of(row("", "", "ignored", "", ""), row("山", "やま", "", "", "")));

            assertThat(result.rows()).containsExactly(
                    row("", "", "orphan", "", ""),
                    row("山", "やま", "", "", ""));
            assertThat(result.added()).isEqualTo(1);
        }

        @Test
        void neverDeletesRows() {
            List<Row> existing = List.of(row("日本", "にほん", "", "", ""), row("山", "やま", "", "", ""));

            MergeResult result = engine.merge(existing, List.of());

            assertThat(result.rows()).containsExactlyElementsOf(existing);
            assertThat(result.changed()).isFalse();
        }

        @Test
        void nullInputsAreTreatedAsEmpty() {
            MergeResult result = engine.merge(null, null);

            assertThat(result.rows()).isEmpty();
        }
    }

    @Test
    void mergingTheSameRowsTwiceChangesNothing() {
        // Arrange
        List<Row> incoming = List.of(
                row("日本", "にほん", "Japan", "", "N5"),
                row("祭り", "まつり", "festival", "祭りに行く。", ""));
        MergeResult first = engine.merge(List.of(), incoming, MergePolicy.PREFER_INCOMING);

        // Act
        MergeResult second = engine.merge(first.rows(), incoming, MergePolicy.PREFER_INCOMING);

        // Assert
        assertThat(second.rows()).isEqualTo(first.rows());
        assertThat(second.added()).isZero();
        assertThat(second.updated()).isZero();
    }

    @Test
    void resultKeysStayUnique() {
        MergeResult result = engine.merge(
                List.of(row("日本", "にほん", "", "", "")),
                List.of(row("日本", "にほん", "", "", ""), row("日本", "にほん", "Japan", "", ""),
                        row("山", "やま", "", "", ""), row("山", "やま", "", "", "")));

        assertThat(result.rows()).extracting(Row::key).doesNotHaveDuplicates();
    }
}
