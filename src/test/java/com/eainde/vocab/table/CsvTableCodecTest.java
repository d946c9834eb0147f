package com.eainde.vocab.table;

import com.eainde.vocab.model.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvTableCodecTest {

    private final CsvTableCodec codec = new CsvTableCodec();

    @Test
    void narrowTablesGetThreeColumns() {
        // Act
        String csv = codec.write(List.of(Row.of("日本", "にほん"), new Row("山", "やま", "mountain", "", "")));

        // Assert
        assertThat(csv.lines()).containsExactly("Term,Reading,Meaning", "日本,にほん,", "山,やま,mountain");
    }

    @Test
    void anyExampleOrLevelWidensTheTable() {
        String csv = codec.write(List.of(Row.of("日本", "にほん"), new Row("山", "やま", "", "", "N5")));

        assertThat(csv.lines()).containsExactly("Term,Reading,Meaning,Example,JLPT", "日本,にほん,,,", "山,やま,,,N5");
    }

    @Test
    void valuesWithSeparatorsSurviveTheRoundTrip() {
        List<Row> rows = List.of(
                new Row("日本", "にほん", "Japan, Japanese state", "\"日本\"は国です。", "N5"),
                new Row("祭り", "まつり", "festival\nfair", "", ""));

        assertThat(codec.read(codec.write(rows))).isEqualTo(rows);
    }

    @Test
    void readingPadsShortRowsSkipsBlankOnesAndCanonicalizes() {
        String csv = """
                Term,Reading,Meaning,Example,JLPT
                 日本 ,にほん
                ,,,,
                                
                山,やま,mountain,,n5
                """;

        assertThat(codec.read(csv)).containsExactly(
                new Row("日本", "にほん", "", "", ""),
                new Row("山", "やま", "mountain", "", "N5"));
    }

    @Test
    void headerOnlyGivesNoRows() {
        assertThat(codec.read("Term,Reading,Meaning\n")).isEmpty();
        assertThat(codec.read("")).isEmpty();
    }

    @Test
    void filesCarryAByteOrderMarkThatReadingSkips(@TempDir Path dir) throws IOException {
        // Arrange
        Path file = dir.resolve("vocab.csv");
        List<Row> rows = List.of(new Row("文化", "ぶんか", "culture", "", ""));

        // Act
        codec.writeFile(rows, file);

        // Assert
        byte[] bytes = Files.readAllBytes(file);
        assertThat(bytes).startsWith((byte) 0xEF, (byte) 0xBB, (byte) 0xBF);
        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("Term,Reading,Meaning");
        assertThat(codec.readFile(file)).isEqualTo(rows);
    }

    @Test
    void stringsWithALeadingByteOrderMarkAreRead() {
        assertThat(codec.read("\uFEFFTerm,Reading,Meaning\n日本,にほん,Japan\n"))
                .containsExactly(new Row("日本", "にほん", "Japan", "", ""));
    }
}
