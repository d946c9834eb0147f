package com.eainde.vocab;

import com.eainde.vocab.enrich.DictionaryLookup;
import com.eainde.vocab.extraction.CandidateExtractor;
import com.eainde.vocab.extraction.ExtractionOptions;
import com.eainde.vocab.generation.UniqueRowGenerator;
import com.eainde.vocab.merge.MergeEngine;
import com.eainde.vocab.merge.MergePolicy;
import com.eainde.vocab.model.Row;
import com.eainde.vocab.paste.GlossaryBlobParser;
import com.eainde.vocab.service.VocabularyTableService;
import com.eainde.vocab.table.CsvTableCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class VocabCommandLineTest {

    @TempDir
    Path dir;

    private final CsvTableCodec codec = new CsvTableCodec();
    private final UniqueRowGenerator generator = mock(UniqueRowGenerator.class);
    private final DictionaryLookup dictionaryLookup = mock(DictionaryLookup.class);
    private VocabularyTableService service;
    private VocabCommandLine commandLine;

    @BeforeEach
    void setUp() {
        service = new VocabularyTableService(new CandidateExtractor(text -> List.of()), new GlossaryBlobParser(),
                generator, dictionaryLookup, new MergeEngine(), Runnable::run, MergePolicy.FILL_BLANK_ONLY);
        commandLine = new VocabCommandLine(service, codec, ExtractionOptions.defaults());
    }

    @Test
    void loadsPastesAndWritesTheTable() throws Exception {
        // Arrange
        Path in = dir.resolve("in.csv");
        codec.writeFile(List.of(new Row("日本", "にほん", "", "", "")), in);
        Path paste = dir.resolve("paste.txt");
        Files.writeString(paste, "日本 (にほん) Japan 祭り (まつり) festival", StandardCharsets.UTF_8);
        Path out = dir.resolve("out.csv");

        // Act
        commandLine.run(new DefaultApplicationArguments("--in=" + in, "--paste=" + paste, "--out=" + out));

        // Assert
        assertThat(codec.readFile(out)).containsExactly(
                new Row("日本", "にほん", "Japan", "", ""),
                new Row("祭り", "まつり", "festival", "", ""));
        verifyNoInteractions(generator);
    }

    @Test
    void noOptionsDoesNothing() throws Exception {
        commandLine.run(new DefaultApplicationArguments());

        assertThat(service.rows()).isEmpty();
    }

    @Test
    void aCountThatIsNotANumberSkipsGenerationInsteadOfFailing() {
        DefaultApplicationArguments args = new DefaultApplicationArguments("--topic=food", "--count=ten");

        assertThatCode(() -> commandLine.run(args)).doesNotThrowAnyException();

        verifyNoInteractions(generator);
        assertThat(service.rows()).isEmpty();
    }

    @Test
    void enrichFillsEmptyFieldsFromTheDictionary() throws Exception {
        // Arrange
        Path in = dir.resolve("in.csv");
        codec.writeFile(List.of(new Row("日本", "にほん", "Nippon", "", "")), in);
        Path out = dir.resolve("out.csv");
        when(dictionaryLookup.lookup("日本", "にほん"))
                .thenReturn(Optional.of(new Row("日本", "にほん", "Japan", "日本は島国です。", "N5")));

        // Act
        commandLine.run(new DefaultApplicationArguments("--in=" + in, "--enrich", "--out=" + out));

        // Assert
        assertThat(codec.readFile(out)).containsExactly(new Row("日本", "にほん", "Nippon", "日本は島国です。", "N5"));
    }
}
