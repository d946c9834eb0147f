package com.eainde.vocab;

import com.eainde.vocab.extraction.ExtractionOptions;
import com.eainde.vocab.generation.GenerationProgressListener;
import com.eainde.vocab.generation.GenerationState;
import com.eainde.vocab.merge.MergeResult;
import com.eainde.vocab.service.GenerationTask;
import com.eainde.vocab.service.VocabularyTableService;
import com.eainde.vocab.table.CsvTableCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Command-line front end.
 *
 * <pre>
 *   --in=table.csv          load an existing table first
 *   --extract=article.txt   extract candidates from a text file
 *   --paste=glossary.txt    import a pasted glossary
 *   --topic="Weather" --count=30 [--gpt-only] [--replace]
 *   --enrich [--overwrite]  look every row up in the dictionary
 *   --out=table.csv         write the resulting table
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VocabCommandLine implements ApplicationRunner {

    private static final int DEFAULT_COUNT = 30;

    private final VocabularyTableService tableService;
    private final CsvTableCodec csvTableCodec;
    private final ExtractionOptions extractionOptions;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (args.getOptionNames().isEmpty()) {
            log.info("Nothing to do. Options: --in=<csv> --extract=<file> --paste=<file> "
                    + "--topic=<topic> [--count=<n>] [--gpt-only] [--replace] --enrich [--overwrite] --out=<csv>");
            return;
        }

        String in = option(args, "in");
        if (in != null) {
            MergeResult loaded = tableService.replaceRows(csvTableCodec.readFile(Path.of(in)));
            log.info("Loaded {} rows from {}", loaded.rows().size(), in);
        }

        String extract = option(args, "extract");
        if (extract != null) {
            report("extract", tableService.extractFromText(readText(extract), extractionOptions));
        }

        String paste = option(args, "paste");
        if (paste != null) {
            report("paste", tableService.importPasted(readText(paste)));
        }

        String topic = option(args, "topic");
        if (topic != null) {
            generate(topic, args);
        }

        if (args.containsOption("enrich")) {
            enrich(!args.containsOption("overwrite"));
        }

        String out = option(args, "out");
        if (out != null) {
            csvTableCodec.writeFile(tableService.rows(), Path.of(out));
        }
    }

    private void generate(String topic, ApplicationArguments args) {
        String countOption = option(args, "count");
        int count = DEFAULT_COUNT;
        if (countOption != null) {
            try {
                count = Integer.parseInt(countOption.strip());
            } catch (NumberFormatException e) {
                log.error("Skipping topic '{}': --count must be a whole number, got '{}'", topic, countOption);
                return;
            }
        }
        boolean gptOnly = args.containsOption("gpt-only");
        boolean append = !args.containsOption("replace");

        GenerationTask task = tableService.generateFromTopic(topic, count, gptOnly, append,
                new ConsoleProgress());
        try {
            report("topic '" + topic + "'", task.result().join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Generation task {} for '{}' failed: {}", task.taskId(), topic, cause.getMessage());
        }
    }

    private void enrich(boolean onlyFillEmpty) {
        GenerationTask task = tableService.enrichTable(onlyFillEmpty,
                (row, hits, total) -> log.info("Jisho {}/{} ({} found)", row, total, hits));
        try {
            report("jisho", task.result().join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Dictionary task {} failed: {}", task.taskId(), cause.getMessage());
        }
    }

    private static void report(String source, MergeResult result) {
        log.info("{}: {} added, {} updated, table now {} rows",
                source, result.added(), result.updated(), result.rows().size());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static String readText(String file) throws IOException {
        return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    }

    private static final class ConsoleProgress implements GenerationProgressListener {

        @Override
        public void onRound(int round, int collected, int target) {
            log.info("Round {}: {}/{} unique rows", round, collected, target);
        }

        @Override
        public void onState(GenerationState state) {
            log.debug("Generation state {}", state);
        }
    }
}
