package com.eainde.vocab.config;

import com.eainde.vocab.enrich.DictionaryLookup;
import com.eainde.vocab.enrich.JishoDictionaryLookup;
import com.eainde.vocab.extraction.CandidateExtractor;
import com.eainde.vocab.extraction.ExtractionOptions;
import com.eainde.vocab.generation.ChatModelVocabularyGenerator;
import com.eainde.vocab.generation.GenerationGuidance;
import com.eainde.vocab.generation.GenerationSettings;
import com.eainde.vocab.generation.RetryPolicy;
import com.eainde.vocab.generation.Sleeper;
import com.eainde.vocab.generation.UniqueRowGenerator;
import com.eainde.vocab.generation.VocabularyGenerator;
import com.eainde.vocab.merge.MergeEngine;
import com.eainde.vocab.merge.MergePolicy;
import com.eainde.vocab.parse.LenientJsonParser;
import com.eainde.vocab.paste.GlossaryBlobParser;
import com.eainde.vocab.service.VocabularyTableService;
import com.eainde.vocab.table.CsvTableCodec;
import com.eainde.vocab.thread.MdcAwareExecutor;
import com.eainde.vocab.tokenizer.KuromojiTokenizerAdapter;
import com.eainde.vocab.tokenizer.TokenizerAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the vocabulary pipeline from {@code vocab.*} properties.
 *
 * <p>The chat model is lazy: extraction, paste import and CSV work run without an API key,
 * the model is only built on the first generation request.</p>
 */
@Slf4j
@Configuration
public class VocabConfig {

    // ── OpenAI ──────────────────────────────────────────────────────────
    @Value("${vocab.openai.api-key:}")
    private String openAiApiKey;

    @Value("${vocab.openai.model-name:gpt-4o-mini}")
    private String openAiModelName;

    @Value("${vocab.openai.temperature:0.4}")
    private double openAiTemperature;

    @Value("${vocab.openai.timeout:60s}")
    private Duration openAiTimeout;

    // ── Generation loop ─────────────────────────────────────────────────
    @Value("${vocab.generation.max-rounds:12}")
    private int maxRounds;

    @Value("${vocab.generation.stall-rounds:5}")
    private int stallRounds;

    @Value("${vocab.generation.avoid-limit:250}")
    private int avoidLimit;

    @Value("${vocab.generation.final-slack:10}")
    private int finalSlack;

    @Value("${vocab.generation.backoff-step:200ms}")
    private Duration roundBackoffStep;

    @Value("${vocab.generation.batch-attempts:3}")
    private int batchAttempts;

    @Value("${vocab.generation.batch-backoff-step:400ms}")
    private Duration batchBackoffStep;

    // ── Extraction ──────────────────────────────────────────────────────
    @Value("${vocab.extraction.top-k:80}")
    private int topK;

    @Value("${vocab.extraction.min-freq:2}")
    private int minFreq;

    @Value("${vocab.extraction.allow-phrases:true}")
    private boolean allowPhrases;

    @Value("${vocab.extraction.max-ngram-len:3}")
    private int maxNgramLen;

    // ── Jisho ───────────────────────────────────────────────────────────
    @Value("${vocab.jisho.base-url:" + JishoDictionaryLookup.DEFAULT_BASE_URL + "}")
    private String jishoBaseUrl;

    @Value("${vocab.jisho.timeout:10s}")
    private Duration jishoTimeout;

    // =========================================================================
    //  Extraction
    // =========================================================================

    @Bean
    public TokenizerAdapter tokenizerAdapter() {
        return new KuromojiTokenizerAdapter();
    }

    @Bean
    public CandidateExtractor candidateExtractor(TokenizerAdapter tokenizerAdapter) {
        return new CandidateExtractor(tokenizerAdapter);
    }

    @Bean
    public ExtractionOptions extractionOptions() {
        return ExtractionOptions.builder()
                .topK(topK)
                .minFreq(minFreq)
                .allowPhrases(allowPhrases)
                .maxNgramLen(maxNgramLen)
                .build();
    }

    // =========================================================================
    //  Generation
    // =========================================================================

    @Bean
    @Lazy
    public ChatModel chatModel() {
        if (openAiApiKey == null || openAiApiKey.isBlank()) {
            throw new IllegalStateException("vocab.openai.api-key is not set; topic generation needs an OpenAI key");
        }
        log.info("Building OpenAI chat model '{}' (temperature={}, timeout={})",
                openAiModelName, openAiTemperature, openAiTimeout);
        return OpenAiChatModel.builder()
                .apiKey(openAiApiKey)
                .modelName(openAiModelName)
                .temperature(openAiTemperature)
                .timeout(openAiTimeout)
                .build();
    }

    @Bean
    public VocabularyGenerator vocabularyGenerator(@Lazy ChatModel chatModel, ObjectMapper objectMapper) {
        return new ChatModelVocabularyGenerator(chatModel, objectMapper, openAiTemperature);
    }

    @Bean
    public LenientJsonParser lenientJsonParser(ObjectMapper objectMapper) {
        return new LenientJsonParser(objectMapper);
    }

    @Bean
    public OkHttpClient jishoHttpClient() {
        return new OkHttpClient.Builder()
                .callTimeout(jishoTimeout)
                .build();
    }

    @Bean
    public DictionaryLookup dictionaryLookup(OkHttpClient jishoHttpClient, ObjectMapper objectMapper) {
        return new JishoDictionaryLookup(jishoHttpClient, jishoBaseUrl, objectMapper);
    }

    @Bean
    public UniqueRowGenerator uniqueRowGenerator(VocabularyGenerator vocabularyGenerator,
                                                 LenientJsonParser lenientJsonParser,
                                                 DictionaryLookup dictionaryLookup) {
        return new UniqueRowGenerator(
                vocabularyGenerator,
                lenientJsonParser,
                dictionaryLookup,
                new GenerationGuidance(),
                new GenerationSettings(maxRounds, stallRounds, avoidLimit, finalSlack),
                new RetryPolicy(1, roundBackoffStep),
                new RetryPolicy(batchAttempts, batchBackoffStep),
                Sleeper.SYSTEM);
    }

    // =========================================================================
    //  Table
    // =========================================================================

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor generationExecutor() {
        return MdcAwareExecutor.daemonPool("vocab-gen");
    }

    @Bean
    public MergeEngine mergeEngine() {
        return new MergeEngine();
    }

    @Bean
    public GlossaryBlobParser glossaryBlobParser() {
        return new GlossaryBlobParser();
    }

    @Bean
    public CsvTableCodec csvTableCodec() {
        return new CsvTableCodec();
    }

    @Bean
    public VocabularyTableService vocabularyTableService(CandidateExtractor candidateExtractor,
                                                         GlossaryBlobParser glossaryBlobParser,
                                                         UniqueRowGenerator uniqueRowGenerator,
                                                         DictionaryLookup dictionaryLookup,
                                                         MergeEngine mergeEngine,
                                                         Executor generationExecutor) {
        return new VocabularyTableService(candidateExtractor, glossaryBlobParser, uniqueRowGenerator,
                dictionaryLookup, mergeEngine, generationExecutor, MergePolicy.FILL_BLANK_ONLY);
    }
}
