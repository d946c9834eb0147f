package com.eainde.vocab.config;

import com.eainde.vocab.VocabApplication;
import com.eainde.vocab.extraction.ExtractionOptions;
import com.eainde.vocab.generation.UniqueRowGenerator;
import com.eainde.vocab.service.VocabularyTableService;
import com.eainde.vocab.table.CsvTableCodec;
import com.eainde.vocab.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "vocab.openai.api-key=",
        "vocab.extraction.top-k=40",
        "vocab.extraction.min-freq=1"
})
class VocabConfigTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ExtractionOptions extractionOptions;

    @Test
    void contextStartsWithoutAnApiKey() {
        assertThat(context.getBean(VocabularyTableService.class)).isNotNull();
        assertThat(context.getBean(UniqueRowGenerator.class)).isNotNull();
        assertThat(context.getBean(CsvTableCodec.class)).isNotNull();
    }

    @Test
    void extractionOptionsComeFromProperties() {
        assertThat(extractionOptions.topK()).isEqualTo(40);
        assertThat(extractionOptions.minFreq()).isEqualTo(1);
        assertThat(extractionOptions.allowPhrases()).isTrue();
    }

    @Test
    void chatModelNeedsAKeyOnceRequested() {
        assertThatThrownBy(() -> context.getBean(ChatModel.class))
                .isInstanceOf(BeanCreationException.class)
                .hasRootCauseMessage("vocab.openai.api-key is not set; topic generation needs an OpenAI key");
    }

    @Test
    void generationExecutorIsShutDownWithTheContext() {
        // Arrange
        ConfigurableApplicationContext own = new SpringApplicationBuilder(VocabApplication.class).run();
        MdcAwareExecutor executor = own.getBean("generationExecutor", MdcAwareExecutor.class);

        // Act
        own.close();

        // Assert
        assertThat(executor.isShutdown()).isTrue();
    }
}
