package com.eainde.vocab.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VocabularyGenerator} backed by a langchain4j {@link ChatModel} in JSON mode.
 *
 * <p>The user message is a JSON document carrying the instruction, topic, count,
 * avoid pairs, rules and the item schema.</p>
 */
@Slf4j
public class ChatModelVocabularyGenerator implements VocabularyGenerator {

    static final String SYSTEM_PROMPT =
            "You are a Japanese vocabulary generator. Respond ONLY with valid JSON.";
    static final String INSTRUCTION =
            "Generate Japanese vocabulary strictly as JSON with key 'items'.";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Double temperature;

    /**
     * @param temperature sampling temperature, {@code null} leaves the model default
     */
    public ChatModelVocabularyGenerator(ChatModel chatModel, ObjectMapper objectMapper, Double temperature) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.temperature = temperature;
    }

    @Override
    public String generate(GenerationPrompt prompt) {
        ChatRequestParameters parameters = ChatRequestParameters.builder()
                .temperature(temperature)
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .build())
                .build();

        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(userPayload(prompt)))
                .parameters(parameters)
                .build();

        log.debug("Requesting {} items for topic '{}' with {} avoid pairs",
                prompt.count(), prompt.topic(), prompt.avoid().size());

        ChatResponse response = chatModel.chat(request);
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            log.warn("Chat model returned an empty reply for topic '{}'", prompt.topic());
            return "{}";
        }
        return text;
    }

    String userPayload(GenerationPrompt prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("instruction", INSTRUCTION);
        payload.put("topic", prompt.topic());
        payload.put("count", prompt.count());
        payload.put("avoid_pairs", prompt.avoidPairs());
        prompt.rules().forEach(payload.putArray("rules")::add);

        ObjectNode schema = payload.putObject("schema");
        schema.put("term", "Kanji or kana headword");
        schema.put("reading", "Hiragana or katakana reading");
        schema.put("meaning", "Short English gloss");
        schema.put("example", "One short Japanese sentence using the term");
        schema.put("jlpt", "N5|N4|N3|N2|N1 or empty");

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize generation prompt", e);
        }
    }
}
