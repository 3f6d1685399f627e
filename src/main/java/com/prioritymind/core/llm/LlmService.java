package com.prioritymind.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce typed output from LLM calls.
 * <p>
 * {@link BeanOutputConverter} derives a JSON schema from the target class, the
 * format instructions are appended to the user prompt, and the response is
 * deserialized back. Responses the converter rejects get a second, lenient
 * Jackson pass before giving up.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.chat.options.model:default}") String model) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized with chat model {}", model);
    }

    /**
     * Sends a system + user prompt and returns the response as {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returned no content
     * @throws LlmParseException         if the content is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started: {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete: {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is reachable and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter rejected LLM response for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    private <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = stripCodeFence(json);
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFence(String json) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
