package com.researchplatform.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.common.llm.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} backed by the Anthropic Messages API.
 *
 * <p>Fully non-blocking. A missing API key, a transport failure or a reply without a text
 * block surfaces as {@link CollaboratorException}; every caller pairs the call with its own
 * fallback.
 */
@Component
public class AnthropicLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);
    static final String COLLABORATOR = "anthropic";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final Duration timeout;

    public AnthropicLlmClient(@Qualifier("anthropicWebClient") WebClient webClient,
                              ObjectMapper objectMapper,
                              @Value("${anthropic.api-key:}") String apiKey,
                              @Value("${anthropic.model:claude-haiku-4-5-20251001}") String model,
                              @Value("${anthropic.max-tokens:1500}") int maxTokens,
                              @Value("${anthropic.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new CollaboratorException(COLLABORATOR, "No API key configured"));
        }
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson -> webClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .bodyValue(bodyJson)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .map(this::extractText)
            .doOnSuccess(text -> log.debug("[Anthropic] Completion received. model={} chars={}", model, text.length()))
            .onErrorMap(e -> !(e instanceof CollaboratorException),
                e -> new CollaboratorException(COLLABORATOR, e.getMessage(), e));
    }

    String extractText(String response) {
        try {
            JsonNode content = objectMapper.readTree(response).path("content");
            StringBuilder text = new StringBuilder();
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText("text")) && block.hasNonNull("text")) {
                    text.append(block.get("text").asText());
                }
            }
            if (text.length() == 0) {
                throw new CollaboratorException(COLLABORATOR, "Response carried no text content");
            }
            return text.toString();
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed to parse response", e);
        }
    }
}
