package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Blocking access to an Ollama-compatible {@code /api/generate} endpoint.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmClient {

    private final WebClient ollamaWebClient;

    @Value("${ollama.model:llama3.2}")
    private String model;

    @Value("${ollama.timeout-seconds:60}")
    private long timeoutSeconds;

    /**
     * @throws CollaboratorException when the endpoint is unreachable, times out or answers with no text
     */
    public String generate(String prompt, double temperature) {
        Map<String, Object> body = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", Map.of("temperature", temperature)
        );

        Map<?, ?> result;
        try {
            result = ollamaWebClient.post()
                    .uri("/api/generate")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            log.warn("LLM call failed: {}", e.getMessage());
            throw new CollaboratorException("LLM call failed: " + e.getMessage(), e);
        }

        Object response = result != null ? result.get("response") : null;
        if (!(response instanceof String) || ((String) response).trim().isEmpty()) {
            throw new CollaboratorException("LLM returned no text");
        }
        log.debug("LLM returned {} chars", ((String) response).length());
        return ((String) response).trim();
    }
}
