package com.interview.assistant.ai.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.interview.assistant.ai.service.GroqCredentials;
import com.interview.assistant.ai.service.LLMClient;
import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.config.GroqProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groq chat completions (OpenAI 호환) 클라이언트.
 */
@Slf4j
@Component
public class GroqChatClient implements LLMClient {

    private final RestClient rest;
    private final GroqProps props;
    private final GroqCredentials credentials;

    public GroqChatClient(@Qualifier("groqRestClient") RestClient rest, GroqProps props, GroqCredentials credentials) {
        this.rest = rest;
        this.props = props;
        this.credentials = credentials;
    }

    @Override
    public String complete(String system, String user, double temperature, int maxTokens) {
        credentials.requireConfigured();

        var messages = List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", user)
        );
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getLlmModel());
        body.put("messages", messages);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);

        JsonNode resp;
        try {
            resp = rest.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            UpstreamException ue = GroqErrors.translate(e, "LLM response timed out.", "LLM service unavailable.");
            switch (ue.getKind()) {
                case CREDENTIAL_INVALID -> log.error("Groq authentication failed: invalid API key");
                case TIMEOUT -> log.error("LLM timeout after {}s", props.getTimeoutSeconds());
                default -> log.error("LLM generation failed: {}", e.getMessage(), e);
            }
            throw ue;
        }

        if (resp == null) {
            return "";
        }
        return resp.path("choices").path(0).path("message").path("content").asText("").strip();
    }
}
