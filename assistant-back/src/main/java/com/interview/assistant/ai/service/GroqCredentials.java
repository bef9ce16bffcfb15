package com.interview.assistant.ai.service;

import com.interview.assistant.common.Normalizer;
import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.config.GroqProps;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GroqCredentials {

    private final GroqProps props;
    private final Normalizer normalizer;

    @PostConstruct
    void warnIfMissing() {
        if (!isConfigured()) {
            log.warn("GROQ_API_KEY is not configured. Requests using LLM/transcription will fail until it is set.");
        }
    }

    public String apiKey() {
        return normalizer.normalizeApiKey(props.getApiKey());
    }

    public boolean isConfigured() {
        String key = apiKey();
        return !key.isEmpty() && !normalizer.isPlaceholderKey(key);
    }

    public void requireConfigured() {
        if (!isConfigured()) {
            throw new UpstreamException(UpstreamException.Kind.NOT_CONFIGURED,
                    "GROQ_API_KEY is missing or invalid in the backend configuration.");
        }
    }
}
