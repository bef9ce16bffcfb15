package com.interview.assistant.ai.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.interview.assistant.ai.service.GroqCredentials;
import com.interview.assistant.ai.service.TranscriptionClient;
import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.common.error.UpstreamException.Kind;
import com.interview.assistant.common.error.ValidationException;
import com.interview.assistant.config.GroqProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Groq Whisper 음성 인식 클라이언트.
 */
@Slf4j
@Component
public class GroqTranscriptionClient implements TranscriptionClient {

    private static final String DEFAULT_FILENAME = "audio.wav";

    private final RestClient rest;
    private final GroqProps props;
    private final GroqCredentials credentials;

    public GroqTranscriptionClient(@Qualifier("groqRestClient") RestClient rest, GroqProps props,
                                   GroqCredentials credentials) {
        this.rest = rest;
        this.props = props;
        this.credentials = credentials;
    }

    @Override
    public String transcribe(String filename, byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new ValidationException("Empty audio payload.");
        }
        credentials.requireConfigured();

        String name = StringUtils.hasText(filename) ? filename : DEFAULT_FILENAME;
        // multipart 파일 파트는 파일명이 있어야 서버가 포맷을 추정함
        ByteArrayResource file = new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return name;
            }
        };

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", file);
        form.add("model", props.getWhisperModel());
        form.add("response_format", "verbose_json");
        form.add("language", props.getTranscriptionLanguage());
        form.add("temperature", "0");

        JsonNode resp;
        try {
            resp = rest.post()
                    .uri("/audio/transcriptions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.apiKey())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            UpstreamException ue = GroqErrors.translate(e, "Transcription timed out.", "Transcription service unavailable.");
            switch (ue.getKind()) {
                case CREDENTIAL_INVALID -> log.error("Groq authentication failed: invalid API key");
                case TIMEOUT -> log.error("Transcription timeout after {}s", props.getTimeoutSeconds());
                default -> log.error("Transcription failed: {}", e.getMessage(), e);
            }
            throw ue;
        }

        String text = resp == null ? "" : resp.path("text").asText("").strip();
        if (text.isEmpty()) {
            throw new UpstreamException(Kind.EMPTY_RESULT, "Could not transcribe audio.");
        }
        log.debug("transcribed {} bytes from {} into {} chars", audio.length, name, text.length());
        return text;
    }
}
