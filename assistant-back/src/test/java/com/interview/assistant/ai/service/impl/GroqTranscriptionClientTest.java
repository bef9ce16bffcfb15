package com.interview.assistant.ai.service.impl;

import com.interview.assistant.ai.service.GroqCredentials;
import com.interview.assistant.common.Normalizer;
import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.common.error.UpstreamException.Kind;
import com.interview.assistant.common.error.ValidationException;
import com.interview.assistant.config.GroqProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("GroqTranscriptionClient Tests")
class GroqTranscriptionClientTest {

    private static final String BASE_URL = "https://groq.test/openai/v1";
    private static final byte[] AUDIO = "RIFF....WAVEfmt ".getBytes(StandardCharsets.US_ASCII);

    private GroqProps props;
    private MockRestServiceServer server;
    private GroqTranscriptionClient client;

    @BeforeEach
    void setUp() {
        props = new GroqProps();
        props.setApiKey("test-key");
        props.setBaseUrl(BASE_URL);

        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GroqTranscriptionClient(builder.build(), props, new GroqCredentials(props, new Normalizer()));
    }

    @Test
    @DisplayName("uploads multipart audio and returns the stripped text")
    void transcribes() {
        server.expect(requestTo(BASE_URL + "/audio/transcriptions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andRespond(withSuccess("{\"text\":\"  what is your timeline?  \",\"language\":\"en\"}",
                        MediaType.APPLICATION_JSON));

        assertEquals("what is your timeline?", client.transcribe("question.wav", AUDIO));
        server.verify();
    }

    @Test
    @DisplayName("empty text is an empty-result upstream error")
    void emptyText() {
        server.expect(requestTo(BASE_URL + "/audio/transcriptions"))
                .andRespond(withSuccess("{\"text\":\"   \"}", MediaType.APPLICATION_JSON));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.transcribe("a.wav", AUDIO));
        assertEquals(Kind.EMPTY_RESULT, e.getKind());
        assertEquals("Could not transcribe audio.", e.getMessage());
    }

    @Test
    @DisplayName("empty payload is rejected locally")
    void emptyPayload() {
        assertThrows(ValidationException.class, () -> client.transcribe("a.wav", new byte[0]));
        server.verify();
    }

    @Test
    @DisplayName("401 from Groq is a credential error")
    void unauthorized() {
        server.expect(requestTo(BASE_URL + "/audio/transcriptions")).andRespond(withUnauthorizedRequest());

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.transcribe("a.wav", AUDIO));
        assertEquals(Kind.CREDENTIAL_INVALID, e.getKind());
    }

    @Test
    @DisplayName("bad gateway is reported as unavailable")
    void badGateway() {
        server.expect(requestTo(BASE_URL + "/audio/transcriptions")).andRespond(withBadGateway());

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.transcribe("a.wav", AUDIO));
        assertEquals(Kind.UNAVAILABLE, e.getKind());
        assertEquals("Transcription service unavailable.", e.getMessage());
    }
}
