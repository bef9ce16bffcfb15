package com.interview.assistant.ai.service.impl;

import com.interview.assistant.ai.service.GroqCredentials;
import com.interview.assistant.common.Normalizer;
import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.common.error.UpstreamException.Kind;
import com.interview.assistant.config.GroqProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("GroqChatClient Tests")
class GroqChatClientTest {

    private static final String BASE_URL = "https://groq.test/openai/v1";

    private GroqProps props;
    private MockRestServiceServer server;
    private GroqChatClient client;

    @BeforeEach
    void setUp() {
        props = new GroqProps();
        props.setApiKey(" \"test-key\" ");
        props.setBaseUrl(BASE_URL);

        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GroqChatClient(builder.build(), props, new GroqCredentials(props, new Normalizer()));
    }

    @Test
    @DisplayName("posts an OpenAI-style body and returns the first choice stripped")
    void completes() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("llama-3.1-8b-instant"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("hello"))
                .andExpect(jsonPath("$.max_tokens").value(180))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"  Sure thing.  "}}]}
                        """, MediaType.APPLICATION_JSON));

        assertEquals("Sure thing.", client.complete("sys", "hello", 0.2, 180));
        server.verify();
    }

    @Test
    @DisplayName("missing choices yields an empty string")
    void missingChoices() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertEquals("", client.complete("sys", "hello", 0.2, 180));
    }

    @Test
    @DisplayName("401 from Groq is a credential error")
    void unauthorized() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withUnauthorizedRequest());

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete("sys", "hi", 0.2, 180));
        assertEquals(Kind.CREDENTIAL_INVALID, e.getKind());
        assertEquals(401, e.getStatus().value());
    }

    @Test
    @DisplayName("server error is reported as unavailable")
    void serverError() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withServerError());

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete("sys", "hi", 0.2, 180));
        assertEquals(Kind.UNAVAILABLE, e.getKind());
        assertEquals(502, e.getStatus().value());
    }

    @Test
    @DisplayName("socket timeout is reported as a timeout")
    void timeout() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete("sys", "hi", 0.2, 180));
        assertEquals(Kind.TIMEOUT, e.getKind());
        assertEquals(504, e.getStatus().value());
    }

    @Test
    @DisplayName("placeholder key fails before any request is made")
    void notConfigured() {
        props.setApiKey("REPLACE_WITH_REAL_KEY");

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete("sys", "hi", 0.2, 180));
        assertEquals(Kind.NOT_CONFIGURED, e.getKind());
        server.verify();
    }
}
