package com.interview.assistant.config;

import com.interview.assistant.ai.service.GroqCredentials;
import com.interview.assistant.ai.service.impl.GroqChatClient;
import com.interview.assistant.common.Normalizer;
import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.common.error.UpstreamException.Kind;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 실제 OkHttp 스택으로 Groq 호출 타임아웃 동작 확인 (로컬 MockWebServer).
 */
@DisplayName("GroqClientConfig Tests")
class GroqClientConfigTest {

    private static final String CHAT_JSON = "{\"choices\":[{\"message\":{\"content\":\"On it.\"}}]}";

    private final GroqClientConfig config = new GroqClientConfig();

    private MockWebServer server;
    private GroqProps props;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        props = new GroqProps();
        props.setApiKey("test-key");
        props.setBaseUrl(server.url("/openai/v1").toString());
        props.setTimeoutSeconds(1.0);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private GroqChatClient chatClient() {
        OkHttpClient http = config.groqHttpClient(props);
        RestClient rest = config.groqRestClient(RestClient.builder(), props, http);
        return new GroqChatClient(rest, props, new GroqCredentials(props, new Normalizer()));
    }

    @Test
    @DisplayName("timeout-seconds bounds every phase and the whole call, without retries")
    void appliesTimeouts() {
        props.setTimeoutSeconds(2.5);

        OkHttpClient http = config.groqHttpClient(props);

        assertEquals(2500, http.callTimeoutMillis());
        assertEquals(2500, http.connectTimeoutMillis());
        assertEquals(2500, http.readTimeoutMillis());
        assertEquals(2500, http.writeTimeoutMillis());
        assertFalse(http.retryOnConnectionFailure());
    }

    @Test
    @DisplayName("prompt response goes through the configured base url")
    void fastResponse() throws InterruptedException {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(CHAT_JSON));

        assertEquals("On it.", chatClient().complete("sys", "hi", 0.2, 180));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/openai/v1/chat/completions", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
    }

    @Test
    @DisplayName("body trickling in past the limit is cut off as a timeout")
    void tricklingBodyTimesOut() {
        // 100ms 마다 16바이트: 한 번의 read 는 read timeout(1초) 안에 끝나지만 전체는 2.5초 이상 걸림
        String slowBody = " ".repeat(400) + CHAT_JSON;
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(slowBody)
                .throttleBody(16, 100, TimeUnit.MILLISECONDS));

        GroqChatClient client = chatClient();
        long started = System.nanoTime();
        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete("sys", "hi", 0.2, 180));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertEquals(Kind.TIMEOUT, e.getKind());
        assertTrue(elapsed.compareTo(Duration.ofMillis(2000)) < 0, "took " + elapsed);
    }
}
