package com.interview.assistant.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.OkHttp3ClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class GroqClientConfig {

    /**
     * connect/read/write 는 각 단계의 상한이고, callTimeout 은 연결부터 본문 수신 완료까지 한 호출 전체의 상한.
     * 조금씩 흘러 들어오는 응답도 timeout-seconds 를 넘기면 끊긴다. 재시도 없음.
     */
    @Bean
    public OkHttpClient groqHttpClient(GroqProps props) {
        Duration timeout = Duration.ofMillis(Math.round(props.getTimeoutSeconds() * 1000));
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    @SuppressWarnings("removal")
    public RestClient groqRestClient(RestClient.Builder builder, GroqProps props, OkHttpClient groqHttpClient) {
        return builder
                .baseUrl(props.getBaseUrl())
                .requestFactory(new OkHttp3ClientHttpRequestFactory(groqHttpClient))
                .build();
    }
}
