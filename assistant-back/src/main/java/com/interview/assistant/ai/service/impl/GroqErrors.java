package com.interview.assistant.ai.service.impl;

import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.common.error.UpstreamException.Kind;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;

/**
 * RestClient 예외 → {@link UpstreamException}. 타임아웃과 키 오류는 운영자가 구분할 수 있게 나눈다.
 */
final class GroqErrors {

    static final String INVALID_KEY_MESSAGE = "Invalid GROQ_API_KEY. Update the backend configuration with a valid key.";

    private GroqErrors() {
    }

    static UpstreamException translate(RestClientException e, String timeoutMessage, String unavailableMessage) {
        if (e instanceof HttpClientErrorException.Unauthorized) {
            return new UpstreamException(Kind.CREDENTIAL_INVALID, INVALID_KEY_MESSAGE, e);
        }
        // 호출 전체 상한(callTimeout)은 본문을 읽는 중에도 걸릴 수 있어 ResourceAccessException 으로 한정하지 않음
        if (isTimeout(e)) {
            return new UpstreamException(Kind.TIMEOUT, timeoutMessage, e);
        }
        return new UpstreamException(Kind.UNAVAILABLE, unavailableMessage, e);
    }

    static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            // SocketTimeoutException 과 OkHttp 의 InterruptedIOException("timeout") 둘 다 포함
            if (t instanceof InterruptedIOException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
