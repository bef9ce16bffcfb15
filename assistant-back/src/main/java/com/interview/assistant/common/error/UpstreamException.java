package com.interview.assistant.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 외부 제공자(Groq) 호출 실패. 재시도하지 않는다.
 */
@Getter
public class UpstreamException extends ApiException {

    public enum Kind {
        TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
        CREDENTIAL_INVALID(HttpStatus.UNAUTHORIZED),
        EMPTY_RESULT(HttpStatus.UNPROCESSABLE_ENTITY),
        UNAVAILABLE(HttpStatus.BAD_GATEWAY),
        NOT_CONFIGURED(HttpStatus.SERVICE_UNAVAILABLE);

        private final HttpStatus status;

        Kind(HttpStatus status) {
            this.status = status;
        }
    }

    private final Kind kind;

    public UpstreamException(Kind kind, String message) {
        super(ErrorCode.UPSTREAM_ERROR, kind.status, message);
        this.kind = kind;
    }

    public UpstreamException(Kind kind, String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, kind.status, message, cause);
        this.kind = kind;
    }
}
