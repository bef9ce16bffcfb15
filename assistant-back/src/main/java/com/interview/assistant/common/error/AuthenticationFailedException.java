package com.interview.assistant.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 인증 실패. 사유별로 메시지는 고정이며, 토큰이 왜 무효인지(서명/만료/형식)는 구분하지 않는다.
 */
@Getter
public class AuthenticationFailedException extends ApiException {

    public enum Reason {
        MISSING("Missing access token"),
        INVALID("Invalid or expired token"),
        NOT_FOUND("User not found"),
        INVALID_CREDENTIALS("Invalid credentials");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public AuthenticationFailedException(Reason reason) {
        super(reason == Reason.NOT_FOUND ? ErrorCode.NOT_FOUND_ERROR : ErrorCode.AUTHENTICATION_ERROR,
                HttpStatus.UNAUTHORIZED, reason.message);
        this.reason = reason;
    }

    public AuthenticationFailedException(Reason reason, Throwable cause) {
        super(reason == Reason.NOT_FOUND ? ErrorCode.NOT_FOUND_ERROR : ErrorCode.AUTHENTICATION_ERROR,
                HttpStatus.UNAUTHORIZED, reason.message, cause);
        this.reason = reason;
    }
}
