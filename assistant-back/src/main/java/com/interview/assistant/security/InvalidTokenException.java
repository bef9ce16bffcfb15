package com.interview.assistant.security;

/**
 * 토큰 검증 실패. 서명/만료/형식 중 무엇 때문인지는 호출자에게 구분해 주지 않는다.
 */
public class InvalidTokenException extends SecurityException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
