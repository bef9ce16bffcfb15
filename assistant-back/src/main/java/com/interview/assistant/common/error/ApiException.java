package com.interview.assistant.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 서비스 계층에서 던지는 예외의 공통 부모.
 * {@link com.interview.assistant.common.ApiExceptionAdvice}가 상태코드/오류코드로 변환한다.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;

    protected ApiException(ErrorCode errorCode, HttpStatus status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected ApiException(ErrorCode errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    /** 클라이언트에게 보여줄 메시지. 기본은 예외 메시지 그대로. */
    public String getClientMessage() {
        return getMessage();
    }
}
