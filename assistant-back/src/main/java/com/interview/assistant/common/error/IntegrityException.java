package com.interview.assistant.common.error;

import org.springframework.http.HttpStatus;

/**
 * 저장된 레코드가 스키마와 맞지 않음. 재시도로 복구되지 않는다.
 */
public class IntegrityException extends ApiException {

    public IntegrityException(String message) {
        super(ErrorCode.INTEGRITY_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }

    @Override
    public String getClientMessage() {
        return "Stored data is corrupted.";
    }
}
