package com.interview.assistant.common.error;

import org.springframework.http.HttpStatus;

public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, message);
    }

    public ValidationException(HttpStatus status, String message) {
        super(ErrorCode.VALIDATION_ERROR, status, message);
    }
}
