package com.interview.assistant.common.error;

import org.springframework.http.HttpStatus;

public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT_ERROR, HttpStatus.CONFLICT, message);
    }
}
