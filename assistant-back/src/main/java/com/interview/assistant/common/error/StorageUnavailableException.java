package com.interview.assistant.common.error;

import org.springframework.http.HttpStatus;

public class StorageUnavailableException extends ApiException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE_ERROR, HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }

    @Override
    public String getClientMessage() {
        return "Storage is unavailable.";
    }
}
