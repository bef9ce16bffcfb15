package com.interview.assistant.common.error;

/**
 * 외부로 노출되는 오류 분류. {@code ErrorResponse.error} 값으로 그대로 내려간다.
 */
public enum ErrorCode {
    VALIDATION_ERROR("validation_error"),
    AUTHENTICATION_ERROR("authentication_error"),
    CONFLICT_ERROR("conflict_error"),
    NOT_FOUND_ERROR("not_found_error"),
    UPSTREAM_ERROR("upstream_error"),
    INTEGRITY_ERROR("integrity_error"),
    STORAGE_UNAVAILABLE_ERROR("storage_unavailable_error");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
