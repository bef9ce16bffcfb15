package com.interview.assistant.common;

/**
 * 모든 오류 응답의 본문. ex) {"error":"authentication_error","detail":"Invalid credentials","code":"HTTP_401"}
 */
public record ErrorResponse(String error, String detail, String code) {

    public static ErrorResponse of(String error, String detail, int status) {
        return new ErrorResponse(error, detail, "HTTP_" + status);
    }
}
