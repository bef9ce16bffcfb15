package com.interview.assistant.login.dto;

public record TokenResponse(
        String accessToken,
        String tokenType,            // 항상 "bearer"
        long expiresIn,              // 초 단위
        UserResponse user
) {
    public static final String BEARER = "bearer";
}
