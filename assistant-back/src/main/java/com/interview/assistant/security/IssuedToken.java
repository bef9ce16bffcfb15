package com.interview.assistant.security;

/**
 * 발급된 액세스 토큰과 유효 기간(초).
 */
public record IssuedToken(String token, long expiresInSeconds) {}
