package com.interview.assistant.security;

import com.interview.assistant.login.entity.User;

import java.time.OffsetDateTime;

/**
 * 요청 하나 동안 유효한 인증 주체. 비밀번호 해시는 담지 않는다.
 */
public record Identity(long id, String username, OffsetDateTime createdAt) {

    public static Identity from(User user) {
        return new Identity(user.getId(), user.getUsername(), user.getCreatedAt());
    }
}
