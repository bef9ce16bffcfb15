package com.interview.assistant.login.dto;

import com.interview.assistant.login.entity.User;
import com.interview.assistant.security.Identity;

import java.time.OffsetDateTime;

public record UserResponse(long id, String username, OffsetDateTime createdAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getCreatedAt());
    }

    public static UserResponse from(Identity identity) {
        return new UserResponse(identity.id(), identity.username(), identity.createdAt());
    }
}
