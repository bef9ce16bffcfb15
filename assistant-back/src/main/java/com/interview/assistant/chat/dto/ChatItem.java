package com.interview.assistant.chat.dto;

import com.interview.assistant.chat.entity.ChatMessage;

import java.time.OffsetDateTime;

public record ChatItem(long id, String role, String content, OffsetDateTime createdAt) {

    public static ChatItem from(ChatMessage m) {
        return new ChatItem(m.getId(), m.getRole(), m.getContent(), m.getCreatedAt());
    }
}
