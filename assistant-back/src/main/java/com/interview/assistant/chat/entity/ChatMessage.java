package com.interview.assistant.chat.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * chat_history.csv 한 행.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class ChatMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    /** 테이블 전체 기준 max(id) + 1 (사용자별 아님) */
    private final long id;

    /** 저장소에서는 참조 무결성 검사 안 함 */
    private final long userId;

    private final String role;

    private final String content;

    private final OffsetDateTime createdAt;
}
