package com.interview.assistant.chat.service;

import com.interview.assistant.chat.entity.ChatMessage;
import com.interview.assistant.storage.service.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ChatHistoryService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final RecordStore recordStore;

    /** 사용자 존재 여부는 호출 측(인증 게이트)에서 이미 확인됨 */
    public void recordChatTurn(long userId, String role, String content) {
        recordStore.appendChatMessage(userId, role, content);
    }

    /** 질문 → 답변 순서로 두 행 기록 */
    public void recordExchange(long userId, String question, String answer) {
        recordChatTurn(userId, ChatMessage.ROLE_USER, question);
        recordChatTurn(userId, ChatMessage.ROLE_ASSISTANT, answer);
    }

    /**
     * 오래된 순(ASC). limit 은 1..200 으로 보정.
     * 기록이 limit 보다 많으면 가장 오래된 limit 개가 반환된다.
     */
    public List<ChatMessage> fetchChatHistory(long userId, int limit) {
        int capped = Math.min(MAX_LIMIT, Math.max(1, limit));
        return recordStore.listChatHistory(userId, capped);
    }
}
