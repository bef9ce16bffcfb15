package com.interview.assistant.storage.service;

import com.interview.assistant.chat.entity.ChatMessage;
import com.interview.assistant.login.entity.User;

import java.util.List;
import java.util.Optional;

/**
 * 사용자/채팅 기록 테이블 저장소.
 * 모든 연산은 프로세스 단위 단일 락 아래에서 직렬로 실행된다.
 */
public interface RecordStore {

    /** 데이터 디렉터리와 헤더만 있는 테이블을 보장. 여러 번 호출해도 기존 행은 건드리지 않음 */
    void initialize();

    Optional<User> findUserByUsername(String username);

    /**
     * 중복 검사 없이 한 행을 추가한다. 유일성은 호출자가 보장해야 함.
     * 가입 흐름에서는 {@link #createUserIfAbsent(String, String)}를 사용.
     */
    User createUser(String username, String passwordHash);

    /** 존재 확인과 추가를 한 번의 락 안에서 수행. 이미 있으면 empty */
    Optional<User> createUserIfAbsent(String username, String passwordHash);

    ChatMessage appendChatMessage(long userId, String role, String content);

    /** (createdAt, id) 오름차순 정렬 후 앞에서부터 limit개 (가장 오래된 메시지들) */
    List<ChatMessage> listChatHistory(long userId, int limit);
}
