package com.interview.assistant.login.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * users.csv 한 행. 저장소가 돌려주는 값은 매번 새로 만든 불변 객체다.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString(exclude = "passwordHash")
public class User {

    /** max(id) + 1 로 부여, 재사용 없음 */
    private final long id;

    /** 대소문자 구분, 전체에서 유일 */
    private final String username;

    /** PasswordHasher 출력값. 응답으로 내보내지 않는다. */
    private final String passwordHash;

    private final OffsetDateTime createdAt;
}
