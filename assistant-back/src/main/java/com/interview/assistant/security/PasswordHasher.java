package com.interview.assistant.security;

import com.interview.assistant.common.error.IntegrityException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 비밀번호 단방향 해시/검증.
 * 해시 문자열 안에 salt가 들어 있으므로 같은 비밀번호라도 매번 다른 값이 나온다.
 */
@Component
public class PasswordHasher {

    private final PasswordEncoder encoder;

    public PasswordHasher(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    public String hash(String password) {
        return encoder.encode(password);
    }

    /**
     * 불일치는 false. 저장된 해시 자체가 깨진 경우에만 {@link IntegrityException}.
     */
    public boolean verify(String password, String passwordHash) {
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IntegrityException("Stored password hash is empty");
        }
        try {
            return encoder.matches(password, passwordHash);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Stored password hash is malformed", e);
        }
    }
}
