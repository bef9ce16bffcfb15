package com.interview.assistant.login.service;

import com.interview.assistant.common.Normalizer;
import com.interview.assistant.common.error.AuthenticationFailedException;
import com.interview.assistant.common.error.AuthenticationFailedException.Reason;
import com.interview.assistant.common.error.ConflictException;
import com.interview.assistant.common.error.ValidationException;
import com.interview.assistant.login.dto.LoginResult;
import com.interview.assistant.login.entity.User;
import com.interview.assistant.security.JwtProvider;
import com.interview.assistant.security.PasswordHasher;
import com.interview.assistant.storage.service.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final int MIN_PASSWORD_LENGTH = 6;

    private final RecordStore recordStore;
    private final PasswordHasher passwordHasher;
    private final JwtProvider jwtProvider;
    private final Normalizer normalizer;

    // ============================ 회원가입 영역 ======================================
    public User signup(String rawUsername, String rawPassword) {
        String username = normalizer.trimToEmpty(rawUsername);
        String password = normalizer.trimToEmpty(rawPassword);

        if (username.isEmpty()) {
            throw new ValidationException("Username is required");
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        // 해시 계산 전에 먼저 걸러낸다 (해시는 비싸다)
        if (recordStore.findUserByUsername(username).isPresent()) {
            throw new ConflictException("Username already exists");
        }

        String passwordHash = passwordHasher.hash(password);

        // 해시 계산 동안 같은 이름으로 가입한 요청이 있을 수 있으므로 락 안에서 한 번 더 확인
        Optional<User> created = recordStore.createUserIfAbsent(username, passwordHash);
        User user = created.orElseThrow(() -> new ConflictException("Username already exists"));
        log.info("user signed up: id={}, username={}", user.getId(), user.getUsername());
        return user;
    }
    // ============================ 회원가입 영역 ======================================

    // ============================ 로그인 영역 =======================================
    public LoginResult login(String rawUsername, String rawPassword) {
        String username = normalizer.trimToEmpty(rawUsername);
        String password = normalizer.trimToEmpty(rawPassword);
        if (username.isEmpty() || password.isEmpty()) {
            throw new ValidationException("Username and password are required");
        }

        User user = recordStore.findUserByUsername(username)
                .orElseThrow(() -> new AuthenticationFailedException(Reason.INVALID_CREDENTIALS));

        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            // 아이디 없음 / 비밀번호 틀림을 구분하지 않음
            throw new AuthenticationFailedException(Reason.INVALID_CREDENTIALS);
        }

        return new LoginResult(jwtProvider.issue(user.getUsername()), user);
    }
}
