package com.interview.assistant.security;

import com.interview.assistant.common.error.AuthenticationFailedException;
import com.interview.assistant.common.error.AuthenticationFailedException.Reason;
import com.interview.assistant.storage.service.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Bearer 토큰 → {@link Identity}. 캐시 없이 매 요청마다 토큰 검증 + 사용자 조회.
 */
@Component
@RequiredArgsConstructor
public class AuthenticationGate {

    private final JwtProvider jwtProvider;
    private final RecordStore recordStore;

    public Identity resolve(String bearerCredential) {
        if (bearerCredential == null || bearerCredential.isBlank()) {
            throw new AuthenticationFailedException(Reason.MISSING);
        }

        String username;
        try {
            username = jwtProvider.verify(bearerCredential.trim());
        } catch (InvalidTokenException e) {
            throw new AuthenticationFailedException(Reason.INVALID, e);
        }

        return recordStore.findUserByUsername(username)
                .map(Identity::from)
                .orElseThrow(() -> new AuthenticationFailedException(Reason.NOT_FOUND));
    }
}
