package com.interview.assistant.security;

import com.interview.assistant.config.JwtProps;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Locale;

@Component
public class JwtProviderImpl implements JwtProvider {

    private final MacAlgorithm algorithm;
    private final SecretKey key;
    private final Duration lifetime;
    private final Clock clock;
    private final JwtParser parser;

    public JwtProviderImpl(JwtProps props, Clock clock) {
        String secret = props.getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("app.jwt.secret must be configured.");
        }
        if (props.getExpireMinutes() <= 0) {
            throw new IllegalArgumentException("app.jwt.expire-minutes must be positive.");
        }

        String algorithmId = props.getAlgorithm().trim().toUpperCase(Locale.ROOT);
        this.algorithm = switch (algorithmId) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalArgumentException("Unsupported JWT algorithm: " + props.getAlgorithm());
        };
        String jcaName = "HmacSHA" + algorithmId.substring(2);   // HS256 -> HmacSHA256

        byte[] keyBytes = props.isSecretBase64()
                ? Base64.getDecoder().decode(secret)
                : secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length * 8 < algorithm.getKeyBitLength()) {
            throw new IllegalArgumentException("JWT secret must be at least "
                    + algorithm.getKeyBitLength() / 8 + " bytes for " + algorithm.getId() + ".");
        }

        this.key = new SecretKeySpec(keyBytes, jcaName);
        this.lifetime = Duration.ofMinutes(props.getExpireMinutes());
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))   // 만료 판정도 같은 시계 기준
                .build();
    }

    @Override
    public IssuedToken issue(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        Instant now = clock.instant();
        String token = Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(lifetime)))
                .signWith(key, algorithm)
                .compact();
        return new IssuedToken(token, lifetime.toSeconds());
    }

    @Override
    public String verify(String token) {
        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
        // 다른 HMAC 알고리즘으로 서명된 토큰은 받지 않음
        if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidTokenException("Invalid token");
        }
        String subject = jws.getPayload().getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Invalid token payload");
        }
        return subject;
    }
}
