package com.interview.assistant.security;

import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * passlib {@code pbkdf2_sha256} 형식 인코더.
 *
 * <p>저장 형식은 {@code $pbkdf2-sha256$<rounds>$<salt>$<digest>}.
 * salt/digest 는 ab64 (표준 base64 에서 '+' 대신 '.', 패딩 없음).
 * 기존 users.csv 의 해시를 그대로 검증할 수 있고, 새로 만든 해시도 passlib 에서 검증된다.
 */
public class PasslibPbkdf2PasswordEncoder implements PasswordEncoder {

    public static final String PREFIX = "$pbkdf2-sha256$";

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int DIGEST_BYTES = 32;
    private static final Pattern AB64 = Pattern.compile("^[A-Za-z0-9./]+$");

    private final BytesKeyGenerator saltGenerator;
    private final int rounds;

    public PasslibPbkdf2PasswordEncoder(int saltLength, int rounds) {
        if (rounds < 1) {
            throw new IllegalArgumentException("rounds must be positive");
        }
        this.saltGenerator = KeyGenerators.secureRandom(saltLength);
        this.rounds = rounds;
    }

    @Override
    public String encode(CharSequence rawPassword) {
        byte[] salt = saltGenerator.generateKey();
        return PREFIX + rounds + "$" + ab64Encode(salt) + "$" + ab64Encode(derive(rawPassword, salt, rounds));
    }

    /** 형식이 깨진 값은 false 가 아니라 IllegalArgumentException */
    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        if (encodedPassword == null || !encodedPassword.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not a " + PREFIX + " hash");
        }
        String[] parts = encodedPassword.substring(PREFIX.length()).split("\\$", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected <rounds>$<salt>$<digest>");
        }
        int storedRounds = Integer.parseInt(parts[0]);
        if (storedRounds < 1) {
            throw new IllegalArgumentException("Non-positive rounds: " + storedRounds);
        }
        byte[] salt = ab64Decode(parts[1]);
        byte[] expected = ab64Decode(parts[2]);
        if (expected.length != DIGEST_BYTES) {
            throw new IllegalArgumentException("Digest must be " + DIGEST_BYTES + " bytes");
        }
        return MessageDigest.isEqual(expected, derive(rawPassword, salt, storedRounds));
    }

    private static byte[] derive(CharSequence rawPassword, byte[] salt, int rounds) {
        // SunJCE 는 char[] 를 UTF-8 로 바꿔 HMAC 키로 쓴다 (passlib 과 동일)
        PBEKeySpec spec = new PBEKeySpec(rawPassword.toString().toCharArray(), salt, rounds, DIGEST_BYTES * 8);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not derive " + ALGORITHM + " key", e);
        } finally {
            spec.clearPassword();
        }
    }

    static String ab64Encode(byte[] bytes) {
        return Base64.getEncoder().withoutPadding().encodeToString(bytes).replace('+', '.');
    }

    static byte[] ab64Decode(String value) {
        if (!AB64.matcher(value).matches()) {
            throw new IllegalArgumentException("Not an ab64 value");
        }
        // 패딩이 없어도 java Base64 디코더는 받아준다 (길이 % 4 == 1 이면 예외)
        return Base64.getDecoder().decode(value.replace('.', '+'));
    }
}
