package com.interview.assistant.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

@Component
public class Normalizer {

    private static final Set<String> PLACEHOLDER_KEYS = Set.of("replace_with_real_key", "your_groq_api_key_here");

    /** 앞뒤 공백만 제거 (대소문자는 그대로, username은 대소문자 구분) */
    public String trimToEmpty(String s) {
        return s == null ? "" : s.trim();
    }

    /** 공백 제거 + 감싸고 있는 따옴표 한 쌍 제거 ('key' / "key") */
    public String normalizeApiKey(String raw) {
        String key = trimToEmpty(raw);
        if (key.length() >= 2) {
            char first = key.charAt(0);
            char last = key.charAt(key.length() - 1);
            if (first == last && (first == '\'' || first == '"')) {
                key = key.substring(1, key.length() - 1).trim();
            }
        }
        return key;
    }

    public boolean isPlaceholderKey(String key) {
        return key != null && PLACEHOLDER_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }
}
