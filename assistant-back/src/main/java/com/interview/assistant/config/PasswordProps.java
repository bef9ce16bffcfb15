package com.interview.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.security.password")
@Data
public class PasswordProps {
    private int saltLength = 16;         // bytes
    private int iterations = 29000;      // passlib pbkdf2_sha256 기본값
}
