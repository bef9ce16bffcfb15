package com.interview.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.jwt")
@Data
public class JwtProps {
    private String secret;                 // JWT_SECRET_KEY
    private boolean secretBase64 = false;
    private long expireMinutes = 60;
    private String algorithm = "HS256";    // HS256 / HS384 / HS512
}
