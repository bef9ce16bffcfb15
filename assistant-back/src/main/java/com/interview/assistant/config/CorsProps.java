package com.interview.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** 쉼표 구분 문자열로 받는다: http://localhost:3000,http://127.0.0.1:3000 */
@Configuration
@ConfigurationProperties(prefix = "app.cors")
@Data
public class CorsProps {
    private String allowedOrigins = "*";
    private String allowedMethods = "GET,POST,OPTIONS";
    private String allowedHeaders = "*";
}
