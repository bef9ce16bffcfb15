package com.interview.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.audio")
@Data
public class AudioProps {
    private int maxSizeMb = 15;
}
