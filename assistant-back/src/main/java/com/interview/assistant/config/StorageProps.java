package com.interview.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.storage")
@Data
public class StorageProps {
    private String dataDir = "data";                       // users.csv, chat_history.csv 위치
    private String usersFile = "users.csv";
    private String chatsFile = "chat_history.csv";
}
