package com.interview.assistant.config;

import com.interview.assistant.storage.service.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@RequiredArgsConstructor
@Configuration
public class StorageInitConfig {
    private final RecordStore recordStore;

    /** 기동 시마다 호출해도 안전 (없을 때만 헤더 행으로 생성) */
    @Bean
    ApplicationRunner initRecordStore() {
        return args -> recordStore.initialize();
    }
}
