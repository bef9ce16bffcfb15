package com.interview.assistant.common.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @Value("${app.name:AI Interview Backend}")
    private String appName;

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "ok", "service", appName);
    }
}
