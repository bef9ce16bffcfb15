package com.interview.assistant.chat.dto;

public record ChatResponse(String answer) {}
