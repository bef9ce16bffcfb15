package com.interview.assistant.chat.dto;

public record ProcessAudioResponse(String transcription, String answer) {}
