package com.interview.assistant.ai.service;

public interface TranscriptionClient {

    /** 음성 → 텍스트. 결과가 비면 UpstreamException(EMPTY_RESULT) */
    String transcribe(String filename, byte[] audio);
}
