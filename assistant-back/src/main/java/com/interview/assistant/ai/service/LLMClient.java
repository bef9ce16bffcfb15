package com.interview.assistant.ai.service;

public interface LLMClient {
    /**
     * @param system      시스템 프롬프트
     * @param user        사용자 프롬프트
     * @param temperature 샘플링 온도
     * @param maxTokens   최대 생성 토큰
     * @return 모델 응답 원문 (비어 있을 수 있음)
     */
    String complete(String system, String user, double temperature, int maxTokens);
}
