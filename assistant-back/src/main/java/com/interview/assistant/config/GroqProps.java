package com.interview.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.groq")
@Data
public class GroqProps {
    private String apiKey = "";                                    // GROQ_API_KEY
    private String baseUrl = "https://api.groq.com/openai/v1";     // OpenAI 호환 엔드포인트
    private String whisperModel = "whisper-large-v3-turbo";
    private String transcriptionLanguage = "en";
    private String llmModel = "llama-3.1-8b-instant";
    private double timeoutSeconds = 8.0;
    private double temperature = 0.2;
    private int maxTokens = 180;
    private int maxSentences = 4;
    private String systemPrompt = "You are a professional technical consultant in a live client meeting. "
            + "Provide short, confident, business-ready answers. "
            + "No long explanations. "
            + "No filler words. "
            + "Keep answers under 4 sentences.";
}
