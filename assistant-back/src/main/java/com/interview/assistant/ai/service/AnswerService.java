package com.interview.assistant.ai.service;

import com.interview.assistant.common.error.UpstreamException;
import com.interview.assistant.common.error.UpstreamException.Kind;
import com.interview.assistant.common.error.ValidationException;
import com.interview.assistant.config.GroqProps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 질문(또는 음성 인식 결과)에 대한 짧은 미팅용 답변 생성.
 */
@Service
@RequiredArgsConstructor
public class AnswerService {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private final LLMClient llm;
    private final GroqProps props;

    public String generateShortAnswer(String transcription) {
        if (transcription == null || transcription.isBlank()) {
            throw new ValidationException("Transcription is empty.");
        }

        String userPrompt = "Client question/transcript:\n"
                + transcription + "\n\n"
                + "Return only the final meeting-ready answer.";

        String content = llm.complete(props.getSystemPrompt(), userPrompt, props.getTemperature(), props.getMaxTokens());
        if (content == null || content.isBlank()) {
            throw new UpstreamException(Kind.EMPTY_RESULT, "LLM returned empty answer.");
        }
        return limitSentences(content, props.getMaxSentences());
    }

    /** 공백을 한 칸으로 정리하고 앞에서부터 maxSentences 문장만 남긴다 */
    static String limitSentences(String text, int maxSentences) {
        String cleaned = String.join(" ", text.trim().split("\\s+"));
        List<String> parts = Arrays.stream(SENTENCE_END.split(cleaned))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
        if (parts.size() <= maxSentences) {
            return cleaned;
        }
        return String.join(" ", parts.subList(0, maxSentences)).trim();
    }
}
