package com.interview.assistant.chat.service;

import com.interview.assistant.ai.service.AnswerService;
import com.interview.assistant.ai.service.GroqCredentials;
import com.interview.assistant.ai.service.TranscriptionClient;
import com.interview.assistant.chat.dto.ProcessAudioResponse;
import com.interview.assistant.common.error.ValidationException;
import com.interview.assistant.config.AudioProps;
import com.interview.assistant.security.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * 텍스트 질문 / 음성 업로드 → 답변 생성 → 대화 기록.
 * 제공자 호출이 모두 성공한 뒤에만 기록한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssistantService {

    private final GroqCredentials credentials;
    private final AnswerService answerService;
    private final TranscriptionClient transcriptionClient;
    private final ChatHistoryService chatHistoryService;
    private final AudioProps audioProps;

    public String respond(Identity identity, String message) {
        credentials.requireConfigured();

        String answer = answerService.generateShortAnswer(message);
        chatHistoryService.recordExchange(identity.id(), message, answer);
        return answer;
    }

    public ProcessAudioResponse processAudio(Identity identity, MultipartFile audio) {
        credentials.requireConfigured();

        if (!StringUtils.hasText(audio.getOriginalFilename())) {
            throw new ValidationException("Audio filename is missing.");
        }
        String contentType = audio.getContentType();
        if (StringUtils.hasText(contentType) && !contentType.startsWith("audio/")) {
            throw new ValidationException("Invalid file type. Please upload an audio file.");
        }

        byte[] bytes;
        try {
            bytes = audio.getBytes();
        } catch (IOException e) {
            log.warn("failed to read uploaded audio: {}", audio.getOriginalFilename(), e);
            throw new ValidationException("Could not read uploaded audio.");
        }

        long maxBytes = audioProps.getMaxSizeMb() * FileUtils.ONE_MB;
        if (bytes.length > maxBytes) {
            throw new ValidationException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "Audio file is too large. Max allowed: " + audioProps.getMaxSizeMb() + "MB.");
        }
        if (bytes.length == 0) {
            throw new ValidationException("Uploaded audio file is empty.");
        }

        log.debug("process-audio: user={}, file={}, size={}", identity.username(),
                audio.getOriginalFilename(), FileUtils.byteCountToDisplaySize(bytes.length));

        String transcription = transcriptionClient.transcribe(audio.getOriginalFilename(), bytes);
        String answer = answerService.generateShortAnswer(transcription);

        chatHistoryService.recordExchange(identity.id(), transcription, answer);
        return new ProcessAudioResponse(transcription, answer);
    }
}
