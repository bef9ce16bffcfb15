package com.interview.assistant.chat.controller;

import com.interview.assistant.chat.dto.ProcessAudioResponse;
import com.interview.assistant.chat.service.AssistantService;
import com.interview.assistant.security.Identity;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
public class AudioController {

    private final AssistantService assistantService;

    /** multipart "audio" 파트 → 음성 인식 + 답변 */
    @PostMapping(value = "/process-audio", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ProcessAudioResponse processAudio(@RequestPart("audio") MultipartFile audio,
                                             @AuthenticationPrincipal Identity identity) {
        return assistantService.processAudio(identity, audio);
    }
}
