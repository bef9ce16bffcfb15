package com.interview.assistant.chat.controller;

import com.interview.assistant.chat.dto.ChatHistoryResponse;
import com.interview.assistant.chat.dto.ChatItem;
import com.interview.assistant.chat.dto.ChatRequest;
import com.interview.assistant.chat.dto.ChatResponse;
import com.interview.assistant.chat.service.AssistantService;
import com.interview.assistant.chat.service.ChatHistoryService;
import com.interview.assistant.security.Identity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/chat")
@RequiredArgsConstructor
public class ChatController {

    private final AssistantService assistantService;
    private final ChatHistoryService chatHistoryService;

    @PostMapping("/respond")
    public ChatResponse respond(@Valid @RequestBody ChatRequest req,
                                @AuthenticationPrincipal Identity identity) {
        return new ChatResponse(assistantService.respond(identity, req.message()));
    }

    /** 내 대화 기록 (오래된 순, limit 1..200) */
    @GetMapping("/history")
    public ChatHistoryResponse history(@RequestParam(name = "limit", defaultValue = "50") int limit,
                                       @AuthenticationPrincipal Identity identity) {
        return new ChatHistoryResponse(chatHistoryService.fetchChatHistory(identity.id(), limit).stream()
                .map(ChatItem::from)
                .toList());
    }
}
