package com.interview.assistant.chat.dto;

import java.util.List;

public record ChatHistoryResponse(List<ChatItem> items) {}
