package com.interview.assistant.chat.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ChatRequest(@NotNull @Size(min = 1, max = 4000) String message) {}
