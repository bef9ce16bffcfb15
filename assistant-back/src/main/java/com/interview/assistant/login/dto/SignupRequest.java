package com.interview.assistant.login.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotNull @Size(min = 1, max = 128) String username,
        /** 원문 비밀번호(서버에서 해시) */
        @NotNull @Size(min = 1, max = 128) String password
) {}
