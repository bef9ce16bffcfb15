package com.interview.assistant.login.dto;

import com.interview.assistant.login.entity.User;
import com.interview.assistant.security.IssuedToken;

/** 로그인 성공 결과 (서비스 → 컨트롤러) */
public record LoginResult(IssuedToken token, User user) {}
