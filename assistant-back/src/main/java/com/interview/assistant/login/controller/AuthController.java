package com.interview.assistant.login.controller;

import com.interview.assistant.login.dto.LoginRequest;
import com.interview.assistant.login.dto.LoginResult;
import com.interview.assistant.login.dto.SignupRequest;
import com.interview.assistant.login.dto.TokenResponse;
import com.interview.assistant.login.dto.UserResponse;
import com.interview.assistant.login.service.AuthService;
import com.interview.assistant.security.Identity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * 회원가입: 아이디/비밀번호는 앞뒤 공백 제거 후 검사.
     * 200 + 생성된 사용자 (비밀번호 해시는 내보내지 않음)
     */
    @PostMapping(value = "/signup", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserResponse> signup(@Valid @RequestBody SignupRequest req) {
        return ResponseEntity.ok(UserResponse.from(authService.signup(req.username(), req.password())));
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest req) {
        LoginResult result = authService.login(req.username(), req.password());
        return ResponseEntity.ok(new TokenResponse(
                result.token().token(),
                TokenResponse.BEARER,
                result.token().expiresInSeconds(),
                UserResponse.from(result.user())
        ));
    }

    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal Identity identity) {
        return UserResponse.from(identity);
    }
}
