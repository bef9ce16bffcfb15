package com.interview.assistant.security;

public interface JwtProvider {

    /** sub=subject, iat=now, exp=now+설정된 수명 */
    IssuedToken issue(String subject);

    /** 서명+만료 검증 후 sub 반환. 실패 시 {@link InvalidTokenException} */
    String verify(String token);
}
