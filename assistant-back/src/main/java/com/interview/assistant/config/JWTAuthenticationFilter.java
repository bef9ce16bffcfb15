package com.interview.assistant.config;

import com.interview.assistant.common.ErrorResponseWriter;
import com.interview.assistant.common.error.ApiException;
import com.interview.assistant.common.error.AuthenticationFailedException;
import com.interview.assistant.security.AuthenticationGate;
import com.interview.assistant.security.Identity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JWTAuthenticationFilter extends OncePerRequestFilter {

    /** 인증 실패 사유를 엔트리포인트로 넘길 때 쓰는 request attribute */
    public static final String AUTH_FAILURE_ATTR = JWTAuthenticationFilter.class.getName() + ".FAILURE";

    private static final String BEARER = "Bearer ";

    private final AuthenticationGate authenticationGate;
    private final ErrorResponseWriter errorResponseWriter;

    /** 인증이 필요 없는 경로는 필터를 아예 건너뜁니다. */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI().substring(request.getContextPath().length());
        return "/auth/signup".equals(p)
                || "/auth/login".equals(p)
                || "/health".equals(p)
                || "OPTIONS".equalsIgnoreCase(request.getMethod()); // CORS preflight
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String token = bearerToken(req.getHeader(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            try {
                Identity identity = authenticationGate.resolve(token);
                if (SecurityContextHolder.getContext().getAuthentication() == null) {
                    var auth = new UsernamePasswordAuthenticationToken(identity, null, List.of());
                    SecurityContextHolder.getContext().setAuthentication(auth);
                }
            } catch (AuthenticationFailedException e) {
                log.debug("bearer rejected: {}", e.getReason());
                // 그냥 통과 → 보호 리소스면 엔트리포인트에서 401
                req.setAttribute(AUTH_FAILURE_ATTR, e);
            } catch (ApiException e) {
                // 저장소 장애 등: 인증 실패로 뭉개지 않고 그대로 응답
                log.error("authentication lookup failed: {}", e.getMessage(), e);
                errorResponseWriter.write(res, e);
                return;
            }
        }
        chain.doFilter(req, res);
    }

    /** "Bearer xxx" 가 아니면 자격 증명 없음으로 취급 */
    private static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return null;
        }
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
