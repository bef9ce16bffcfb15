package com.interview.assistant.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interview.assistant.common.error.ApiException;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 컨트롤러 밖(시큐리티 필터/엔트리포인트)에서 {@link ErrorResponse}를 직접 써야 할 때 사용.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse res, ApiException e) throws IOException {
        int status = e.getStatus().value();
        res.setStatus(status);
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(res.getOutputStream(),
                ErrorResponse.of(e.getErrorCode().value(), e.getClientMessage(), status));
    }
}
