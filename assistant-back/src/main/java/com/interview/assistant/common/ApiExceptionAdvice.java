package com.interview.assistant.common;

import com.interview.assistant.common.error.ApiException;
import com.interview.assistant.common.error.ErrorCode;
import com.interview.assistant.common.error.IntegrityException;
import com.interview.assistant.common.error.StorageUnavailableException;
import com.interview.assistant.common.error.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionAdvice {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handle(ApiException e) {
        if (e instanceof IntegrityException || e instanceof StorageUnavailableException) {
            log.error("storage failure: {}", e.getMessage(), e);
        } else if (e instanceof UpstreamException u) {
            log.warn("upstream failure: kind={} detail={}", u.getKind(), e.getMessage());
        }
        return body(e.getStatus(), e.getErrorCode().value(), e.getClientMessage());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception e) {
        log.debug("invalid request payload: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(ErrorCode.VALIDATION_ERROR.value(), "Invalid request payload.", "INVALID_REQUEST"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException e) {
        return body(HttpStatus.PAYLOAD_TOO_LARGE, ErrorCode.VALIDATION_ERROR.value(), "Audio file is too large.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        // 404/405 등 스프링 MVC가 상태코드를 이미 알고 있는 경우
        if (e instanceof org.springframework.web.ErrorResponse mvc) {
            HttpStatus status = HttpStatus.valueOf(mvc.getStatusCode().value());
            return body(status, "http_error", status.getReasonPhrase());
        }
        log.error("Unhandled server error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal_server_error", "Unexpected server error.", "INTERNAL_ERROR"));
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, detail, status.value()));
    }
}
