package com.riskguard.exception;

import com.riskguard.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions from the admin endpoints onto {@link ApiErrorResponse}. Retryable failures
 * (storage busy, broker throttling) answer with a {@code Retry-After} header.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "1";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error -> fields.put(error.getField(), error.getDefaultMessage()));
        log.warn("stage=api.rejected path={} fields={}", request.getRequestURI(), fields.keySet());
        return respond(ErrorCode.VALIDATION_ERROR, "Request failed validation", fields, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex, HttpServletRequest request) {
        log.warn("stage=api.rejected path={}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Malformed request", null, request);
    }

    /** A relayed broker payload with a non-numeric price, size or P&L field. */
    @ExceptionHandler(NumberFormatException.class)
    public ResponseEntity<ApiErrorResponse> handleBadNumber(NumberFormatException ex, HttpServletRequest request) {
        log.warn("stage=api.rejected path={} bad number: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Event payload has a malformed number", Map.of("cause", String.valueOf(ex.getMessage())), request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleRiskGuard(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("stage=api.failed path={} code={}: {}", request.getRequestURI(), errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("stage=api.rejected path={} code={}: {}", request.getRequestURI(), errorCode.getCode(), ex.getMessage());
        }
        return respond(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("stage=api.failed path={} unexpected error", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "Unexpected error", null, request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse body = ApiErrorResponse.of(errorCode, message, details, request.getRequestURI(), clock.instant());
        ResponseEntity.BodyBuilder response = ResponseEntity.status(errorCode.getHttpStatus());
        if (errorCode.isRetryable()) {
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return response.body(body);
    }
}
