package com.riskguard.api.dto.response;

import com.riskguard.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body of the admin API. {@code retryable} tells a relaying adapter whether to send
 * the same request again.
 */
@Getter
@Builder
public class ApiErrorResponse {

    private final String code;
    private final String message;
    private final boolean retryable;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Instant timestamp) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .details(details != null ? details : Map.of())
                .path(path)
                .timestamp(timestamp)
                .build();
    }
}
