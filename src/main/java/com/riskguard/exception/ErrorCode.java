package com.riskguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned by the admin API and carried by every {@link BaseException}.
 * Retryable codes describe conditions that clear without operator action.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    CONFIG_ERROR("CONFIG_ERROR", 500, false),
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", 503, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    BROKER_ERROR("BROKER_ERROR", 502, false),
    BROKER_TRANSIENT("BROKER_TRANSIENT", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
