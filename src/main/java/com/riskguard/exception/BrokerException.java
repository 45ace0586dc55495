package com.riskguard.exception;

/**
 * Non-retryable failure reported by the broker (order rejected, unknown symbol, etc.).
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }

    protected BrokerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
