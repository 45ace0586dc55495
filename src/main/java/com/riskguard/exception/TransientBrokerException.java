package com.riskguard.exception;

/**
 * Broker failure that is expected to clear on its own: rate limiting, a token refresh
 * in progress, or a call that ran past its timeout. The enforcement executor retries these
 * with backoff; they never reach the rule layer.
 */
public class TransientBrokerException extends BrokerException {

    public TransientBrokerException(String message) {
        super(ErrorCode.BROKER_TRANSIENT, message, null);
    }

    public TransientBrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_TRANSIENT, message, cause);
    }
}
