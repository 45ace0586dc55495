package com.riskguard.exception;

/**
 * The embedded store could not complete a read-modify-write. The operation that raised it
 * is treated as not done, so the caller retries on the next tick or event.
 */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
