package com.campaign.canon.core;

/**
 * Base type for every failure raised by the canonical-state core.
 * Each subclass carries a fixed {@link ErrorCode}.
 */
public abstract class CanonException extends RuntimeException {

    private final ErrorCode errorCode;

    protected CanonException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CanonException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
