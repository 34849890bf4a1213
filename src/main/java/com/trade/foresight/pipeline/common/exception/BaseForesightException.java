package com.trade.foresight.pipeline.common.exception;

import lombok.Getter;

/**
 * Base exception for the pipeline. Every failure surfaced by a store, the
 * inference endpoint or the control plane carries an error code.
 */
@Getter
public abstract class BaseForesightException extends RuntimeException {

    private final String errorCode;

    protected BaseForesightException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseForesightException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseForesightException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
