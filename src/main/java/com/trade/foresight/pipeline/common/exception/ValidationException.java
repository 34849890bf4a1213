package com.trade.foresight.pipeline.common.exception;

/**
 * Exception thrown when input validation fails.
 */
public class ValidationException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
