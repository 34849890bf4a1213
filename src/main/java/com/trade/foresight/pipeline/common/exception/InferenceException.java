package com.trade.foresight.pipeline.common.exception;

/**
 * Raised when the inference endpoint answers with an error or an unreadable body,
 * or cannot be reached after the configured attempts.
 */
public class InferenceException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-INF-001";

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
