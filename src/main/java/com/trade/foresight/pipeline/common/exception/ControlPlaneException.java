package com.trade.foresight.pipeline.common.exception;

/**
 * Raised when a control state record cannot be read or written.
 */
public class ControlPlaneException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CTL-001";

    public ControlPlaneException(String message) {
        super(message);
    }

    public ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
