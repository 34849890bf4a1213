package com.trade.foresight.pipeline.common.exception;

/**
 * Raised when a model slot operation cannot be carried out.
 */
public class VersionRegistryException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VER-001";

    public VersionRegistryException(String message) {
        super(message);
    }

    public VersionRegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
