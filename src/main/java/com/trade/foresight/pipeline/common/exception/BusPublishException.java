package com.trade.foresight.pipeline.common.exception;

/**
 * Raised when a candle chunk is not acknowledged by the broker.
 */
public class BusPublishException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BUS-001";

    public BusPublishException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
