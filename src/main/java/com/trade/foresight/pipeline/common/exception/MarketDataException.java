package com.trade.foresight.pipeline.common.exception;

/**
 * Exception thrown when candles cannot be fetched from the upstream market API.
 */
public class MarketDataException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-MKT-001";

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
