package com.trade.foresight.pipeline.common.exception;

import lombok.Getter;

/**
 * Exception thrown when a document store write fails. {@code quota} is set
 * when the store rejected the write because of rate or quota limits.
 */
@Getter
public class StoreWriteException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-STORE-001";
    private static final String QUOTA_ERROR_CODE = "ERR-STORE-429";

    private final boolean quota;

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
        this.quota = false;
    }

    public StoreWriteException(String message, Throwable cause, boolean quota) {
        super(quota ? QUOTA_ERROR_CODE : DEFAULT_ERROR_CODE, message, cause);
        this.quota = quota;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
