package com.trade.foresight.pipeline.common.exception;

/**
 * Raised for a job file whose name or content does not describe a known job.
 */
public class JobDescriptorException extends BaseForesightException {
    private static final String DEFAULT_ERROR_CODE = "ERR-JOB-001";

    public JobDescriptorException(String message) {
        super(message);
    }

    public JobDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
