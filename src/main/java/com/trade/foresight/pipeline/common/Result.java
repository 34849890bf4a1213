package com.trade.foresight.pipeline.common;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a wait or poll whose failure the caller decides on. Failures
 * carry a short code ({@code TIMEOUT}, {@code INTERRUPTED}) next to the
 * human readable message.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
    }

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public boolean isOk() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public T get() {
        return data;
    }
}
