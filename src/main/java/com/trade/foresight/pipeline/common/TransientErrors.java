package com.trade.foresight.pipeline.common;

import com.trade.foresight.pipeline.common.exception.StoreWriteException;
import org.springframework.web.client.HttpStatusCodeException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Message/type based classification of failures coming back from the broker,
 * the document store and the inference endpoint. HTTP errors are classified by
 * status: 5xx is transient, any other status is not.
 */
public final class TransientErrors {

    private static final String[] TRANSIENT_MARKERS = {
            "timed out", "timeout", "connection refused", "connection reset",
            "broker not available", "not leader", "temporarily unavailable",
            "503", "502", "504"
    };

    private static final String[] QUOTA_MARKERS = {
            "quota", "429", "resourceexhausted", "resource exhausted", "too many requests",
            "request rate is large", "toomanyrequests"
    };

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof HttpStatusCodeException) {
                return ((HttpStatusCodeException) c).getStatusCode().is5xxServerError();
            }
            if (c instanceof SocketTimeoutException || c instanceof TimeoutException) return true;
            if (c instanceof IOException && !(c instanceof java.io.FileNotFoundException)) return true;
            if (contains(c.getMessage(), TRANSIENT_MARKERS)) return true;
            if (c.getCause() == c) break;
        }
        return false;
    }

    public static boolean isQuota(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof StoreWriteException && ((StoreWriteException) c).isQuota()) return true;
            if (contains(c.getClass().getSimpleName(), QUOTA_MARKERS)) return true;
            if (contains(c.getMessage(), QUOTA_MARKERS)) return true;
            if (c.getCause() == c) break;
        }
        return false;
    }

    private static boolean contains(String text, String[] markers) {
        if (text == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String m : markers) {
            if (lower.contains(m)) return true;
        }
        return false;
    }
}
