package com.trade.foresight.pipeline.common;

import java.util.function.Predicate;

/**
 * Retry predicate for the "inference" and "market" retry instances: transient
 * failures and rate limiting are retried, anything else fails on the first
 * attempt.
 */
public class TransientRetryPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable t) {
        return TransientErrors.isTransient(t) || TransientErrors.isQuota(t);
    }
}
