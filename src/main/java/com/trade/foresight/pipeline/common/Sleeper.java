package com.trade.foresight.pipeline.common;

import java.time.Duration;

/**
 * Blocking pause used by every polling loop, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> {
        if (d != null && !d.isNegative() && !d.isZero()) {
            Thread.sleep(d.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
