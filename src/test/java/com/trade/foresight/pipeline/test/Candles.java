package com.trade.foresight.pipeline.test;

import com.trade.foresight.pipeline.model.PriceCandle;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Candle fixtures.
 */
public final class Candles {

    public static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private Candles() {
    }

    public static PriceCandle at(Instant t, double close) {
        return PriceCandle.builder()
                .symbol("BTCUSDT")
                .openTime(t)
                .open(close - 1)
                .high(close + 2)
                .low(close - 2)
                .close(close)
                .volume(10)
                .build();
    }

    /** {@code n} consecutive one-minute candles from {@code start}, closes 100, 101, ... */
    public static List<PriceCandle> minutes(Instant start, int n) {
        List<PriceCandle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(at(start.plus(Duration.ofMinutes(i)), 100 + i));
        }
        return out;
    }
}
