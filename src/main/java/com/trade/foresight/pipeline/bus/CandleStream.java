package com.trade.foresight.pipeline.bus;

import com.trade.foresight.pipeline.model.PriceCandle;

import java.time.Duration;
import java.util.List;

/**
 * Subscription to a symbol's candle topic. One element per received message.
 */
public interface CandleStream extends AutoCloseable {

    List<List<PriceCandle>> poll(Duration timeout);

    @Override
    void close();
}
