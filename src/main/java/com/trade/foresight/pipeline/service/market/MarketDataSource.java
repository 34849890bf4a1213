package com.trade.foresight.pipeline.service.market;

import com.trade.foresight.pipeline.model.PriceCandle;

import java.time.Instant;
import java.util.List;

public interface MarketDataSource {

    /**
     * Closed candles with open time at or after {@code fromInclusive}, ascending.
     */
    List<PriceCandle> fetchSince(String symbol, Instant fromInclusive);
}
