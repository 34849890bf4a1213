package com.trade.foresight.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One-minute OHLCV candle. On the wire the symbol is implied by the topic,
 * so it is not serialized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceCandle {

    @JsonIgnore
    private String symbol;

    private Instant openTime;
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;

    /** OHLC ordering holds and volume is non-negative. */
    @JsonIgnore
    public boolean isValid() {
        if (openTime == null) return false;
        if (Double.isNaN(open) || Double.isNaN(high) || Double.isNaN(low) || Double.isNaN(close)) return false;
        return high >= Math.max(Math.max(open, close), low)
                && low <= Math.min(Math.min(open, close), high)
                && volume >= 0;
    }
}
