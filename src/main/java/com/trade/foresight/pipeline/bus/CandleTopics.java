package com.trade.foresight.pipeline.bus;

import com.trade.foresight.pipeline.model.ControlEntity;

import java.util.Locale;

/**
 * Naming on the bus: one topic per symbol, one consumer group per model version.
 */
public final class CandleTopics {

    private CandleTopics() {
    }

    public static String topic(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }

    public static String consumerGroup(ControlEntity entity) {
        return entity.getModel() + "-" + entity.getVersion() + "-consumer";
    }

    /** {SYMBOL}_batch_{epochMillis}_{offset} */
    public static String batchKey(String symbol, long epochMillis, int offset) {
        return topic(symbol) + "_batch_" + epochMillis + "_" + offset;
    }
}
