package com.trade.foresight.pipeline.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * Identity of a worker in the control plane: (symbol, model, version).
 * The producer is the fixed entity ALL/producer/main and the job dispatcher
 * ALL/dispatcher/main.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ControlEntity {

    public static final String PRODUCER_SYMBOL = "ALL";
    public static final String PRODUCER_MODEL = "producer";
    public static final String PRODUCER_VERSION = "main";
    public static final String DISPATCHER_MODEL = "dispatcher";

    String symbol;
    String model;
    String version;

    public static ControlEntity of(String symbol, String model, String version) {
        if (isBlank(symbol) || isBlank(model) || isBlank(version)) {
            throw new IllegalArgumentException("symbol, model and version are required");
        }
        String s = symbol.trim();
        return new ControlEntity(
                PRODUCER_SYMBOL.equalsIgnoreCase(s) ? PRODUCER_SYMBOL : s.toUpperCase(Locale.ROOT),
                model.trim().toLowerCase(Locale.ROOT),
                version.trim().toLowerCase(Locale.ROOT));
    }

    public static ControlEntity producer() {
        return new ControlEntity(PRODUCER_SYMBOL, PRODUCER_MODEL, PRODUCER_VERSION);
    }

    public static ControlEntity dispatcher() {
        return new ControlEntity(PRODUCER_SYMBOL, DISPATCHER_MODEL, PRODUCER_VERSION);
    }

    /** Inverse of {@link #key()}; expects exactly three underscore separated parts. */
    public static ControlEntity parse(String key) {
        String[] parts = key == null ? new String[0] : key.split("_");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Not a control key: " + key);
        }
        return of(parts[0], parts[1], parts[2]);
    }

    public boolean isProducer() {
        return PRODUCER_SYMBOL.equals(symbol) && PRODUCER_MODEL.equals(model);
    }

    public boolean isDispatcher() {
        return PRODUCER_SYMBOL.equals(symbol) && DISPATCHER_MODEL.equals(model);
    }

    /** A per-version inference worker, as opposed to the producer or the dispatcher. */
    public boolean isConsumer() {
        return !isProducer() && !isDispatcher();
    }

    /** e.g. BTCUSDT_lightgbm_v1 or ALL_producer_main */
    public String key() {
        return symbol + "_" + model + "_" + version;
    }

    /** Prediction column on the candle document, e.g. lightgbm_v1. */
    public String predictionColumn() {
        return model + "_" + version;
    }

    @Override
    public String toString() {
        return key();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
