package com.trade.foresight.pipeline.enums;

import java.util.Locale;

/**
 * Model families with a slot directory under {@code models/}. Each family
 * ships side files next to its main artifact, matched by a glob.
 */
public enum ModelType {
    LIGHTGBM("lightgbm", "*_features.pkl"),
    TST("tst", "*scaler*.pkl"),
    FINBERT("finbert", null),
    ENSEMBLE("ensemble", null);

    private final String key;
    private final String sideFileGlob;

    ModelType(String key, String sideFileGlob) {
        this.key = key;
        this.sideFileGlob = sideFileGlob;
    }

    public String getKey() {
        return key;
    }

    /** Null when the family has no side files. */
    public String getSideFileGlob() {
        return sideFileGlob;
    }

    public static ModelType fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("model type is required");
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (ModelType t : values()) {
            if (t.key.equals(k)) return t;
        }
        throw new IllegalArgumentException("Unknown model type: " + key);
    }
}
