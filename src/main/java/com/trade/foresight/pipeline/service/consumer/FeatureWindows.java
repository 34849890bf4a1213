package com.trade.foresight.pipeline.service.consumer;

import com.trade.foresight.pipeline.model.PriceCandle;

import java.util.List;

/**
 * Feature vector of a candle window: open, high, low, close and volume,
 * each min-max scaled over the window (a constant column keeps its raw values),
 * flattened row by row to {@code seqLen * 5} values. Shorter windows are
 * zero padded at the front.
 */
public final class FeatureWindows {

    public static final int FIELDS = 5;

    private FeatureWindows() {
    }

    public static double[] vector(List<PriceCandle> window, int seqLen) {
        int n = Math.min(window.size(), seqLen);
        List<PriceCandle> rows = window.subList(window.size() - n, window.size());

        double[][] cols = new double[FIELDS][n];
        for (int i = 0; i < n; i++) {
            PriceCandle c = rows.get(i);
            cols[0][i] = c.getOpen();
            cols[1][i] = c.getHigh();
            cols[2][i] = c.getLow();
            cols[3][i] = c.getClose();
            cols[4][i] = c.getVolume();
        }
        for (double[] col : cols) {
            scale(col);
        }

        double[] out = new double[seqLen * FIELDS];
        int pad = seqLen - n;
        for (int i = 0; i < n; i++) {
            for (int f = 0; f < FIELDS; f++) {
                out[(pad + i) * FIELDS + f] = cols[f][i];
            }
        }
        return out;
    }

    private static void scale(double[] col) {
        if (col.length == 0) return;
        double min = col[0];
        double max = col[0];
        for (double v : col) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (max <= min) return;
        double range = max - min;
        for (int i = 0; i < col.length; i++) {
            col[i] = (col[i] - min) / range;
        }
    }
}
