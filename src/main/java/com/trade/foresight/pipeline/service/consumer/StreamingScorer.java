package com.trade.foresight.pipeline.service.consumer;

import com.trade.foresight.pipeline.model.PriceCandle;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Rolling window of the last {@code seqLen} candles seen by a consumer.
 * Each accepted batch yields at most one scoring request: the newest candle.
 * The cursor only moves on {@link #commit(Instant)}, after the prediction is stored.
 * <p>
 * Not thread-safe; owned by the consumer's poll loop.
 */
public class StreamingScorer {

    private final int seqLen;
    private final Deque<PriceCandle> window = new ArrayDeque<>();
    private Instant cursor;

    public StreamingScorer(int seqLen) {
        if (seqLen < 1) throw new IllegalArgumentException("seqLen must be positive");
        this.seqLen = seqLen;
    }

    /**
     * Sorts the batch, drops rows at or before the cursor or the window's newest
     * row, and appends the rest.
     *
     * @return the request for the newest candle once the window is full
     */
    public Optional<ScoringRequest> offer(List<PriceCandle> batch) {
        if (batch == null || batch.isEmpty()) return Optional.empty();
        List<PriceCandle> sorted = new ArrayList<>(batch);
        sorted.removeIf(c -> c == null || c.getOpenTime() == null);
        sorted.sort(Comparator.comparing(PriceCandle::getOpenTime));

        boolean grew = false;
        for (PriceCandle c : sorted) {
            Instant floor = newest();
            if (floor != null && !c.getOpenTime().isAfter(floor)) continue;
            window.addLast(c);
            grew = true;
            while (window.size() > seqLen) window.removeFirst();
        }
        if (!grew || window.size() < seqLen) return Optional.empty();

        List<PriceCandle> rows = new ArrayList<>(window);
        PriceCandle target = rows.get(rows.size() - 1);
        return Optional.of(new ScoringRequest(target, FeatureWindows.vector(rows, seqLen)));
    }

    public void commit(Instant openTime) {
        if (cursor == null || openTime.isAfter(cursor)) {
            cursor = openTime;
        }
    }

    public Optional<Instant> getCursor() {
        return Optional.ofNullable(cursor);
    }

    public int size() {
        return window.size();
    }

    private Instant newest() {
        Instant last = window.isEmpty() ? null : window.peekLast().getOpenTime();
        if (cursor == null) return last;
        if (last == null) return cursor;
        return last.isAfter(cursor) ? last : cursor;
    }

    @Value
    public static class ScoringRequest {
        PriceCandle target;
        double[] features;
    }
}
