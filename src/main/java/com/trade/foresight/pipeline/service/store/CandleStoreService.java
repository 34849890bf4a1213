package com.trade.foresight.pipeline.service.store;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.PriceCandle;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Candle persistence per symbol: chunked set-merge inserts, the retention
 * window, and the prediction column queries used by consumers and maintenance.
 */
@Slf4j
@Service
public class CandleStoreService {

    private final CandleDocumentGateway gateway;
    private final ChunkedBatchWriter writer;
    private final Duration retention;

    @Autowired
    public CandleStoreService(CandleDocumentGateway gateway, ChunkedBatchWriter writer, ForesightProperties props) {
        this(gateway, writer, Duration.ofDays(props.getStore().getRetentionDays()));
    }

    public CandleStoreService(CandleDocumentGateway gateway, ChunkedBatchWriter writer, Duration retention) {
        this.gateway = gateway;
        this.writer = writer;
        this.retention = retention;
    }

    public static String collection(String symbol) {
        return symbol.toLowerCase(Locale.ROOT);
    }

    /**
     * Set-merges the candles in chunks, then trims the retention window.
     * Failures propagate as StoreWriteException.
     */
    public int bulkInsert(String symbol, List<PriceCandle> candles) {
        if (candles == null || candles.isEmpty()) return 0;
        String coll = collection(symbol);
        writer.write("insert " + coll, candles, chunk -> gateway.mergeCandles(coll, chunk));
        log.info("Inserted {} candles into {}", candles.size(), coll);
        trimRetention(symbol);
        return candles.size();
    }

    /**
     * Deletes documents older than latest open time minus the retention window.
     */
    public int trimRetention(String symbol) {
        String coll = collection(symbol);
        Optional<Instant> latest = gateway.latestOpenTime(coll);
        if (!latest.isPresent()) return 0;
        Instant cutoff = latest.get().minus(retention);
        List<String> stale = gateway.idsOlderThan(coll, cutoff);
        if (stale.isEmpty()) return 0;
        writer.write("trim " + coll, stale, chunk -> gateway.deleteIds(coll, new ArrayList<>(chunk)));
        log.info("Retention: removed {} documents from {} older than {}", stale.size(), coll, cutoff);
        return stale.size();
    }

    public Optional<Instant> lastOpenTime(String symbol) {
        return gateway.latestOpenTime(collection(symbol));
    }

    public List<Instant> missingPredictionTimes(String symbol, String column) {
        return gateway.missingTimes(collection(symbol), column, 0);
    }

    public Optional<Instant> firstMissingTime(String symbol, String column) {
        List<Instant> first = gateway.missingTimes(collection(symbol), column, 1);
        return first.isEmpty() ? Optional.empty() : Optional.of(first.get(0));
    }

    /**
     * First and last open time still missing {@code column}; empty when none are missing.
     */
    public Optional<TimeRange> missingTimeRange(String symbol, String column) {
        Optional<Instant> first = firstMissingTime(symbol, column);
        if (!first.isPresent()) return Optional.empty();
        Instant last = gateway.lastMissingTime(collection(symbol), column).orElse(first.get());
        return Optional.of(new TimeRange(first.get(), last));
    }

    public long countPredictions(String symbol, String column) {
        return gateway.countWithColumn(collection(symbol), column);
    }

    /**
     * Moves {@code {model}_{from}} into {@code {model}_{to}} and clears the source column.
     */
    public int shiftPredictions(String symbol, String model, String fromVersion, String toVersion) {
        String coll = collection(symbol);
        String from = model.toLowerCase(Locale.ROOT) + "_" + fromVersion;
        String to = model.toLowerCase(Locale.ROOT) + "_" + toVersion;
        Map<String, Object> values = gateway.columnValues(coll, from);
        List<Map.Entry<String, Object>> entries = new ArrayList<>(values.entrySet());
        writer.write("shift " + coll + " " + from + "->" + to, entries, chunk -> {
            Map<String, Object> part = new LinkedHashMap<>();
            chunk.forEach(e -> part.put(e.getKey(), e.getValue()));
            gateway.moveColumn(coll, from, to, part);
        });
        log.info("Shifted {} predictions in {} from {} to {}", entries.size(), coll, from, to);
        return entries.size();
    }

    @Value
    public static class TimeRange {
        Instant from;
        Instant to;
    }
}
