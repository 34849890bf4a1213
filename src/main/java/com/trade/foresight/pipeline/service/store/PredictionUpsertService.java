package com.trade.foresight.pipeline.service.store;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.PredictionRecord;
import com.trade.foresight.pipeline.model.PriceCandle;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes prediction vectors into the {@code {model}_{version}} column of the
 * candle documents. Rerunning with the same input leaves the collection unchanged.
 * <p>
 * Small batches update document by document and learn what is missing from the
 * update result. Batches at or above the threshold do one bulk field update and
 * then ask the store which keys exist. Either way the missing keys are written
 * as full rows, after which the retention window is trimmed.
 */
@Slf4j
@Service
public class PredictionUpsertService {

    private final CandleDocumentGateway gateway;
    private final ChunkedBatchWriter writer;
    private final CandleStoreService candles;
    private final int threshold;

    @Autowired
    public PredictionUpsertService(CandleDocumentGateway gateway, ChunkedBatchWriter writer,
                                   CandleStoreService candles, ForesightProperties props) {
        this(gateway, writer, candles, props.getConsumer().getUpsertThreshold());
    }

    public PredictionUpsertService(CandleDocumentGateway gateway, ChunkedBatchWriter writer,
                                   CandleStoreService candles, int threshold) {
        this.gateway = gateway;
        this.writer = writer;
        this.candles = candles;
        this.threshold = threshold;
    }

    public UpsertOutcome upsert(String symbol, String column, List<PredictionRecord> records) {
        if (records == null || records.isEmpty()) {
            return new UpsertOutcome(0, 0);
        }
        String coll = CandleStoreService.collection(symbol);

        // last record wins for a repeated open time
        Map<String, PredictionRecord> byId = new LinkedHashMap<>();
        for (PredictionRecord r : records) {
            byId.put(CandleDocumentGateway.documentId(r.getCandle().getOpenTime()), r);
        }

        List<String> missing = byId.size() < threshold
                ? updateOneByOne(coll, column, byId)
                : updateInBulk(coll, column, byId);

        if (!missing.isEmpty()) {
            List<PredictionRecord> rows = new ArrayList<>();
            for (String id : missing) rows.add(byId.get(id));
            writer.write("insert rows " + coll + "." + column, rows, chunk -> {
                Map<PriceCandle, List<Double>> part = new LinkedHashMap<>();
                chunk.forEach(r -> part.put(r.getCandle(), r.getValues()));
                gateway.upsertRows(coll, column, part);
            });
            candles.trimRetention(symbol);
        }

        UpsertOutcome out = new UpsertOutcome(byId.size() - missing.size(), missing.size());
        log.info("Upserted {}.{}: updated={} inserted={}", coll, column, out.getUpdated(), out.getInserted());
        return out;
    }

    private List<String> updateOneByOne(String coll, String column, Map<String, PredictionRecord> byId) {
        // a set: a chunk retried after a quota error reports its misses again
        Set<String> missing = new LinkedHashSet<>();
        List<Map.Entry<String, PredictionRecord>> entries = new ArrayList<>(byId.entrySet());
        writer.write("update " + coll + "." + column, entries, chunk -> {
            for (Map.Entry<String, PredictionRecord> e : chunk) {
                if (!gateway.setColumn(coll, e.getKey(), column, e.getValue().getValues())) {
                    missing.add(e.getKey());
                }
            }
        });
        return new ArrayList<>(missing);
    }

    private List<String> updateInBulk(String coll, String column, Map<String, PredictionRecord> byId) {
        List<Map.Entry<String, PredictionRecord>> entries = new ArrayList<>(byId.entrySet());
        writer.write("bulk update " + coll + "." + column, entries, chunk -> {
            Map<String, List<Double>> part = new LinkedHashMap<>();
            chunk.forEach(e -> part.put(e.getKey(), e.getValue().getValues()));
            gateway.setColumnBulk(coll, column, part);
        });
        Set<String> present = gateway.existingIds(coll, byId.keySet());
        List<String> missing = new ArrayList<>();
        for (String id : byId.keySet()) {
            if (!present.contains(id)) missing.add(id);
        }
        return missing;
    }

    @Value
    public static class UpsertOutcome {
        int updated;
        int inserted;
    }
}
