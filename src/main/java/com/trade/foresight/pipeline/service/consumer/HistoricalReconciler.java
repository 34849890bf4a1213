package com.trade.foresight.pipeline.service.consumer;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.PredictionRecord;
import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.inference.InferenceClient;
import com.trade.foresight.pipeline.service.market.LocalPriceLedger;
import com.trade.foresight.pipeline.service.store.CandleStoreService;
import com.trade.foresight.pipeline.service.store.PredictionUpsertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Backfills the prediction column for candles stored while this consumer was
 * not running. For each open time missing the column, the window of
 * {@code seq-len} ledger rows ending at it is scored; candles without a full
 * window in the ledger are left alone. Work is done in chunks of
 * {@code inference-chunk}; a failed chunk is logged and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalReconciler {

    private final CandleStoreService store;
    private final LocalPriceLedger ledger;
    private final InferenceClient inference;
    private final PredictionUpsertService upserts;
    private final PredictionLog predictionLog;
    private final ForesightProperties props;

    /**
     * @return number of predictions stored
     */
    public int reconcile(ControlEntity entity) {
        return reconcile(entity, () -> false);
    }

    /**
     * Same as {@link #reconcile(ControlEntity)}, checking {@code cancelled}
     * before each chunk so a DELETE can end a long backfill early.
     *
     * @return number of predictions stored
     */
    public int reconcile(ControlEntity entity, BooleanSupplier cancelled) {
        final String symbol = entity.getSymbol();
        final String column = entity.predictionColumn();
        final int seqLen = props.getConsumer().getSeqLen();
        log.info("Starting historical reconciliation for {}", entity);

        List<Instant> missing = store.missingPredictionTimes(symbol, column);
        if (missing.isEmpty()) {
            log.info("No missing predictions found");
            return 0;
        }
        log.info("Found {} missing predictions", missing.size());

        List<PriceCandle> rows;
        try {
            rows = ledger.readAll(symbol);
        } catch (IOException e) {
            log.error("Error reading price ledger for {}: {}", symbol, e.toString());
            return 0;
        }
        Map<Instant, Integer> index = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) index.put(rows.get(i).getOpenTime(), i);

        List<PriceCandle> targets = new ArrayList<>();
        List<double[]> features = new ArrayList<>();
        for (Instant t : missing) {
            Integer idx = index.get(t);
            if (idx == null || idx < seqLen - 1) continue;
            targets.add(rows.get(idx));
            features.add(FeatureWindows.vector(rows.subList(idx - seqLen + 1, idx + 1), seqLen));
        }
        if (targets.isEmpty()) {
            log.info("No price data found for missing time periods");
            return 0;
        }
        log.info("Processing {} missing predictions", targets.size());

        int stored = 0;
        int chunk = props.getConsumer().getInferenceChunk();
        for (int from = 0; from < targets.size(); from += chunk) {
            if (cancelled.getAsBoolean()) {
                log.info("Historical reconciliation for {} cancelled after {} predictions", entity, stored);
                return stored;
            }
            int to = Math.min(from + chunk, targets.size());
            try {
                List<List<Double>> preds = inference.predict(features.subList(from, to), entity.getModel(), entity.getVersion());
                List<PredictionRecord> records = new ArrayList<>(preds.size());
                for (int i = 0; i < preds.size(); i++) {
                    records.add(new PredictionRecord(targets.get(from + i), preds.get(i)));
                }
                upserts.upsert(symbol, column, records);
                stored += records.size();
                appendLog(entity, records);
            } catch (RuntimeException e) {
                log.error("Error reconciling rows {}..{} for {}: {}", from, to - 1, entity, e.getMessage());
            }
        }
        log.info("Historical reconciliation stored {} predictions for {}", stored, entity);
        return stored;
    }

    private void appendLog(ControlEntity entity, List<PredictionRecord> records) {
        try {
            for (PredictionRecord r : records) {
                predictionLog.append(entity, r.getCandle().getOpenTime(), r.getValues());
            }
        } catch (IOException e) {
            log.error("Error writing predictions log: {}", e.toString());
        }
    }
}
