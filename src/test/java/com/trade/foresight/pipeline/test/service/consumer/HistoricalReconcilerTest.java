package com.trade.foresight.pipeline.test.service.consumer;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.InferenceException;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.consumer.HistoricalReconciler;
import com.trade.foresight.pipeline.service.consumer.PredictionLog;
import com.trade.foresight.pipeline.service.inference.InferenceClient;
import com.trade.foresight.pipeline.service.market.LocalPriceLedger;
import com.trade.foresight.pipeline.service.store.CandleStoreService;
import com.trade.foresight.pipeline.service.store.ChunkedBatchWriter;
import com.trade.foresight.pipeline.service.store.PredictionUpsertService;
import com.trade.foresight.pipeline.test.Candles;
import com.trade.foresight.pipeline.test.InMemoryCandleDocumentGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class HistoricalReconcilerTest {

    private static final ControlEntity ENTITY = ControlEntity.of("BTCUSDT", "lightgbm", "v1");

    @TempDir
    Path dir;

    private InMemoryCandleDocumentGateway gateway;
    private CandleStoreService store;
    private LocalPriceLedger ledger;
    private InferenceClient inference;
    private PredictionLog predictionLog;
    private HistoricalReconciler reconciler;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryCandleDocumentGateway();
        ChunkedBatchWriter writer = new ChunkedBatchWriter(500, Duration.ZERO, d -> { });
        store = new CandleStoreService(gateway, writer, Duration.ofDays(180));
        ledger = new LocalPriceLedger(dir.resolve("prices"));
        inference = mock(InferenceClient.class);
        predictionLog = new PredictionLog(dir.resolve("predictions"));
        ForesightProperties props = new ForesightProperties();
        props.getConsumer().setSeqLen(30);
        props.getConsumer().setInferenceChunk(4);
        reconciler = new HistoricalReconciler(store, ledger, inference,
                new PredictionUpsertService(gateway, writer, store, 100), predictionLog, props);
    }

    private static List<List<Double>> answers(int n) {
        List<List<Double>> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(Arrays.asList(0.2, 0.3, 0.5));
        return out;
    }

    @Test
    void scoresOnlyCandlesWithFullLedgerWindow() throws Exception {
        List<PriceCandle> cs = Candles.minutes(Candles.T0, 35);
        ledger.append("BTCUSDT", cs);
        store.bulkInsert("BTCUSDT", cs);
        when(inference.predict(anyList(), eq("lightgbm"), eq("v1")))
                .thenAnswer(inv -> answers(((List<?>) inv.getArgument(0)).size()));

        int stored = reconciler.reconcile(ENTITY);

        // candles 29..34 have 30 rows behind them; two chunks of 4 and 2
        assertThat(stored).isEqualTo(6);
        verify(inference, times(2)).predict(anyList(), eq("lightgbm"), eq("v1"));
        assertThat(store.countPredictions("BTCUSDT", "lightgbm_v1")).isEqualTo(6);
        assertThat(store.firstMissingTime("BTCUSDT", "lightgbm_v1")).contains(Candles.T0);
        assertThat(Files.readAllLines(predictionLog.fileFor(ENTITY))).hasSize(7);
    }

    @Test
    void failedChunkIsSkipped() throws Exception {
        List<PriceCandle> cs = Candles.minutes(Candles.T0, 35);
        ledger.append("BTCUSDT", cs);
        store.bulkInsert("BTCUSDT", cs);
        when(inference.predict(anyList(), eq("lightgbm"), eq("v1")))
                .thenThrow(new InferenceException("server down"))
                .thenAnswer(inv -> answers(((List<?>) inv.getArgument(0)).size()));

        assertThat(reconciler.reconcile(ENTITY)).isEqualTo(2);
        assertThat(store.countPredictions("BTCUSDT", "lightgbm_v1")).isEqualTo(2);
    }

    @Test
    void nothingMissingMeansNoInference() {
        assertThat(reconciler.reconcile(ENTITY)).isZero();
        verify(inference, never()).predict(anyList(), eq("lightgbm"), eq("v1"));
    }

    @Test
    void missingLedgerLeavesCandlesAlone() {
        store.bulkInsert("BTCUSDT", Candles.minutes(Candles.T0, 40));

        assertThat(reconciler.reconcile(ENTITY)).isZero();
        verify(inference, never()).predict(anyList(), eq("lightgbm"), eq("v1"));
    }

    @Test
    void cancellationStopsBeforeTheNextChunk() throws Exception {
        List<PriceCandle> cs = Candles.minutes(Candles.T0, 35);
        ledger.append("BTCUSDT", cs);
        store.bulkInsert("BTCUSDT", cs);
        AtomicBoolean deleted = new AtomicBoolean();
        when(inference.predict(anyList(), eq("lightgbm"), eq("v1"))).thenAnswer(inv -> {
            deleted.set(true);
            return answers(((List<?>) inv.getArgument(0)).size());
        });

        assertThat(reconciler.reconcile(ENTITY, deleted::get)).isEqualTo(4);
        verify(inference, times(1)).predict(anyList(), eq("lightgbm"), eq("v1"));
        assertThat(store.countPredictions("BTCUSDT", "lightgbm_v1")).isEqualTo(4);
    }
}
