package com.trade.foresight.pipeline.service.consumer;

import com.trade.foresight.pipeline.bus.CandleStream;
import com.trade.foresight.pipeline.bus.CandleStreamFactory;
import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;
import com.trade.foresight.pipeline.model.PredictionRecord;
import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.control.ControlPlane;
import com.trade.foresight.pipeline.service.inference.InferenceClient;
import com.trade.foresight.pipeline.service.store.PredictionUpsertService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The consumer process for one (symbol, model, version).
 * <pre>
 * WAIT --START--> RUNNING --PAUSE--> PAUSED --START--> RUNNING
 *   any non-terminal --DELETE--> DELETED, unrecoverable failure --> ERROR
 * </pre>
 * Startup: announce WAIT, block until START, announce RUNNING and start the
 * control monitor, check the model is served, backfill missing predictions,
 * then score the stream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsumerRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    private final ControlPlane control;
    private final InferenceClient inference;
    private final HistoricalReconciler reconciler;
    private final PredictionUpsertService upserts;
    private final PredictionLog predictionLog;
    private final CandleStreamFactory streams;
    private final ConsumerControlMonitor monitor;
    private final ForesightProperties props;
    private final Sleeper sleeper;

    private volatile boolean stopping;

    @PreDestroy
    public void stop() {
        stopping = true;
    }

    public int run(ControlEntity entity) {
        log.info("Starting consumer for {}", entity);
        try {
            ControlPhase pending = control.current(entity).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
            // a START or DELETE written before this process came up is kept
            if (pending != ControlPhase.START && pending != ControlPhase.DELETE) {
                control.write(entity, ControlPhase.WAIT);
            }
            if (!awaitStart(entity)) {
                return EXIT_OK;
            }
            control.write(entity, ControlPhase.RUNNING);
            // watch for PAUSE/DELETE from here on, reconciliation included
            monitor.start(entity);

            if (!inference.isModelAvailable(entity.getModel(), entity.getVersion())) {
                log.error("Model {}/{} is not available", entity.getModel(), entity.getVersion());
                control.write(entity, ControlPhase.ERROR, "Model not available");
                return EXIT_ERROR;
            }

            reconciler.reconcile(entity, monitor::isTerminated);
            if (monitor.isTerminated()) {
                log.info("Deleted during reconciliation, not starting the stream");
                return EXIT_OK;
            }
            stream(entity);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("Consumer interrupted, shutting down...");
        } catch (RuntimeException e) {
            log.error("Error running consumer {}: {}", entity, e.getMessage(), e);
            control.write(entity, ControlPhase.ERROR, String.valueOf(e.getMessage()));
            return EXIT_ERROR;
        } finally {
            monitor.stop();
        }
        if (!monitor.isTerminated()) {
            control.write(entity, ControlPhase.DELETED);
        }
        return EXIT_OK;
    }

    /**
     * @return false when DELETE arrived before START (DELETED already written)
     */
    private boolean awaitStart(ControlEntity entity) throws InterruptedException {
        log.info("Waiting for start command...");
        while (!stopping) {
            ControlPhase phase = control.read(entity, props.getControl().getReadTimeout());
            if (phase == ControlPhase.START) {
                return true;
            }
            if (phase == ControlPhase.DELETE) {
                log.info("Received delete command before start");
                control.write(entity, ControlPhase.DELETED);
                return false;
            }
            sleeper.sleep(props.getConsumer().getStartPollInterval());
        }
        control.write(entity, ControlPhase.DELETED);
        return false;
    }

    private void stream(ControlEntity entity) {
        StreamingScorer scorer = new StreamingScorer(props.getConsumer().getSeqLen());
        log.info("Starting consumer pipeline...");
        try (CandleStream stream = streams.open(entity)) {
            while (!stopping && !monitor.isTerminated()) {
                for (List<PriceCandle> batch : stream.poll(props.getConsumer().getPollTimeout())) {
                    process(entity, scorer, batch);
                }
            }
        }
    }

    /**
     * Scores one message. Failures are logged; the cursor does not move and
     * reconciliation picks the candle up on the next start.
     */
    public void process(ControlEntity entity, StreamingScorer scorer, List<PriceCandle> batch) {
        ControlPhase phase = control.current(entity).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
        if (phase != ControlPhase.RUNNING) {
            log.debug("Skipping batch of {} while {}", batch.size(), phase.getCode());
            return;
        }
        Optional<StreamingScorer.ScoringRequest> req = scorer.offer(batch);
        if (!req.isPresent()) return;

        PriceCandle target = req.get().getTarget();
        try {
            List<List<Double>> preds = inference.predict(
                    Collections.singletonList(req.get().getFeatures()), entity.getModel(), entity.getVersion());
            if (preds.isEmpty()) return;
            List<Double> prediction = preds.get(0);

            upserts.upsert(entity.getSymbol(), entity.predictionColumn(),
                    Collections.singletonList(new PredictionRecord(target, prediction)));
            try {
                predictionLog.append(entity, target.getOpenTime(), prediction);
            } catch (IOException e) {
                log.error("Error writing predictions log: {}", e.toString());
            }
            scorer.commit(target.getOpenTime());
            log.info("Processed prediction for {}", target.getOpenTime());
        } catch (RuntimeException e) {
            log.error("Error processing prediction for {}: {}", target.getOpenTime(), e.getMessage());
        }
    }
}
