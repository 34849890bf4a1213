package com.trade.foresight.pipeline.service.training;

import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.enums.TrainingState;
import com.trade.foresight.pipeline.model.documents.TrainingJobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Workflow-side wait on the status table: done when every row is terminal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingStatusSensor {

    private final TrainingStatusStore store;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * Succeeds with the final rows once all are SUCCESS or FAILED. Fails with
     * code TIMEOUT, naming the rows still open, when {@code timeout} elapses.
     * An empty table counts as not done.
     */
    public Result<List<TrainingJobStatus>> awaitCompletion(Duration timeout, Duration pollInterval) {
        long deadline = clock.millis() + timeout.toMillis();
        List<String> open;
        while (true) {
            List<TrainingJobStatus> rows = store.getStatus();
            open = pending(rows);
            if (!rows.isEmpty() && open.isEmpty()) {
                log.info("All {} training jobs finished", rows.size());
                return Result.ok(rows);
            }
            if (clock.millis() >= deadline) break;
            log.debug("Waiting on {}", open);
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.fail("INTERRUPTED", "Interrupted while waiting on " + open);
            }
        }
        log.warn("Training jobs still open after {}s: {}", timeout.getSeconds(), open);
        return Result.fail("TIMEOUT", "Still pending: " + String.join(", ", open));
    }

    public static boolean anyFailed(List<TrainingJobStatus> rows) {
        return rows.stream().anyMatch(r -> r.getState() == TrainingState.FAILED);
    }

    private static List<String> pending(List<TrainingJobStatus> rows) {
        return rows.stream()
                .filter(r -> r.getState() == null || !r.getState().isTerminal())
                .map(TrainingJobStatus::getId)
                .collect(Collectors.toList());
    }
}
