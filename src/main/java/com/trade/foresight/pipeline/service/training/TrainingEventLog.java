package com.trade.foresight.pipeline.service.training;

import com.trade.foresight.pipeline.common.TransientErrors;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.StoreWriteException;
import com.trade.foresight.pipeline.enums.TrainingEventType;
import com.trade.foresight.pipeline.model.documents.TrainingEvent;
import com.trade.foresight.pipeline.model.documents.TrainingRunSnapshot;
import com.trade.foresight.pipeline.repo.documents.TrainingEventRepo;
import com.trade.foresight.pipeline.repo.documents.TrainingRunSnapshotRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Training progress events plus a folded snapshot per run. The event append
 * is best effort; a quota failure on the snapshot is raised so the caller
 * knows the run state was not recorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingEventLog {

    private final TrainingEventRepo events;
    private final TrainingRunSnapshotRepo runs;
    private final ForesightProperties props;
    private final Clock clock;

    public void logEvent(String dagName, String taskName, String modelName, String runId,
                         TrainingEventType type, String status, String message, Map<String, Object> metadata) {
        Instant now = clock.instant();
        try {
            events.save(TrainingEvent.builder()
                    .dagName(dagName)
                    .taskName(taskName)
                    .modelName(modelName)
                    .runId(runId)
                    .eventType(type)
                    .status(status)
                    .message(message)
                    .metadata(metadata)
                    .createdAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to write to batch_events: {}", e.toString());
            if (TransientErrors.isQuota(e)) {
                log.warn("Store quota exceeded, writes will fail until it resets");
            }
        }

        String id = String.join("_", dagName, taskName, modelName, runId);
        try {
            TrainingRunSnapshot current = runs.findById(id).orElseGet(() -> TrainingRunSnapshot.builder()
                    .id(id)
                    .dagName(dagName)
                    .taskName(taskName)
                    .modelName(modelName)
                    .runId(runId)
                    .build());
            Map<String, Object> merged = current.getMetadata() == null
                    ? new LinkedHashMap<>() : new LinkedHashMap<>(current.getMetadata());
            if (metadata != null) merged.putAll(metadata);

            runs.save(current.toBuilder()
                    .status(status)
                    .retries(current.getRetries() + (type == TrainingEventType.RETRY ? 1 : 0))
                    .lastMessage(message)
                    .metadata(merged.isEmpty() ? null : merged)
                    .updatedAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to update run snapshot {}: {}", id, e.toString());
            if (TransientErrors.isQuota(e)) {
                throw new StoreWriteException("Run snapshot " + id + " not written", e, true);
            }
        }
    }

    /** Newest first; {@code runId} may be null for all runs of the DAG. */
    public List<TrainingEvent> events(String dagName, String runId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return runId == null
                ? events.findByDagNameOrderByCreatedAtDesc(dagName, page)
                : events.findByDagNameAndRunIdOrderByCreatedAtDesc(dagName, runId, page);
    }

    public List<TrainingRunSnapshot> runs(String dagName, String runId) {
        return runId == null
                ? runs.findByDagNameOrderByUpdatedAtDesc(dagName)
                : runs.findByDagNameAndRunIdOrderByUpdatedAtDesc(dagName, runId);
    }

    /** Deletes events past the retention window, one page of batch-limit size at a time. */
    public int cleanupOldEvents() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(props.getTraining().getEventRetentionDays()));
        PageRequest page = PageRequest.of(0, props.getStore().getBatchLimit());
        int deleted = 0;
        List<TrainingEvent> batch;
        while (!(batch = events.findByCreatedAtBefore(cutoff, page)).isEmpty()) {
            events.deleteAll(batch);
            deleted += batch.size();
        }
        log.info("Deleted {} events older than {}", deleted, cutoff);
        return deleted;
    }
}
