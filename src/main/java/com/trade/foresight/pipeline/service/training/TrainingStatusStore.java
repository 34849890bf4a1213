package com.trade.foresight.pipeline.service.training;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.enums.TrainingState;
import com.trade.foresight.pipeline.model.documents.TrainingJobStatus;
import com.trade.foresight.pipeline.repo.documents.TrainingJobStatusRepo;
import com.trade.foresight.pipeline.service.store.ChunkedBatchWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-cycle status table shared with the external training workflow.
 * A cycle starts with {@link #flush()} and {@link #initEntries()}; training
 * tasks report through {@link #setState}; the workflow polls until every row
 * is SUCCESS or FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingStatusStore {

    private final TrainingJobStatusRepo repo;
    private final ChunkedBatchWriter writer;
    private final ForesightProperties props;
    private final Clock clock;

    /** Removes every row, in chunks. */
    public int flush() {
        List<TrainingJobStatus> all = repo.findAll();
        writer.write("batch_status flush", all, repo::deleteAll);
        log.info("Flushed {} status entries", all.size());
        return all.size();
    }

    /** One PENDING row per (model, coin) plus the aggregate row. */
    public List<TrainingJobStatus> initEntries() {
        ForesightProperties.Training t = props.getTraining();
        Instant now = clock.instant();
        List<TrainingJobStatus> rows = new ArrayList<>();
        for (String model : t.getModels()) {
            for (String coin : t.getCoins()) {
                rows.add(pending(model, coin, now));
            }
        }
        rows.add(pending(t.getAggregateModel(), t.getAggregateCoin(), now));
        writer.write("batch_status init", rows, repo::saveAll);
        log.info("Initialized {} status entries", rows.size());
        return rows;
    }

    /** Merge-upsert of one row; a null error clears the previous one. */
    public TrainingJobStatus setState(String model, String coin, TrainingState state, String errorMessage) {
        String id = TrainingJobStatus.idOf(model, coin);
        TrainingJobStatus row = repo.findById(id).orElseGet(() -> TrainingJobStatus.builder()
                .id(id)
                .model(model)
                .coin(coin)
                .build());
        row.setState(state);
        row.setErrorMessage(errorMessage);
        row.setUpdatedAt(clock.instant());
        TrainingJobStatus saved = repo.save(row);
        log.info("Updated {} to {}", id, state);
        return saved;
    }

    public List<TrainingJobStatus> getStatus() {
        return repo.findAll(Sort.by(Sort.Direction.ASC, "id"));
    }

    private static TrainingJobStatus pending(String model, String coin, Instant now) {
        return TrainingJobStatus.builder()
                .id(TrainingJobStatus.idOf(model, coin))
                .model(model)
                .coin(coin)
                .state(TrainingState.PENDING)
                .updatedAt(now)
                .build();
    }
}
