package com.trade.foresight.pipeline.service.control;

import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Lifecycle state shared between the orchestrator and the worker processes.
 * Last write wins; there is no locking.
 */
public interface ControlPlane {

    /**
     * Upserts the record for {@code entity}. A null error clears the previous one.
     */
    ControlState write(ControlEntity entity, ControlPhase phase, String errorMessage);

    default ControlState write(ControlEntity entity, ControlPhase phase) {
        return write(entity, phase, null);
    }

    /** Single read without waiting. */
    Optional<ControlState> current(ControlEntity entity);

    /**
     * Polls until a record for {@code entity} exists, returning its phase,
     * or {@link ControlPhase#UNKNOWN} once {@code timeout} elapses.
     */
    ControlPhase read(ControlEntity entity, Duration timeout);

    /**
     * Rendezvous: polls until the entity's phase satisfies {@code until}.
     * Succeeds with the matching phase; fails with code TIMEOUT otherwise.
     * An absent record is presented to the predicate as UNKNOWN.
     */
    Result<ControlPhase> waitFor(ControlEntity entity, Predicate<ControlPhase> until,
                                 Duration timeout, Duration pollInterval);

    List<ControlState> snapshot();

    void delete(ControlEntity entity);

    void deleteAll();
}
