package com.trade.foresight.pipeline.service.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.ControlPlaneException;
import com.trade.foresight.pipeline.core.FastStateStore;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * ControlPlane over the shared FastStateStore; one JSON record per entity
 * under {@code control:<entity key>}.
 */
@Slf4j
@Service
public class StateStoreControlPlane implements ControlPlane {

    static final String KEY_PREFIX = "control:";

    private final FastStateStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;

    @Autowired
    public StateStoreControlPlane(FastStateStore store, ObjectMapper mapper, Clock clock,
                                  Sleeper sleeper, ForesightProperties props) {
        this(store, mapper, clock, sleeper, props.getControl().getPollInterval());
    }

    public StateStoreControlPlane(FastStateStore store, ObjectMapper mapper, Clock clock,
                                  Sleeper sleeper, Duration pollInterval) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.sleeper = sleeper;
        this.pollInterval = pollInterval;
    }

    private static String key(ControlEntity e) {
        return KEY_PREFIX + e.key();
    }

    @Override
    public ControlState write(ControlEntity entity, ControlPhase phase, String errorMessage) {
        if (phase == null || phase == ControlPhase.UNKNOWN) {
            throw new IllegalArgumentException("Cannot store phase " + phase);
        }
        ControlState state = ControlState.builder()
                .crypto(entity.getSymbol())
                .model(entity.getModel())
                .version(entity.getVersion())
                .state(phase)
                .errorMessage(errorMessage)
                .updatedAt(Instant.now(clock))
                .build();
        try {
            store.put(key(entity), mapper.writeValueAsString(state), null);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneException("Cannot encode state for " + entity, e);
        } catch (RuntimeException e) {
            throw new ControlPlaneException("Cannot write state for " + entity + ": " + e.getMessage(), e);
        }
        log.info("control {} -> {}{}", entity, phase.getCode(), errorMessage == null ? "" : " (" + errorMessage + ")");
        return state;
    }

    @Override
    public Optional<ControlState> current(ControlEntity entity) {
        Optional<String> raw = store.get(key(entity));
        if (!raw.isPresent()) return Optional.empty();
        return Optional.ofNullable(decode(raw.get(), entity.key()));
    }

    @Override
    public ControlPhase read(ControlEntity entity, Duration timeout) {
        long deadline = clock.millis() + millis(timeout);
        for (; ; ) {
            Optional<ControlState> cur = current(entity);
            if (cur.isPresent() && cur.get().getState() != null) {
                return cur.get().getState();
            }
            if (clock.millis() >= deadline || !pause(pollInterval)) {
                return ControlPhase.UNKNOWN;
            }
        }
    }

    @Override
    public Result<ControlPhase> waitFor(ControlEntity entity, Predicate<ControlPhase> until,
                                        Duration timeout, Duration interval) {
        long deadline = clock.millis() + millis(timeout);
        ControlPhase last = ControlPhase.UNKNOWN;
        for (; ; ) {
            last = current(entity).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
            if (until.test(last)) {
                return Result.ok(last);
            }
            if (clock.millis() >= deadline) break;
            if (!pause(interval)) {
                return Result.fail("INTERRUPTED", "Interrupted while waiting for " + entity);
            }
        }
        return Result.fail("TIMEOUT", "Timed out after " + timeout.getSeconds() + "s waiting for "
                + entity + ", last state " + last.getCode());
    }

    @Override
    public List<ControlState> snapshot() {
        List<ControlState> out = new ArrayList<>();
        for (String k : store.keys(KEY_PREFIX)) {
            store.get(k).map(raw -> decode(raw, k)).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public void delete(ControlEntity entity) {
        store.delete(key(entity));
    }

    @Override
    public void deleteAll() {
        int n = 0;
        for (String k : store.keys(KEY_PREFIX)) {
            store.delete(k);
            n++;
        }
        log.info("control plane cleared ({} records)", n);
    }

    private ControlState decode(String raw, String key) {
        try {
            return mapper.readValue(raw, ControlState.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable control record {}: {}", key, e.getOriginalMessage());
            return null;
        }
    }

    private boolean pause(Duration d) {
        try {
            sleeper.sleep(d);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long millis(Duration d) {
        return d == null ? 0L : d.toMillis();
    }
}
