package com.trade.foresight.pipeline.service.orchestrator;

import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;
import com.trade.foresight.pipeline.service.control.ControlPlane;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Graceful shutdown of every consumer and the producer. Sends DELETE, waits
 * for each entity to go away within its own timeout and a global one, then
 * clears the control plane. Always exits 0.
 *
 * <p>A SIGTERM or SIGINT stops further waits; the control plane is still
 * cleared before the JVM goes down.</p>
 */
@Slf4j
@Service
public class KillAllRunner {

    private final ControlPlane control;
    private final ForesightProperties props;
    private final Clock clock;

    private volatile boolean proceed = true;
    private long deadline;

    public KillAllRunner(ControlPlane control, ForesightProperties props, Clock clock) {
        this.control = control;
        this.props = props;
        this.clock = clock;
    }

    public int run() {
        proceed = true;
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = signalHook(Thread.currentThread(), done);
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            shutdownAll();
        } catch (RuntimeException e) {
            log.error("Unexpected error during shutdown", e);
        } finally {
            clearStates();
            done.countDown();
            removeHook(hook);
        }
        log.info("Shutdown process completed");
        return 0;
    }

    void shutdownAll() {
        ForesightProperties.Control cfg = props.getControl();
        deadline = clock.millis() + cfg.getGlobalShutdownTimeout().toMillis();
        log.info("Starting graceful shutdown of all processes");

        List<ControlEntity> consumers = consumers();
        log.info("Sending delete command to {} consumer(s)...", consumers.size());
        for (ControlEntity c : consumers) {
            if (!shouldContinue()) break;
            sendDelete(c);
        }
        if (shouldContinue()) {
            log.info("Sending delete command to producer...");
            sendDelete(ControlEntity.producer());
        }

        if (shouldContinue()) {
            log.info("Waiting for all consumers to shut down...");
            for (ControlEntity c : consumers) {
                if (!shouldContinue()) break;
                waitForShutdown(c);
            }
        }
        if (shouldContinue()) {
            log.info("Waiting for producer to shut down...");
            waitForShutdown(ControlEntity.producer());
        }
    }

    /** Configured consumers plus any other worker found in the control plane. */
    List<ControlEntity> consumers() {
        Set<ControlEntity> out = new LinkedHashSet<>();
        for (String s : props.getSymbols()) {
            for (String m : props.getModels()) {
                for (String v : props.getVersions()) {
                    out.add(ControlEntity.of(s, m, v));
                }
            }
        }
        try {
            for (ControlState st : control.snapshot()) {
                ControlEntity e = st.entity();
                if (e.isConsumer()) out.add(e);
            }
        } catch (RuntimeException e) {
            log.warn("Could not list control states: {}", e.getMessage());
        }
        return new ArrayList<>(out);
    }

    private void sendDelete(ControlEntity entity) {
        try {
            ControlPhase phase = control.read(entity, props.getControl().getReadTimeout());
            if (!phase.isGone()) {
                control.write(entity, ControlPhase.DELETE);
                log.info("Sent delete command to {}", entity);
            }
        } catch (RuntimeException e) {
            log.error("Error sending delete command to {}: {}", entity, e.getMessage());
        }
    }

    private boolean waitForShutdown(ControlEntity entity) {
        ForesightProperties.Control cfg = props.getControl();
        long remaining = Math.max(0, deadline - clock.millis());
        Duration timeout = Duration.ofMillis(Math.min(cfg.getEntityShutdownTimeout().toMillis(), remaining));
        log.info("Waiting for {} to shut down...", entity);
        try {
            Result<ControlPhase> r = control.waitFor(entity, ControlPhase::isGone, timeout, cfg.getWaitPollInterval());
            if (r.isOk()) {
                log.info("{} has shut down ({})", entity, r.get().getCode());
                return true;
            }
            if ("INTERRUPTED".equals(r.getErrorCode())) {
                proceed = false;
                log.warn("Interrupted while waiting for {} to shut down", entity);
            } else {
                log.warn("Timeout waiting for {} to shut down", entity);
            }
        } catch (RuntimeException e) {
            log.error("Error checking state for {}: {}", entity, e.getMessage());
        }
        return false;
    }

    private boolean shouldContinue() {
        if (!proceed) return false;
        if (clock.millis() >= deadline) {
            log.warn("Total timeout reached, stopping shutdown process");
            proceed = false;
        }
        return proceed;
    }

    private void clearStates() {
        // the interrupt from a signal must not abort the cleanup I/O
        Thread.interrupted();
        try {
            log.info("Cleaning up state records...");
            control.deleteAll();
        } catch (RuntimeException e) {
            log.error("Error cleaning up state records: {}", e.getMessage());
        }
    }

    private Thread signalHook(Thread main, CountDownLatch done) {
        return new Thread(() -> {
            log.warn("Received termination signal, will finish current operation and exit");
            proceed = false;
            main.interrupt();
            try {
                done.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "kill-all-signal");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down");
        }
    }
}
