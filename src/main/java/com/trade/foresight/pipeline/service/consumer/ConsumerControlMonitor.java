package com.trade.foresight.pipeline.service.consumer;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.service.control.ControlPlane;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Watches a running consumer's control record beside the poll loop.
 * DELETE: acknowledge with DELETED and end the process. PAUSE: acknowledge
 * with PAUSED. START (a resume): acknowledge with RUNNING.
 */
@Slf4j
@Component
public class ConsumerControlMonitor {

    private final ControlPlane control;
    private final ForesightProperties props;
    private final ProcessTerminator terminator;

    private ScheduledExecutorService exec;
    private volatile ControlEntity entity;
    private volatile boolean terminated;

    @Autowired
    public ConsumerControlMonitor(ControlPlane control, ForesightProperties props) {
        this(control, props, ProcessTerminator.SYSTEM_EXIT);
    }

    public ConsumerControlMonitor(ControlPlane control, ForesightProperties props, ProcessTerminator terminator) {
        this.control = control;
        this.props = props;
        this.terminator = terminator;
    }

    public synchronized void start(ControlEntity target) {
        if (exec != null) return;
        this.entity = target;
        final String mdc = target.key();
        exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "control-monitor-" + mdc);
            t.setDaemon(true);
            return t;
        });
        long every = props.getConsumer().getMonitorInterval().toMillis();
        exec.scheduleWithFixedDelay(() -> {
            MDC.put("entity", mdc);
            checkOnce();
        }, every, every, TimeUnit.MILLISECONDS);
        log.info("Control monitor started for {}", target);
    }

    @PreDestroy
    public synchronized void stop() {
        if (exec != null) {
            exec.shutdownNow();
            exec = null;
        }
    }

    public boolean isTerminated() {
        return terminated;
    }

    /** One poll of the control record; exceptions are logged, never thrown. */
    public void checkOnce() {
        final ControlEntity e = entity;
        if (e == null || terminated) return;
        try {
            ControlPhase phase = control.read(e, props.getControl().getReadTimeout());
            switch (phase) {
                case DELETE:
                    log.info("Received delete command for {}, terminating", e);
                    control.write(e, ControlPhase.DELETED);
                    terminated = true;
                    terminator.terminate(0);
                    break;
                case PAUSE:
                    log.info("Pausing {}", e);
                    control.write(e, ControlPhase.PAUSED);
                    break;
                case START:
                    log.info("Resuming {}", e);
                    control.write(e, ControlPhase.RUNNING);
                    break;
                default:
                    break;
            }
        } catch (RuntimeException ex) {
            log.warn("Control check failed for {}: {}", e, ex.toString());
        }
    }
}
