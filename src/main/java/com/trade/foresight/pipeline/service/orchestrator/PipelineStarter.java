package com.trade.foresight.pipeline.service.orchestrator;

import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.JobDescriptorException;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.enums.JobKind;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.JobDescriptor;
import com.trade.foresight.pipeline.service.control.ControlPlane;
import com.trade.foresight.pipeline.service.jobs.JobSubmitter;
import com.trade.foresight.pipeline.service.jobs.ProcessLauncher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Brings the pipeline up: dispatcher, then the producer, then one consumer
 * per (symbol, model, version). A producer that does not reach RUNNING aborts
 * the start; consumer failures are only reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineStarter {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ABORTED = 1;

    private final ControlPlane control;
    private final JobSubmitter submitter;
    private final ProcessLauncher launcher;
    private final ForesightProperties props;

    public int run() {
        log.info("Starting pipeline initialization");
        ForesightProperties.Control cfg = props.getControl();

        log.info("Cleaning up old control states...");
        control.deleteAll();

        if (!ensureDispatcher()) {
            log.error("No job dispatcher available, aborting");
            return EXIT_ABORTED;
        }

        try {
            submitter.submitProducer(props.getSymbols().get(0));
        } catch (JobDescriptorException e) {
            log.error("Could not submit the producer job, aborting", e);
            return EXIT_ABORTED;
        }
        log.info("Waiting for producer to start...");
        Result<ControlPhase> producer = control.waitFor(ControlEntity.producer(),
                p -> p == ControlPhase.RUNNING || p == ControlPhase.ERROR,
                cfg.getProducerStartTimeout(), cfg.getWaitPollInterval());
        if (producer.isFailure() || producer.get() != ControlPhase.RUNNING) {
            log.error("Failed to start producer, aborting: {}",
                    producer.isFailure() ? producer.getError() : "producer reported error");
            return EXIT_ABORTED;
        }
        log.info("Producer is running");

        List<ControlEntity> consumers = consumers();
        List<ControlEntity> submitted = new ArrayList<>();
        for (ControlEntity c : consumers) {
            // START goes first so the dispatcher's reset and the consumer's WAIT keep it
            control.write(c, ControlPhase.START);
            try {
                submitter.submitConsumer(c);
                submitted.add(c);
                log.info("Created consumer job for {}", c);
            } catch (JobDescriptorException e) {
                log.error("Could not submit consumer job for {}", c, e);
            }
        }

        log.info("Waiting for all consumers to start...");
        int started = 0;
        for (ControlEntity c : submitted) {
            Result<ControlPhase> r = control.waitFor(c,
                    p -> p == ControlPhase.RUNNING || p == ControlPhase.ERROR || p == ControlPhase.DELETED,
                    cfg.getConsumerStartTimeout(), cfg.getWaitPollInterval());
            if (r.isOk() && r.get() == ControlPhase.RUNNING) {
                log.info("Consumer {} is running", c);
                started++;
            } else if (r.isOk()) {
                log.error("Consumer {} did not start, state {}", c, r.get().getCode());
            } else {
                log.error("Consumer {} did not start: {}", c, r.getError());
            }
        }

        if (started == consumers.size()) {
            log.info("All {} consumers started successfully", started);
        } else {
            log.warn("{} of {} consumers started", started, consumers.size());
        }
        return EXIT_OK;
    }

    /**
     * A running dispatcher re-announces itself after the control plane is
     * cleared; one is launched only when none answers.
     */
    boolean ensureDispatcher() {
        ControlEntity d = ControlEntity.dispatcher();
        ForesightProperties.Control cfg = props.getControl();
        Result<ControlPhase> answer = control.waitFor(d, ControlPhase.RUNNING::equals,
                cfg.getDispatcherAnswerTimeout(), cfg.getPollInterval());
        if (answer.isOk()) {
            log.info("Job dispatcher already running");
            return true;
        }

        JobDescriptor job = JobDescriptor.builder()
                .kind(JobKind.DISPATCHER)
                .entity(d)
                .jobId(JobKind.DISPATCHER.getCommand())
                .build();
        try {
            launcher.launch(job);
        } catch (IOException | RuntimeException e) {
            log.error("Could not launch the job dispatcher", e);
            return false;
        }
        Result<ControlPhase> started = control.waitFor(d, ControlPhase.RUNNING::equals,
                cfg.getDispatcherStartTimeout(), cfg.getPollInterval());
        if (started.isFailure()) {
            log.error("Job dispatcher did not come up: {}", started.getError());
            return false;
        }
        return true;
    }

    List<ControlEntity> consumers() {
        List<ControlEntity> out = new ArrayList<>();
        for (String s : props.getSymbols()) {
            for (String m : props.getModels()) {
                for (String v : props.getVersions()) {
                    out.add(ControlEntity.of(s, m, v));
                }
            }
        }
        return out;
    }
}
