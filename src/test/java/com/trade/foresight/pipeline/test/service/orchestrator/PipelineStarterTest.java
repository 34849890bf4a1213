package com.trade.foresight.pipeline.test.service.orchestrator;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.JobDescriptorException;
import com.trade.foresight.pipeline.config.CustomConfig;
import com.trade.foresight.pipeline.core.InMemoryFastStateStore;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.enums.JobKind;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;
import com.trade.foresight.pipeline.model.JobDescriptor;
import com.trade.foresight.pipeline.service.control.StateStoreControlPlane;
import com.trade.foresight.pipeline.service.jobs.JobSubmitter;
import com.trade.foresight.pipeline.service.jobs.ProcessLauncher;
import com.trade.foresight.pipeline.service.orchestrator.PipelineStarter;
import com.trade.foresight.pipeline.test.ClockSleeper;
import com.trade.foresight.pipeline.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PipelineStarterTest {

    private static final ControlEntity V1 = ControlEntity.of("BTCUSDT", "lightgbm", "v1");
    private static final ControlEntity V2 = ControlEntity.of("BTCUSDT", "lightgbm", "v2");

    private ManualClock clock;
    private ClockSleeper sleeper;
    private StateStoreControlPlane control;
    private JobSubmitter submitter;
    private ProcessLauncher launcher;
    private PipelineStarter starter;
    private final List<ControlPhase> phaseAtSubmit = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-03-01T00:00:00Z"));
        sleeper = new ClockSleeper(clock);
        control = new StateStoreControlPlane(new InMemoryFastStateStore(""), CustomConfig.pipelineMapper(),
                clock, sleeper, Duration.ofSeconds(1));
        submitter = mock(JobSubmitter.class);
        launcher = mock(ProcessLauncher.class);
        ForesightProperties props = new ForesightProperties();
        props.setSymbols(Collections.singletonList("BTCUSDT"));
        props.setModels(Collections.singletonList("lightgbm"));
        props.setVersions(Arrays.asList("v1", "v2"));
        starter = new PipelineStarter(control, submitter, launcher, props);

        // a running dispatcher answers the check once its record was cleared
        sleeper.onSleep(() -> {
            if (!control.current(ControlEntity.dispatcher()).isPresent()) {
                control.write(ControlEntity.dispatcher(), ControlPhase.RUNNING);
            }
        });
    }

    private ControlPhase phase(ControlEntity e) {
        return control.current(e).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
    }

    private void producerAnswers(ControlPhase phase) {
        when(submitter.submitProducer("BTCUSDT")).thenAnswer(inv -> {
            control.write(ControlEntity.producer(), phase);
            return null;
        });
    }

    private void consumersAnswer(ControlPhase phase) {
        when(submitter.submitConsumer(any())).thenAnswer(inv -> {
            ControlEntity e = inv.getArgument(0);
            phaseAtSubmit.add(phase(e));
            control.write(e, phase);
            return null;
        });
    }

    @Test
    void startsProducerThenConsumers() throws Exception {
        control.write(V1, ControlPhase.ERROR, "previous run");
        producerAnswers(ControlPhase.RUNNING);
        consumersAnswer(ControlPhase.RUNNING);

        assertThat(starter.run()).isEqualTo(PipelineStarter.EXIT_OK);

        verify(launcher, never()).launch(any());
        verify(submitter).submitConsumer(V1);
        verify(submitter).submitConsumer(V2);
        assertThat(phaseAtSubmit).containsOnly(ControlPhase.START);
        assertThat(phase(V1)).isEqualTo(ControlPhase.RUNNING);
        assertThat(phase(V2)).isEqualTo(ControlPhase.RUNNING);
    }

    @Test
    void producerErrorAborts() {
        producerAnswers(ControlPhase.ERROR);

        assertThat(starter.run()).isEqualTo(PipelineStarter.EXIT_ABORTED);

        verify(submitter, never()).submitConsumer(any());
    }

    @Test
    void producerTimeoutAborts() {
        long before = clock.millis();

        assertThat(starter.run()).isEqualTo(PipelineStarter.EXIT_ABORTED);

        verify(submitter).submitProducer("BTCUSDT");
        verify(submitter, never()).submitConsumer(any());
        assertThat(clock.millis() - before).isGreaterThanOrEqualTo(Duration.ofSeconds(300).toMillis());
    }

    @Test
    void consumerFailuresAreOnlyReported() {
        producerAnswers(ControlPhase.RUNNING);
        when(submitter.submitConsumer(V1)).thenAnswer(inv -> {
            control.write(V1, ControlPhase.ERROR, "Model not available");
            return null;
        });
        when(submitter.submitConsumer(V2)).thenThrow(new JobDescriptorException("disk full"));

        assertThat(starter.run()).isEqualTo(PipelineStarter.EXIT_OK);

        assertThat(phase(V1)).isEqualTo(ControlPhase.ERROR);
    }

    @Test
    void launchesDispatcherWhenNoneAnswers() throws Exception {
        sleeper.onSleep(null);
        when(launcher.launch(any())).thenAnswer(inv -> {
            control.write(ControlEntity.dispatcher(), ControlPhase.RUNNING);
            return null;
        });
        producerAnswers(ControlPhase.RUNNING);
        consumersAnswer(ControlPhase.RUNNING);

        assertThat(starter.run()).isEqualTo(PipelineStarter.EXIT_OK);

        ArgumentCaptor<JobDescriptor> job = ArgumentCaptor.forClass(JobDescriptor.class);
        verify(launcher, times(1)).launch(job.capture());
        assertThat(job.getValue().getKind()).isEqualTo(JobKind.DISPATCHER);
        assertThat(job.getValue().getEntity().isDispatcher()).isTrue();
    }

    @Test
    void dispatcherLaunchFailureAborts() throws Exception {
        sleeper.onSleep(null);
        when(launcher.launch(any())).thenThrow(new IOException("no java"));

        assertThat(starter.run()).isEqualTo(PipelineStarter.EXIT_ABORTED);

        verify(submitter, never()).submitProducer(any());
    }
}
