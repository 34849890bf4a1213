package com.trade.foresight.pipeline.test.service.training;

import com.trade.foresight.pipeline.common.Result;
import com.trade.foresight.pipeline.enums.TrainingState;
import com.trade.foresight.pipeline.model.documents.TrainingJobStatus;
import com.trade.foresight.pipeline.service.training.TrainingStatusSensor;
import com.trade.foresight.pipeline.service.training.TrainingStatusStore;
import com.trade.foresight.pipeline.test.ClockSleeper;
import com.trade.foresight.pipeline.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TrainingStatusSensorTest {

    private static final Duration POLL = Duration.ofSeconds(30);

    private TrainingStatusStore store;
    private ManualClock clock;
    private ClockSleeper sleeper;

    @BeforeEach
    void setUp() {
        store = mock(TrainingStatusStore.class);
        clock = new ManualClock(Instant.parse("2024-03-01T00:00:00Z"));
        sleeper = new ClockSleeper(clock);
    }

    private static TrainingJobStatus row(String id, TrainingState state) {
        return TrainingJobStatus.builder().id(id).state(state).build();
    }

    @Test
    void completesOnceEveryRowIsTerminal() {
        List<TrainingJobStatus> running = Arrays.asList(
                row("lightgbm_BTCUSDT", TrainingState.SUCCESS), row("tst_BTCUSDT", TrainingState.RUNNING));
        List<TrainingJobStatus> done = Arrays.asList(
                row("lightgbm_BTCUSDT", TrainingState.SUCCESS), row("tst_BTCUSDT", TrainingState.FAILED));
        when(store.getStatus()).thenReturn(running, done);

        Result<List<TrainingJobStatus>> r = new TrainingStatusSensor(store, clock, sleeper)
                .awaitCompletion(Duration.ofMinutes(10), POLL);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).hasSize(2);
        assertThat(sleeper.getSleeps()).containsExactly(POLL);
        assertThat(TrainingStatusSensor.anyFailed(r.get())).isTrue();
    }

    @Test
    void timesOutNamingOpenRows() {
        when(store.getStatus()).thenReturn(Arrays.asList(
                row("lightgbm_BTCUSDT", TrainingState.SUCCESS),
                row("tst_BTCUSDT", TrainingState.PENDING),
                row("trl_ALL", null)));

        Result<List<TrainingJobStatus>> r = new TrainingStatusSensor(store, clock, sleeper)
                .awaitCompletion(Duration.ofSeconds(60), POLL);

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("TIMEOUT");
        assertThat(r.getError()).isEqualTo("Still pending: tst_BTCUSDT, trl_ALL");
        assertThat(sleeper.getSleeps()).hasSize(2);
    }

    @Test
    void emptyTableIsNotDone() {
        when(store.getStatus()).thenReturn(Collections.emptyList());

        Result<List<TrainingJobStatus>> r = new TrainingStatusSensor(store, clock, sleeper)
                .awaitCompletion(Duration.ofSeconds(30), POLL);

        assertThat(r.getErrorCode()).isEqualTo("TIMEOUT");
    }

    @Test
    void interruptedWaitIsReported() {
        when(store.getStatus()).thenReturn(Collections.singletonList(row("tst_BTCUSDT", TrainingState.RUNNING)));

        Result<List<TrainingJobStatus>> r = new TrainingStatusSensor(store, clock, d -> {
            throw new InterruptedException();
        }).awaitCompletion(Duration.ofMinutes(5), POLL);

        assertThat(Thread.interrupted()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("INTERRUPTED");
    }

    @Test
    void allSuccessfulRowsAreNotFailed() {
        assertThat(TrainingStatusSensor.anyFailed(Arrays.asList(
                row("a", TrainingState.SUCCESS), row("b", TrainingState.SUCCESS)))).isFalse();
    }
}
