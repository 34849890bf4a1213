package com.trade.foresight.pipeline.test.service.store;

import com.trade.foresight.pipeline.common.exception.StoreWriteException;
import com.trade.foresight.pipeline.service.store.ChunkedBatchWriter;
import com.trade.foresight.pipeline.test.ClockSleeper;
import com.trade.foresight.pipeline.test.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChunkedBatchWriterTest {

    private final ManualClock clock = new ManualClock(Instant.parse("2024-03-01T00:00:00Z"));
    private final ClockSleeper sleeper = new ClockSleeper(clock);
    private final ChunkedBatchWriter writer = new ChunkedBatchWriter(500, Duration.ofSeconds(60), sleeper);

    private static List<Integer> items(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Test
    void splitsIntoChunksOfAtMostFiveHundred() {
        List<Integer> sizes = new ArrayList<>();

        int chunks = writer.write("test", items(1234), c -> sizes.add(c.size()));

        assertThat(chunks).isEqualTo(3);
        assertThat(sizes).containsExactly(500, 500, 234);
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void emptyInputWritesNothing() {
        assertThat(writer.write("test", new ArrayList<Integer>(), c -> {
            throw new AssertionError("not called");
        })).isZero();
    }

    @Test
    void quotaFailureIsRetriedOnceAfterBackoff() {
        AtomicInteger calls = new AtomicInteger();

        writer.write("test", items(10), c -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("429 Quota exceeded");
        });

        assertThat(calls.get()).isEqualTo(2);
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(60));
    }

    @Test
    void secondQuotaFailureIsRaised() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> writer.write("test", items(10), c -> {
            calls.incrementAndGet();
            throw new IllegalStateException("Resource exhausted");
        })).isInstanceOfSatisfying(StoreWriteException.class, e -> assertThat(e.isQuota()).isTrue());

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void otherFailuresAreNotRetriedAndEarlierChunksStay() {
        List<Integer> written = new ArrayList<>();

        assertThatThrownBy(() -> writer.write("test", items(1200), c -> {
            if (!written.isEmpty() && written.size() >= 1000) throw new IllegalStateException("disk full");
            written.addAll(c);
        })).isInstanceOfSatisfying(StoreWriteException.class, e -> {
            assertThat(e.isQuota()).isFalse();
            assertThat(e.getMessage()).contains("offset 1000");
        });

        assertThat(written).hasSize(1000);
        assertThat(sleeper.getSleeps()).isEmpty();
    }
}
