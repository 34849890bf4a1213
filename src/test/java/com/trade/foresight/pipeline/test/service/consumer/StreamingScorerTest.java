package com.trade.foresight.pipeline.test.service.consumer;

import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.consumer.FeatureWindows;
import com.trade.foresight.pipeline.service.consumer.StreamingScorer;
import com.trade.foresight.pipeline.service.consumer.StreamingScorer.ScoringRequest;
import com.trade.foresight.pipeline.test.Candles;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class StreamingScorerTest {

    @Test
    void featureVectorScalesEachColumnAndPadsFront() {
        List<PriceCandle> rows = Candles.minutes(Candles.T0, 2);

        double[] v = FeatureWindows.vector(rows, 3);

        assertThat(v).hasSize(15);
        assertThat(Arrays.copyOfRange(v, 0, 5)).containsOnly(0.0);
        // open, high, low, close go 0 -> 1; volume is constant and stays raw
        assertThat(Arrays.copyOfRange(v, 5, 10)).containsExactly(0.0, 0.0, 0.0, 0.0, 10.0);
        assertThat(Arrays.copyOfRange(v, 10, 15)).containsExactly(1.0, 1.0, 1.0, 1.0, 10.0);
    }

    @Test
    void featureVectorUsesNewestRowsOfLongWindow() {
        List<PriceCandle> rows = Candles.minutes(Candles.T0, 5);

        double[] v = FeatureWindows.vector(rows, 3);

        assertThat(v).hasSize(15);
        assertThat(v[3]).isEqualTo(0.0);
        assertThat(v[8]).isCloseTo(0.5, within(1e-9));
        assertThat(v[13]).isEqualTo(1.0);
    }

    @Test
    void noRequestUntilWindowIsFull() {
        StreamingScorer scorer = new StreamingScorer(3);

        assertThat(scorer.offer(Candles.minutes(Candles.T0, 2))).isEmpty();
        Optional<ScoringRequest> req = scorer.offer(
                Collections.singletonList(Candles.at(Candles.T0.plus(Duration.ofMinutes(2)), 102)));

        assertThat(req).isPresent();
        assertThat(req.get().getTarget().getClose()).isEqualTo(102.0);
        assertThat(req.get().getFeatures()).hasSize(15);
        assertThat(scorer.size()).isEqualTo(3);
    }

    @Test
    void unorderedBatchIsSortedAndNewestScored() {
        StreamingScorer scorer = new StreamingScorer(3);
        List<PriceCandle> batch = new ArrayList<>(Candles.minutes(Candles.T0, 4));
        Collections.reverse(batch);

        ScoringRequest req = scorer.offer(batch).orElseThrow();

        assertThat(req.getTarget().getOpenTime()).isEqualTo(Candles.T0.plus(Duration.ofMinutes(3)));
    }

    @Test
    void redeliveredBatchYieldsNothing() {
        StreamingScorer scorer = new StreamingScorer(3);
        List<PriceCandle> batch = Candles.minutes(Candles.T0, 3);

        assertThat(scorer.offer(batch)).isPresent();
        assertThat(scorer.offer(batch)).isEmpty();
        assertThat(scorer.size()).isEqualTo(3);
    }

    @Test
    void rowsAtOrBeforeCursorAreDropped() {
        StreamingScorer scorer = new StreamingScorer(2);
        scorer.commit(Candles.T0.plus(Duration.ofMinutes(5)));

        assertThat(scorer.offer(Candles.minutes(Candles.T0, 6))).isEmpty();
        assertThat(scorer.size()).isZero();

        scorer.commit(Candles.T0);
        assertThat(scorer.getCursor()).contains(Candles.T0.plus(Duration.ofMinutes(5)));
    }
}
