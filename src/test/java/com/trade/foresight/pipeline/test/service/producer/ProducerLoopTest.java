package com.trade.foresight.pipeline.test.service.producer;

import com.trade.foresight.pipeline.bus.CandlePublisher;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.BusPublishException;
import com.trade.foresight.pipeline.common.exception.StoreWriteException;
import com.trade.foresight.pipeline.config.CustomConfig;
import com.trade.foresight.pipeline.core.InMemoryFastStateStore;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.jobs.CandleIndexBootstrap;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.ControlState;
import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.control.StateStoreControlPlane;
import com.trade.foresight.pipeline.service.market.LedgerSync;
import com.trade.foresight.pipeline.service.market.LocalPriceLedger;
import com.trade.foresight.pipeline.service.market.MarketDataSource;
import com.trade.foresight.pipeline.service.producer.ProducerLoop;
import com.trade.foresight.pipeline.service.store.CandleStoreService;
import com.trade.foresight.pipeline.test.Candles;
import com.trade.foresight.pipeline.test.ClockSleeper;
import com.trade.foresight.pipeline.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ProducerLoopTest {

    private static final ControlEntity PRODUCER = ControlEntity.producer();

    @TempDir
    Path dir;

    private ManualClock clock;
    private ClockSleeper sleeper;
    private StateStoreControlPlane control;
    private MarketDataSource market;
    private CandleStoreService store;
    private LocalPriceLedger ledger;
    private CandlePublisher publisher;
    private ProducerLoop producer;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-03-02T00:00:30Z"));
        sleeper = new ClockSleeper(clock);
        control = new StateStoreControlPlane(new InMemoryFastStateStore(""), CustomConfig.pipelineMapper(),
                clock, sleeper, Duration.ofSeconds(1));
        market = mock(MarketDataSource.class);
        store = mock(CandleStoreService.class);
        ledger = new LocalPriceLedger(dir);
        publisher = mock(CandlePublisher.class);
        producer = new ProducerLoop(control, market, store, ledger, publisher, mock(LedgerSync.class),
                mock(CandleIndexBootstrap.class), new ForesightProperties(), clock, sleeper);
    }

    private ControlPhase phase() {
        return control.current(PRODUCER).map(ControlState::getState).orElse(ControlPhase.UNKNOWN);
    }

    @Test
    void cyclePersistsBeforePublishingAndAdvancesCursor() throws Exception {
        List<PriceCandle> fetched = new ArrayList<>(Candles.minutes(Candles.T0, 3));
        fetched.add(0, fetched.remove(2));
        when(market.fetchSince(eq("BTCUSDT"), any())).thenReturn(fetched);

        Optional<Instant> cursor = producer.cycle("BTCUSDT", Optional.empty());

        assertThat(cursor).contains(Candles.T0.plus(Duration.ofMinutes(2)));
        InOrder order = inOrder(store, publisher);
        order.verify(store).bulkInsert(eq("BTCUSDT"), anyList());
        order.verify(publisher).publish(eq("BTCUSDT"), anyList());
        assertThat(ledger.readAll("BTCUSDT")).extracting(PriceCandle::getOpenTime)
                .containsExactly(Candles.T0, Candles.T0.plus(Duration.ofMinutes(1)),
                        Candles.T0.plus(Duration.ofMinutes(2)));
        verify(market).fetchSince("BTCUSDT", Instant.parse("2024-03-01T00:00:30Z"));
    }

    @Test
    void cycleStartsAfterCursorAndDropsOldRows() {
        Instant last = Candles.T0.plus(Duration.ofMinutes(1));
        when(market.fetchSince("BTCUSDT", Candles.T0.plus(Duration.ofMinutes(2))))
                .thenReturn(Candles.minutes(Candles.T0, 2));

        assertThat(producer.cycle("BTCUSDT", Optional.of(last))).isEmpty();
        verify(store, never()).bulkInsert(anyString(), anyList());
        verify(publisher, never()).publish(anyString(), anyList());
    }

    @Test
    void storeFailureIsFatal() {
        when(market.fetchSince(eq("BTCUSDT"), any())).thenReturn(Candles.minutes(Candles.T0, 2));
        when(store.bulkInsert(eq("BTCUSDT"), anyList())).thenThrow(new StoreWriteException("quota", null, true));

        assertThat(producer.run("BTCUSDT")).isEqualTo(ProducerLoop.EXIT_FATAL);

        assertThat(phase()).isEqualTo(ControlPhase.ERROR);
        verify(publisher, never()).publish(anyString(), anyList());
    }

    @Test
    void publishFailureRetriesSameCandles() {
        List<PriceCandle> candles = Candles.minutes(Candles.T0, 2);
        when(market.fetchSince(eq("BTCUSDT"), any())).thenReturn(candles);
        when(publisher.publish(eq("BTCUSDT"), anyList()))
                .thenThrow(new BusPublishException("broker not available", null))
                .thenReturn(1);
        sleeper.onSleep(() -> {
            if (sleeper.getSleeps().size() == 2) control.write(PRODUCER, ControlPhase.DELETE);
        });

        assertThat(producer.run("BTCUSDT")).isEqualTo(ProducerLoop.EXIT_OK);

        verify(publisher, times(2)).publish("BTCUSDT", candles);
        assertThat(sleeper.getSleeps().get(0)).isEqualTo(Duration.ofSeconds(10));
        assertThat(phase()).isEqualTo(ControlPhase.DELETED);
    }

    @Test
    void deleteStopsLoop() {
        when(market.fetchSince(eq("BTCUSDT"), any())).thenReturn(new ArrayList<>());
        sleeper.onSleep(() -> control.write(PRODUCER, ControlPhase.DELETE));

        assertThat(producer.run("BTCUSDT")).isEqualTo(ProducerLoop.EXIT_OK);

        assertThat(phase()).isEqualTo(ControlPhase.DELETED);
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(60));
    }

    @Test
    void pauseSkipsFetching() {
        // run() announces RUNNING first; re-pause right after that write
        StateStoreControlPlane pausing = new StateStoreControlPlane(new InMemoryFastStateStore(""),
                CustomConfig.pipelineMapper(), clock, sleeper, Duration.ofSeconds(1)) {
            @Override
            public ControlState write(ControlEntity entity, ControlPhase phase, String errorMessage) {
                ControlState s = super.write(entity, phase, errorMessage);
                if (phase == ControlPhase.RUNNING) super.write(entity, ControlPhase.PAUSE, null);
                return s;
            }
        };
        ProducerLoop paused = new ProducerLoop(pausing, market, store, ledger, publisher, mock(LedgerSync.class),
                mock(CandleIndexBootstrap.class), new ForesightProperties(), clock, sleeper);
        sleeper.onSleep(() -> pausing.write(PRODUCER, ControlPhase.DELETE));

        assertThat(paused.run("BTCUSDT")).isEqualTo(ProducerLoop.EXIT_OK);

        verify(market, never()).fetchSince(anyString(), any());
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(10));
    }

    @Test
    void cursorComesFromLedgerOnRestart() throws Exception {
        ledger.append("BTCUSDT", Arrays.asList(Candles.at(Candles.T0, 100)));
        when(market.fetchSince(eq("BTCUSDT"), any())).thenReturn(new ArrayList<>());
        sleeper.onSleep(() -> control.write(PRODUCER, ControlPhase.DELETE));

        producer.run("BTCUSDT");

        verify(market).fetchSince("BTCUSDT", Candles.T0.plus(Duration.ofMinutes(1)));
    }
}
