package com.trade.foresight.pipeline.service.producer;

import com.trade.foresight.pipeline.bus.CandlePublisher;
import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.StoreWriteException;
import com.trade.foresight.pipeline.enums.ControlPhase;
import com.trade.foresight.pipeline.jobs.CandleIndexBootstrap;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.control.ControlPlane;
import com.trade.foresight.pipeline.service.market.LedgerSync;
import com.trade.foresight.pipeline.service.market.LocalPriceLedger;
import com.trade.foresight.pipeline.service.market.MarketDataSource;
import com.trade.foresight.pipeline.service.store.CandleStoreService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The producer process: fetch new candles, persist them, append them to the
 * local ledger and publish them, once a minute, until the control plane says DELETE.
 * <p>
 * A failed store write ends the process with ERROR. A failed publish or fetch
 * only aborts the current cycle; the cursor stays put and the next cycle
 * fetches the same candles again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProducerLoop {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;

    private final ControlPlane control;
    private final MarketDataSource market;
    private final CandleStoreService store;
    private final LocalPriceLedger ledger;
    private final CandlePublisher publisher;
    private final LedgerSync ledgerSync;
    private final CandleIndexBootstrap indexes;
    private final ForesightProperties props;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile boolean stopping;

    @PreDestroy
    public void stop() {
        stopping = true;
    }

    public int run(String symbol) {
        final ControlEntity self = ControlEntity.producer();
        final ForesightProperties.Producer cfg = props.getProducer();
        log.info("Starting producer for {}", symbol);

        try {
            indexes.ensure(symbol);
            ledgerSync.sync(symbol);
        } catch (IOException | RuntimeException e) {
            log.error("Initial ledger sync failed for {}: {}", symbol, e.toString());
        }

        control.write(self, ControlPhase.RUNNING);
        Optional<Instant> lastTime = ledger.lastOpenTime(symbol);
        lastTime.ifPresent(t -> log.info("Found existing data, last time: {}", t));

        try {
            while (!stopping) {
                ControlPhase phase = control.read(self, props.getControl().getReadTimeout());
                if (phase == ControlPhase.DELETE) {
                    log.info("Received delete command, shutting down...");
                    control.write(self, ControlPhase.DELETED);
                    return EXIT_OK;
                }
                if (phase == ControlPhase.PAUSE) {
                    log.info("Producer paused, waiting...");
                    sleeper.sleep(cfg.getPauseSleep());
                    continue;
                }
                if (phase == ControlPhase.START) {
                    control.write(self, ControlPhase.RUNNING);
                }

                try {
                    Optional<Instant> advanced = cycle(symbol, lastTime);
                    if (!advanced.isPresent()) {
                        log.info("No new data available, waiting...");
                        sleeper.sleep(cfg.getEmptyFetchSleep());
                        continue;
                    }
                    lastTime = advanced;
                    sleeper.sleep(untilNextMinute());
                } catch (StoreWriteException e) {
                    log.error("CRITICAL: Error inserting into database, stopping producer: {}", e.getMessage(), e);
                    control.write(self, ControlPhase.ERROR, e.getMessage());
                    return EXIT_FATAL;
                } catch (RuntimeException e) {
                    log.error("Error in main loop: {}", e.getMessage(), e);
                    sleeper.sleep(cfg.getErrorSleep());
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("Producer interrupted, shutting down...");
        }
        control.write(self, ControlPhase.DELETED);
        log.info("Producer stopped");
        return EXIT_OK;
    }

    /**
     * One fetch/persist/append/publish pass.
     *
     * @return the new cursor, or empty when nothing new was fetched
     */
    public Optional<Instant> cycle(String symbol, Optional<Instant> lastTime) {
        Instant from = lastTime.map(t -> t.plus(1, ChronoUnit.MINUTES))
                .orElseGet(() -> Instant.now(clock).minus(props.getProducer().getInitialLookback()));

        List<PriceCandle> fresh = market.fetchSince(symbol, from).stream()
                .filter(c -> !lastTime.isPresent() || c.getOpenTime().isAfter(lastTime.get()))
                .sorted((a, b) -> a.getOpenTime().compareTo(b.getOpenTime()))
                .collect(Collectors.toList());
        if (fresh.isEmpty()) return Optional.empty();

        try {
            store.bulkInsert(symbol, fresh);
        } catch (StoreWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreWriteException("Store insert failed for " + symbol + ": " + e.getMessage(), e);
        }

        try {
            ledger.append(symbol, fresh);
            log.info("Appended {} records to ledger", fresh.size());
        } catch (IOException e) {
            log.error("Error writing to ledger {}: {}", ledger.fileFor(symbol), e.toString());
        }

        publisher.publish(symbol, fresh);
        return Optional.of(fresh.get(fresh.size() - 1).getOpenTime());
    }

    Duration untilNextMinute() {
        Instant now = Instant.now(clock);
        Instant next = now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        return Duration.between(now, next);
    }
}
