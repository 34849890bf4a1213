package com.trade.foresight.pipeline.service.market;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.PriceCandle;
import com.trade.foresight.pipeline.service.store.CandleStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Brings the document store up to the local ledger before the producer starts
 * fetching: rows newer than the store's latest open time are inserted. An empty
 * store receives at most {@code max-initial-sync-rows} of the most recent rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerSync {

    private final LocalPriceLedger ledger;
    private final CandleStoreService store;
    private final ForesightProperties props;

    public int sync(String symbol) throws IOException {
        Optional<Instant> last = store.lastOpenTime(symbol);
        List<PriceCandle> rows;
        if (last.isPresent()) {
            Instant cutoff = last.get();
            rows = ledger.readAll(symbol).stream()
                    .filter(c -> c.getOpenTime().isAfter(cutoff))
                    .collect(Collectors.toList());
        } else {
            rows = ledger.readTail(symbol, props.getProducer().getMaxInitialSyncRows());
        }
        if (rows.isEmpty()) {
            log.info("Store already in sync with ledger for {}", symbol);
            return 0;
        }
        store.bulkInsert(symbol, rows);
        log.info("Synced {} ledger rows into the store for {}", rows.size(), symbol);
        return rows.size();
    }
}
