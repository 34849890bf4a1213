package com.trade.foresight.pipeline.service.market;

import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.MarketDataException;
import com.trade.foresight.pipeline.model.PriceCandle;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Paged 1-minute kline download from a Binance compatible REST endpoint.
 * Each page is retried through the "market" Retry instance.
 */
@Slf4j
@Component
public class BinanceKlineClient implements MarketDataSource {

    private static final String KLINES_PATH = "/api/v3/klines";
    private static final ParameterizedTypeReference<List<List<Object>>> KLINES =
            new ParameterizedTypeReference<List<List<Object>>>() {
            };

    private final RestTemplate rest;
    private final ForesightProperties.Market props;
    private final Retry retry;
    private final Clock clock;
    private final Sleeper sleeper;

    public BinanceKlineClient(@Qualifier("marketRestTemplate") RestTemplate rest,
                              ForesightProperties props,
                              RetryRegistry retryRegistry,
                              Clock clock,
                              Sleeper sleeper) {
        this.rest = rest;
        this.props = props.getMarket();
        this.retry = retryRegistry.retry("market");
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public List<PriceCandle> fetchSince(String symbol, Instant fromInclusive) {
        final String sym = symbol.toUpperCase(Locale.ROOT);
        final long end = clock.millis();
        long cursor = fromInclusive.toEpochMilli();
        List<PriceCandle> out = new ArrayList<>();

        while (cursor < end) {
            final URI uri = pageUri(sym, cursor);
            List<List<Object>> page;
            try {
                page = retry.executeSupplier(() -> rest.exchange(uri, HttpMethod.GET, null, KLINES).getBody());
            } catch (RuntimeException e) {
                throw new MarketDataException("Kline fetch failed for " + sym + " at " + Instant.ofEpochMilli(cursor)
                        + ": " + e.getMessage(), e);
            }
            if (page == null || page.isEmpty()) break;

            long lastOpen = cursor;
            for (List<Object> row : page) {
                lastOpen = asLong(row.get(0));
                long closeTime = asLong(row.get(6));
                if (closeTime > end) continue; // still forming
                PriceCandle c = toCandle(sym, row);
                if (c.isValid()) {
                    out.add(c);
                } else {
                    log.warn("Dropping malformed candle {} {}", sym, c);
                }
            }
            cursor = lastOpen + 1;
            pause();
        }
        log.info("Fetched {} candles for {} since {}", out.size(), sym, fromInclusive);
        return out;
    }

    private URI pageUri(String symbol, long startTime) {
        return UriComponentsBuilder.fromHttpUrl(props.getBaseUrl().replaceAll("/+$", "") + KLINES_PATH)
                .queryParam("symbol", symbol)
                .queryParam("interval", props.getInterval())
                .queryParam("startTime", startTime)
                .queryParam("limit", props.getPageLimit())
                .build(true)
                .toUri();
    }

    static PriceCandle toCandle(String symbol, List<Object> row) {
        return PriceCandle.builder()
                .symbol(symbol)
                .openTime(Instant.ofEpochMilli(asLong(row.get(0))))
                .open(asDouble(row.get(1)))
                .high(asDouble(row.get(2)))
                .low(asDouble(row.get(3)))
                .close(asDouble(row.get(4)))
                .volume(asDouble(row.get(5)))
                .build();
    }

    private static long asLong(Object o) {
        return o instanceof Number ? ((Number) o).longValue() : Long.parseLong(String.valueOf(o));
    }

    private static double asDouble(Object o) {
        return o instanceof Number ? ((Number) o).doubleValue() : Double.parseDouble(String.valueOf(o));
    }

    private void pause() {
        try {
            sleeper.sleep(props.getPageDelay());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("Interrupted between kline pages", ie);
        }
    }
}
