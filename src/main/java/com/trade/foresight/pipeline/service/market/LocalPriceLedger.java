package com.trade.foresight.pipeline.service.market;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.model.PriceCandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Append-only CSV of fetched candles per symbol:
 * {@code <data-dir>/prices/<SYMBOL>.csv} with header open_time,open,high,low,close,volume.
 * The producer's cursor and the consumer's reconciliation windows are read from here.
 */
@Slf4j
@Component
public class LocalPriceLedger {

    static final String HEADER = "open_time,open,high,low,close,volume";

    private final Path pricesDir;

    @Autowired
    public LocalPriceLedger(ForesightProperties props) {
        this(Paths.get(props.getPaths().getDataDir(), "prices"));
    }

    public LocalPriceLedger(Path pricesDir) {
        this.pricesDir = pricesDir;
    }

    public Path fileFor(String symbol) {
        return pricesDir.resolve(symbol.toUpperCase(Locale.ROOT) + ".csv");
    }

    public void append(String symbol, List<PriceCandle> candles) throws IOException {
        if (candles.isEmpty()) return;
        Path f = fileFor(symbol);
        Files.createDirectories(f.getParent());
        boolean fresh = !Files.exists(f);
        try (BufferedWriter w = Files.newBufferedWriter(f, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (fresh) {
                w.write(HEADER);
                w.newLine();
            }
            for (PriceCandle c : candles) {
                w.write(c.getOpenTime() + "," + c.getOpen() + "," + c.getHigh() + "," + c.getLow()
                        + "," + c.getClose() + "," + c.getVolume());
                w.newLine();
            }
        }
    }

    /**
     * Latest open time in the ledger; empty when the file is missing, empty or unreadable.
     */
    public Optional<Instant> lastOpenTime(String symbol) {
        try {
            return readAll(symbol).stream().map(PriceCandle::getOpenTime).max(Comparator.naturalOrder());
        } catch (IOException e) {
            log.warn("Error reading ledger {}: {}", fileFor(symbol), e.toString());
            return Optional.empty();
        }
    }

    /** Every parsable row, ascending by open time, duplicates removed. */
    public List<PriceCandle> readAll(String symbol) throws IOException {
        return readTail(symbol, 0);
    }

    /**
     * The last {@code maxRows} rows (0 = all), ascending by open time.
     */
    public List<PriceCandle> readTail(String symbol, int maxRows) throws IOException {
        Path f = fileFor(symbol);
        if (!Files.exists(f)) return new ArrayList<>();
        Deque<PriceCandle> rows = new ArrayDeque<>();
        try (BufferedReader r = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (lineNo == 1 && line.startsWith("open_time")) continue;
                if (line.trim().isEmpty()) continue;
                PriceCandle c = parse(symbol, line);
                if (c == null) {
                    log.debug("Skipping ledger line {} of {}", lineNo, f.getFileName());
                    continue;
                }
                rows.addLast(c);
                if (maxRows > 0 && rows.size() > maxRows) rows.removeFirst();
            }
        }
        List<PriceCandle> out = new ArrayList<>(rows);
        out.sort(Comparator.comparing(PriceCandle::getOpenTime));
        List<PriceCandle> dedup = new ArrayList<>(out.size());
        for (PriceCandle c : out) {
            if (dedup.isEmpty() || !dedup.get(dedup.size() - 1).getOpenTime().equals(c.getOpenTime())) {
                dedup.add(c);
            }
        }
        return dedup;
    }

    static PriceCandle parse(String symbol, String line) {
        String[] p = line.split(",");
        if (p.length < 6) return null;
        try {
            return PriceCandle.builder()
                    .symbol(symbol.toUpperCase(Locale.ROOT))
                    .openTime(parseTime(p[0].trim()))
                    .open(Double.parseDouble(p[1].trim()))
                    .high(Double.parseDouble(p[2].trim()))
                    .low(Double.parseDouble(p[3].trim()))
                    .close(Double.parseDouble(p[4].trim()))
                    .volume(Double.parseDouble(p[5].trim()))
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            return null;
        }
    }

    /** Accepts 2024-01-01T00:00:00Z as well as 2024-01-01 00:00:00+00:00. */
    static Instant parseTime(String s) {
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(s.replace(' ', 'T')).toInstant();
        }
    }
}
