package com.trade.foresight.pipeline.service.store;

import com.trade.foresight.pipeline.model.PriceCandle;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Raw access to the per-symbol candle collections. Document id is the ISO-8601
 * open time; prediction columns are named {@code {model}_{version}}.
 * Callers do the chunking; every method writes its whole argument.
 */
public interface CandleDocumentGateway {

    /** Set-merge candle fields; creates missing documents. */
    void mergeCandles(String collection, List<PriceCandle> candles);

    /** Sets {@code column} on one document; false when the document does not exist. */
    boolean setColumn(String collection, String id, String column, List<Double> values);

    /** Sets {@code column} on every existing document in {@code valuesById}; missing ids are skipped. */
    void setColumnBulk(String collection, String column, Map<String, List<Double>> valuesById);

    /** Upserts full rows: candle fields plus one prediction column. */
    void upsertRows(String collection, String column, Map<PriceCandle, List<Double>> rows);

    Set<String> existingIds(String collection, Collection<String> ids);

    List<String> idsOlderThan(String collection, Instant cutoff);

    void deleteIds(String collection, List<String> ids);

    Optional<Instant> latestOpenTime(String collection);

    /** Open times of documents where {@code column} is missing or null, ascending; limit 0 = no limit. */
    List<Instant> missingTimes(String collection, String column, int limit);

    /** Latest open time among documents missing {@code column}. */
    Optional<Instant> lastMissingTime(String collection, String column);

    long countWithColumn(String collection, String column);

    /** id -> value for every document carrying a non-null {@code column}. */
    Map<String, Object> columnValues(String collection, String column);

    /** For each id: copy the value to {@code toColumn} and null out {@code fromColumn}. */
    void moveColumn(String collection, String fromColumn, String toColumn, Map<String, Object> valuesById);

    static String documentId(Instant openTime) {
        return openTime.toString();
    }
}
