package com.trade.foresight.pipeline.service.store;

import com.mongodb.bulk.BulkWriteResult;
import com.trade.foresight.pipeline.model.PriceCandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Repository
@RequiredArgsConstructor
public class MongoCandleDocumentGateway implements CandleDocumentGateway {

    static final String ID = "_id";
    static final String OPEN_TIME = "open_time";

    private final MongoTemplate mongo;

    private static Query byId(String id) {
        return Query.query(Criteria.where(ID).is(id));
    }

    private static Update candleFields(PriceCandle c) {
        return new Update()
                .set(OPEN_TIME, Date.from(c.getOpenTime()))
                .set("open", c.getOpen())
                .set("high", c.getHigh())
                .set("low", c.getLow())
                .set("close", c.getClose())
                .set("volume", c.getVolume());
    }

    @Override
    public void mergeCandles(String collection, List<PriceCandle> candles) {
        if (candles.isEmpty()) return;
        BulkOperations ops = mongo.bulkOps(BulkOperations.BulkMode.UNORDERED, collection);
        for (PriceCandle c : candles) {
            ops.upsert(byId(CandleDocumentGateway.documentId(c.getOpenTime())), candleFields(c));
        }
        BulkWriteResult r = ops.execute();
        log.debug("merge {} candles into {}: upserted={} modified={}", candles.size(), collection,
                r.getUpserts().size(), r.getModifiedCount());
    }

    @Override
    public boolean setColumn(String collection, String id, String column, List<Double> values) {
        return mongo.updateFirst(byId(id), new Update().set(column, values), collection).getMatchedCount() > 0;
    }

    @Override
    public void setColumnBulk(String collection, String column, Map<String, List<Double>> valuesById) {
        if (valuesById.isEmpty()) return;
        BulkOperations ops = mongo.bulkOps(BulkOperations.BulkMode.UNORDERED, collection);
        valuesById.forEach((id, v) -> ops.updateOne(byId(id), new Update().set(column, v)));
        ops.execute();
    }

    @Override
    public void upsertRows(String collection, String column, Map<PriceCandle, List<Double>> rows) {
        if (rows.isEmpty()) return;
        BulkOperations ops = mongo.bulkOps(BulkOperations.BulkMode.UNORDERED, collection);
        rows.forEach((c, v) -> ops.upsert(
                byId(CandleDocumentGateway.documentId(c.getOpenTime())),
                candleFields(c).set(column, v)));
        ops.execute();
    }

    @Override
    public Set<String> existingIds(String collection, Collection<String> ids) {
        if (ids.isEmpty()) return new HashSet<>();
        Query q = Query.query(Criteria.where(ID).in(ids));
        q.fields().include(ID);
        return mongo.find(q, Document.class, collection).stream()
                .map(d -> String.valueOf(d.get(ID)))
                .collect(Collectors.toSet());
    }

    @Override
    public List<String> idsOlderThan(String collection, Instant cutoff) {
        Query q = Query.query(Criteria.where(OPEN_TIME).lt(Date.from(cutoff)));
        q.fields().include(ID);
        return mongo.find(q, Document.class, collection).stream()
                .map(d -> String.valueOf(d.get(ID)))
                .collect(Collectors.toList());
    }

    @Override
    public void deleteIds(String collection, List<String> ids) {
        if (ids.isEmpty()) return;
        mongo.remove(Query.query(Criteria.where(ID).in(ids)), collection);
    }

    @Override
    public Optional<Instant> latestOpenTime(String collection) {
        return firstOpenTime(new Query(), collection, Sort.Direction.DESC);
    }

    @Override
    public List<Instant> missingTimes(String collection, String column, int limit) {
        Query q = Query.query(Criteria.where(column).is(null)).with(Sort.by(Sort.Direction.ASC, OPEN_TIME));
        if (limit > 0) q.limit(limit);
        q.fields().include(OPEN_TIME);
        return mongo.find(q, Document.class, collection).stream()
                .map(d -> d.getDate(OPEN_TIME))
                .filter(java.util.Objects::nonNull)
                .map(Date::toInstant)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Instant> lastMissingTime(String collection, String column) {
        return firstOpenTime(Query.query(Criteria.where(column).is(null)), collection, Sort.Direction.DESC);
    }

    @Override
    public long countWithColumn(String collection, String column) {
        return mongo.count(Query.query(Criteria.where(column).ne(null)), collection);
    }

    @Override
    public Map<String, Object> columnValues(String collection, String column) {
        Query q = Query.query(Criteria.where(column).ne(null));
        q.fields().include(ID).include(column);
        Map<String, Object> out = new LinkedHashMap<>();
        for (Document d : mongo.find(q, Document.class, collection)) {
            out.put(String.valueOf(d.get(ID)), d.get(column));
        }
        return out;
    }

    @Override
    public void moveColumn(String collection, String fromColumn, String toColumn, Map<String, Object> valuesById) {
        if (valuesById.isEmpty()) return;
        BulkOperations ops = mongo.bulkOps(BulkOperations.BulkMode.UNORDERED, collection);
        valuesById.forEach((id, v) -> ops.updateOne(byId(id), new Update().set(toColumn, v).set(fromColumn, null)));
        ops.execute();
    }

    private Optional<Instant> firstOpenTime(Query q, String collection, Sort.Direction dir) {
        q.with(Sort.by(dir, OPEN_TIME)).limit(1);
        q.fields().include(OPEN_TIME);
        Document d = mongo.findOne(q, Document.class, collection);
        if (d == null || d.getDate(OPEN_TIME) == null) return Optional.empty();
        return Optional.of(d.getDate(OPEN_TIME).toInstant());
    }
}
