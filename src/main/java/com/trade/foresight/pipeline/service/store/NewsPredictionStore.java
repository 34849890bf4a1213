package com.trade.foresight.pipeline.service.store;

import com.trade.foresight.pipeline.model.NewsArticlePrediction;
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
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * News predictions in the {@code trl} collection, one document per article
 * link, with one {@code trl_{version}} column per model version.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class NewsPredictionStore {

    public static final String COLLECTION = "trl";

    private final MongoTemplate mongo;
    private final CandleDocumentGateway gateway;
    private final ChunkedBatchWriter writer;

    public static String column(int version) {
        return COLLECTION + "_" + version;
    }

    /** Merge-upserts every article, writing its prediction into {@code trl_{version}}. */
    public int upsertAll(List<NewsArticlePrediction> articles, int version) {
        String col = column(version);
        List<NewsArticlePrediction> valid = articles.stream()
                .filter(a -> a.getLink() != null && !a.getLink().isEmpty())
                .collect(Collectors.toList());
        log.info("Upserting {} rows into {} ({})", valid.size(), COLLECTION, col);
        writer.write(COLLECTION + " upsert", valid, chunk -> {
            BulkOperations ops = mongo.bulkOps(BulkOperations.BulkMode.UNORDERED, COLLECTION);
            for (NewsArticlePrediction a : chunk) {
                Update u = new Update()
                        .set("title", a.getTitle())
                        .set("link", a.getLink())
                        .set("date", a.getDate() == null ? null : Date.from(a.getDate()))
                        .set(col, a.getPrediction())
                        .set("price_change", a.getPriceChange())
                        .set("label", a.getLabel());
                ops.upsert(Query.query(Criteria.where("_id").is(a.getLink())), u);
            }
            ops.execute();
        });
        return valid.size();
    }

    /**
     * Inserts articles whose link is not stored yet; the prediction goes into
     * a plain {@code pred} field.
     *
     * @return number of inserted documents
     */
    public int insertIfAbsent(List<NewsArticlePrediction> articles) {
        AtomicInteger inserted = new AtomicInteger();
        writer.write(COLLECTION + " insert", articles, chunk -> {
            List<String> links = chunk.stream().map(NewsArticlePrediction::getLink).collect(Collectors.toList());
            Query q = Query.query(Criteria.where("_id").in(links));
            q.fields().include("_id");
            Set<String> existing = new HashSet<>();
            for (Document d : mongo.find(q, Document.class, COLLECTION)) {
                existing.add(d.getString("_id"));
            }
            List<Document> docs = new ArrayList<>();
            for (NewsArticlePrediction a : chunk) {
                if (!existing.add(a.getLink())) continue;
                Document d = new Document("_id", a.getLink())
                        .append("title", a.getTitle())
                        .append("link", a.getLink())
                        .append("date", a.getDate() == null ? null : Date.from(a.getDate()))
                        .append("pred", a.getPrediction())
                        .append("price_change", a.getPriceChange())
                        .append("label", a.getLabel());
                docs.add(d);
            }
            if (!docs.isEmpty()) {
                mongo.insert(docs, COLLECTION);
                inserted.addAndGet(docs.size());
            }
        });
        log.info("Inserted {} new rows into {}, skipped existing links.", inserted.get(), COLLECTION);
        return inserted.get();
    }

    /** Sets {@code trl_{version}} to null on every document. */
    public long resetVersion(int version) {
        String col = column(version);
        long n = mongo.updateMulti(new Query(), new Update().set(col, null), COLLECTION).getModifiedCount();
        log.info("All values in field '{}' have been set to null ({} documents).", col, n);
        return n;
    }

    /** Moves {@code trl_{from}} into {@code trl_{to}}. */
    public int shiftVersion(int from, int to) {
        String fromCol = column(from);
        String toCol = column(to);
        Map<String, Object> values = gateway.columnValues(COLLECTION, fromCol);
        List<Map.Entry<String, Object>> entries = new ArrayList<>(values.entrySet());
        writer.write(COLLECTION + " shift " + fromCol + "->" + toCol, entries, chunk -> gateway.moveColumn(
                COLLECTION, fromCol, toCol,
                chunk.stream().collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue))));
        log.info("Shifted {} documents from {} to {}", entries.size(), fromCol, toCol);
        return entries.size();
    }

    /** Date of the newest stored article. */
    public Optional<Instant> lastArticleDate() {
        Query q = Query.query(Criteria.where("date").ne(null)).with(Sort.by(Sort.Direction.DESC, "date")).limit(1);
        q.fields().include("date");
        Document d = mongo.findOne(q, Document.class, COLLECTION);
        if (d == null || d.getDate("date") == null) return Optional.empty();
        return Optional.of(d.getDate("date").toInstant());
    }
}
