package com.trade.foresight.pipeline.jobs;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.service.store.CandleStoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

/**
 * Mongo bootstrap for a symbol's candle collection: creates it if needed and
 * adds the ascending open_time index used by every range and missing-column query.
 * <p>
 * Toggle with foresight.store.ensure-indexes (default true).
 */
@Component
public class CandleIndexBootstrap {

    private static final Logger log = LoggerFactory.getLogger(CandleIndexBootstrap.class);

    private final MongoTemplate mongoTemplate;
    private final ForesightProperties props;

    public CandleIndexBootstrap(MongoTemplate mongoTemplate, ForesightProperties props) {
        this.mongoTemplate = mongoTemplate;
        this.props = props;
    }

    public void ensure(String symbol) {
        if (!props.getStore().isEnsureIndexes()) {
            log.info("Mongo index bootstrap disabled (foresight.store.ensure-indexes=false). Skipping.");
            return;
        }
        String coll = CandleStoreService.collection(symbol);
        if (!mongoTemplate.collectionExists(coll)) {
            mongoTemplate.createCollection(coll);
            log.info("Created collection '{}'", coll);
        }
        String name = mongoTemplate.indexOps(coll)
                .ensureIndex(new Index().on("open_time", Sort.Direction.ASC).named("open_time_1"));
        log.info("Ensured index {} on '{}'", name, coll);
    }
}
