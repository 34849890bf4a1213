package com.trade.foresight.pipeline.repo.documents;

import com.trade.foresight.pipeline.model.documents.TrainingEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TrainingEventRepo extends MongoRepository<TrainingEvent, String> {

    /**
     * Most recent events of a DAG, newest first.
     */
    List<TrainingEvent> findByDagNameOrderByCreatedAtDesc(String dagName, Pageable page);

    List<TrainingEvent> findByDagNameAndRunIdOrderByCreatedAtDesc(String dagName, String runId, Pageable page);

    /**
     * Retention sweep, one page at a time.
     */
    List<TrainingEvent> findByCreatedAtBefore(Instant cutoff, Pageable page);
}
