package com.trade.foresight.pipeline.repo.documents;

import com.trade.foresight.pipeline.model.documents.TrainingRunSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrainingRunSnapshotRepo extends MongoRepository<TrainingRunSnapshot, String> {

    List<TrainingRunSnapshot> findByDagNameOrderByUpdatedAtDesc(String dagName);

    List<TrainingRunSnapshot> findByDagNameAndRunIdOrderByUpdatedAtDesc(String dagName, String runId);
}
