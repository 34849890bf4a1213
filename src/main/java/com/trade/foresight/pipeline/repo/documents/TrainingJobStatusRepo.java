package com.trade.foresight.pipeline.repo.documents;

import com.trade.foresight.pipeline.model.documents.TrainingJobStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrainingJobStatusRepo extends MongoRepository<TrainingJobStatus, String> {
}
