package com.trade.foresight.pipeline.model.documents;

import com.trade.foresight.pipeline.enums.TrainingEventType;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only log of training task progress
 */
@Document("batch_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingEvent {

    private @Id String id;

    @Field("dag_name")
    private String dagName;
    @Field("task_name")
    private String taskName;
    @Field("model_name")
    private String modelName;
    @Field("run_id")
    private String runId;
    @Field("event_type")
    private TrainingEventType eventType;

    private String status;
    private String message;
    private Map<String, Object> metadata;

    @Indexed
    @Field("created_at")
    private Instant createdAt;
}
