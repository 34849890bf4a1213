package com.trade.foresight.pipeline.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Latest state of one (dag, task, model, run), folded from its events.
 */
@Document("batch_run_status")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRunSnapshot {

    private @Id String id;        // {dag}_{task}_{model}_{run}

    @Field("dag_name")
    private String dagName;
    @Field("task_name")
    private String taskName;
    @Field("model_name")
    private String modelName;
    @Field("run_id")
    private String runId;

    private String status;
    private int retries;

    @Field("last_message")
    private String lastMessage;

    private Map<String, Object> metadata;

    @Field("updated_at")
    private Instant updatedAt;
}
