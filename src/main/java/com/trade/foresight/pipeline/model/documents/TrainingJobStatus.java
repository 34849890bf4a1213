package com.trade.foresight.pipeline.model.documents;

import com.trade.foresight.pipeline.enums.TrainingState;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One row per (model, coin) training job of the current cycle.
 */
@Document("batch_status")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJobStatus {

    private @Id String id;        // {model}_{coin}

    private String model;
    private String coin;
    private TrainingState state;

    @Field("error_message")
    private String errorMessage;

    @Field("updated_at")
    private Instant updatedAt;

    public static String idOf(String model, String coin) {
        return model + "_" + coin;
    }
}
