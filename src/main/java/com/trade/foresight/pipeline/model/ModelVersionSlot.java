package com.trade.foresight.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry entry for one slot of one model type.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelVersionSlot {

    private String path;
    private Instant createdAt;
    private String source;
    private String description;
    private String promotedFrom;
    private Instant promotedAt;
    private Instant rolledBackAt;
    private String rolledBackFrom;
}
