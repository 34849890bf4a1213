package com.trade.foresight.pipeline.model;

import com.trade.foresight.pipeline.enums.ControlPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Control record stored per entity. Serialized as
 * {crypto, model, version, state, error_message, updated_at}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlState {

    private String crypto;
    private String model;
    private String version;
    private ControlPhase state;
    private String errorMessage;
    private Instant updatedAt;

    public ControlEntity entity() {
        return ControlEntity.of(crypto, model, version);
    }
}
