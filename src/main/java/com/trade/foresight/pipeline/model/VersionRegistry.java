package com.trade.foresight.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of {@code models/version_registry.json}:
 * model type -> slot ("v1".."v3") -> entry, plus bookkeeping.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionRegistry {

    private Map<String, Map<String, ModelVersionSlot>> models = new LinkedHashMap<>();
    private Metadata metadata = new Metadata();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private Instant lastUpdated;
        private List<HistoryEntry> versionHistory = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HistoryEntry {
        private String modelType;
        private String action;
        private String version;
        private String path;
        private Instant timestamp;
    }
}
