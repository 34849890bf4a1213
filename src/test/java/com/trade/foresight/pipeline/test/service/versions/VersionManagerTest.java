package com.trade.foresight.pipeline.test.service.versions;

import com.trade.foresight.pipeline.common.exception.ValidationException;
import com.trade.foresight.pipeline.common.exception.VersionRegistryException;
import com.trade.foresight.pipeline.config.CustomConfig;
import com.trade.foresight.pipeline.enums.ModelType;
import com.trade.foresight.pipeline.model.ModelVersionSlot;
import com.trade.foresight.pipeline.model.VersionRegistry;
import com.trade.foresight.pipeline.service.versions.VersionManager;
import com.trade.foresight.pipeline.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class VersionManagerTest {

    @TempDir
    Path dir;

    private Path models;
    private ManualClock clock;
    private VersionManager versions;

    @BeforeEach
    void setUp() {
        models = dir.resolve("models");
        clock = new ManualClock(Instant.parse("2024-03-01T00:00:00Z"));
        versions = new VersionManager(models, CustomConfig.pipelineMapper(), clock);
    }

    /** A model file named model.pkl whose content is {@code tag}, plus a feature side file. */
    private Path model(String tag) throws Exception {
        Path src = Files.createDirectories(dir.resolve("src").resolve(tag));
        Files.write(src.resolve("model_features.pkl"), ("features-" + tag).getBytes(StandardCharsets.UTF_8));
        return Files.write(src.resolve("model.pkl"), tag.getBytes(StandardCharsets.UTF_8));
    }

    private String content(String version) throws Exception {
        Path p = versions.modelPath(ModelType.LIGHTGBM, version).orElseThrow();
        return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    }

    @Test
    void slotsRotateOnEachRegistration() throws Exception {
        versions.initializeBaseline(ModelType.LIGHTGBM, model("A"), "baseline");
        clock.advance(Duration.ofDays(1));
        assertThat(versions.registerNewModel(ModelType.LIGHTGBM, model("B"), "retrain 1")).isEqualTo("3");

        assertThat(content("v1")).isEqualTo("A");
        assertThat(content("v2")).isEqualTo("A");
        assertThat(content("v3")).isEqualTo("B");
        assertThat(versions.versionInfo(ModelType.LIGHTGBM, "2").orElseThrow().getPromotedFrom()).isEqualTo("v1");

        clock.advance(Duration.ofDays(1));
        versions.registerNewModel(ModelType.LIGHTGBM, model("C"), "retrain 2");

        assertThat(content("v1")).isEqualTo("A");
        assertThat(content("v2")).isEqualTo("B");
        assertThat(content("v3")).isEqualTo("C");
        ModelVersionSlot v2 = versions.versionInfo(ModelType.LIGHTGBM, "v2").orElseThrow();
        assertThat(v2.getPromotedFrom()).isEqualTo("v3");
        assertThat(v2.getPromotedAt()).isEqualTo(Instant.parse("2024-03-03T00:00:00Z"));
        assertThat(v2.getDescription()).isEqualTo("retrain 1");
        assertThat(models.resolve("lightgbm/v3/model_features.pkl")).hasContent("features-C");
        assertThat(models.resolve("lightgbm/v2/model_features.pkl")).hasContent("features-B");
    }

    @Test
    void firstRegistrationWithoutBaselineLeavesV2Empty() throws Exception {
        versions.registerNewModel(ModelType.TST, model("X"), "first");

        Map<String, Path> all = versions.allVersions(ModelType.TST);
        assertThat(all).containsKeys("v1", "v2", "v3");
        assertThat(all.get("v1")).isNull();
        assertThat(all.get("v2")).isNull();
        assertThat(all.get("v3")).isNotNull();
    }

    @Test
    void baselineIsWrittenOnce() throws Exception {
        versions.initializeBaseline(ModelType.LIGHTGBM, model("A"), "baseline");
        versions.initializeBaseline(ModelType.LIGHTGBM, model("Z"), "again");

        assertThat(content("1")).isEqualTo("A");
        assertThat(versions.history()).hasSize(1);
    }

    @Test
    void rollbackCopiesTargetIntoV3AndKeepsBackup() throws Exception {
        versions.initializeBaseline(ModelType.LIGHTGBM, model("A"), "baseline");
        versions.registerNewModel(ModelType.LIGHTGBM, model("B"), "retrain 1");
        versions.registerNewModel(ModelType.LIGHTGBM, model("C"), "retrain 2");
        clock.set(Instant.parse("2024-03-05T12:30:15Z"));

        versions.rollbackToVersion(ModelType.LIGHTGBM, "v1");

        assertThat(content("v3")).isEqualTo("A");
        assertThat(content("v2")).isEqualTo("B");
        assertThat(models.resolve("lightgbm/backups/v3_backup_20240305_123015/model.pkl")).hasContent("C");
        ModelVersionSlot v3 = versions.versionInfo(ModelType.LIGHTGBM, "3").orElseThrow();
        assertThat(v3.getRolledBackFrom()).isEqualTo("v1");
        assertThat(v3.getRolledBackAt()).isEqualTo(Instant.parse("2024-03-05T12:30:15Z"));
        assertThat(v3.getDescription()).isEqualTo("baseline");
        assertThat(versions.history()).extracting(VersionRegistry.HistoryEntry::getAction)
                .containsExactly("baseline_initialized", "new_model_registered", "new_model_registered", "rollback");
    }

    @Test
    void registeringAfterRollbackRotatesRolledBackModel() throws Exception {
        versions.initializeBaseline(ModelType.LIGHTGBM, model("A"), "baseline");
        versions.registerNewModel(ModelType.LIGHTGBM, model("B"), "retrain 1");
        versions.rollbackToVersion(ModelType.LIGHTGBM, "2");

        versions.registerNewModel(ModelType.LIGHTGBM, model("D"), "retrain 2");

        assertThat(content("v2")).isEqualTo("A");
        assertThat(content("v3")).isEqualTo("D");
        ModelVersionSlot v2 = versions.versionInfo(ModelType.LIGHTGBM, "2").orElseThrow();
        assertThat(v2.getRolledBackFrom()).isNull();
        assertThat(v2.getPromotedFrom()).isEqualTo("v3");
        assertThat(v2.getPath()).endsWith("model.pkl");
    }

    @Test
    void invalidRollbackTargets() throws Exception {
        assertThatThrownBy(() -> versions.rollbackToVersion(ModelType.LIGHTGBM, "v3"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> versions.rollbackToVersion(ModelType.LIGHTGBM, "7"))
                .isInstanceOf(ValidationException.class);

        versions.registerNewModel(ModelType.LIGHTGBM, model("B"), "only v3");
        assertThatThrownBy(() -> versions.rollbackToVersion(ModelType.LIGHTGBM, "v2"))
                .isInstanceOf(VersionRegistryException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void missingModelFileIsRejected() {
        assertThatThrownBy(() -> versions.registerNewModel(ModelType.TST, dir.resolve("nope.pkl"), "x"))
                .isInstanceOf(VersionRegistryException.class);
        assertThat(Files.exists(models.resolve(VersionManager.REGISTRY_FILE))).isFalse();
    }

    @Test
    void registryIsPersistedAsSnakeCaseJson() throws Exception {
        versions.initializeBaseline(ModelType.LIGHTGBM, model("A"), "baseline");
        versions.registerNewModel(ModelType.LIGHTGBM, model("B"), "retrain");

        String json = new String(Files.readAllBytes(models.resolve(VersionManager.REGISTRY_FILE)),
                StandardCharsets.UTF_8);
        assertThat(json).contains("\"version_history\"", "\"created_at\"", "\"promoted_from\" : \"v1\"",
                "\"last_updated\"");

        VersionManager reloaded = new VersionManager(models, CustomConfig.pipelineMapper(), clock);
        assertThat(reloaded.allVersions(ModelType.LIGHTGBM)).isEqualTo(versions.allVersions(ModelType.LIGHTGBM));
        assertThat(reloaded.history()).hasSize(2);
        assertThat(reloaded.listAll()).containsKeys("lightgbm", "tst", "finbert", "ensemble");
    }

    @Test
    void unreadableRegistryStartsFresh() throws Exception {
        Files.createDirectories(models);
        Files.write(models.resolve(VersionManager.REGISTRY_FILE), "{broken".getBytes(StandardCharsets.UTF_8));

        VersionManager fresh = new VersionManager(models, CustomConfig.pipelineMapper(), clock);

        assertThat(fresh.history()).isEmpty();
        assertThat(fresh.modelPath(ModelType.LIGHTGBM, "v1")).isEmpty();
    }
}
