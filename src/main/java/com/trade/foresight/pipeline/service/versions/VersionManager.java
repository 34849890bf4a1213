package com.trade.foresight.pipeline.service.versions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.ValidationException;
import com.trade.foresight.pipeline.common.exception.VersionRegistryException;
import com.trade.foresight.pipeline.enums.ModelType;
import com.trade.foresight.pipeline.model.ModelVersionSlot;
import com.trade.foresight.pipeline.model.VersionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Three model slots per model type under {@code models/{type}/v{1,2,3}}:
 * <ul>
 *   <li>v1 baseline, written once and never rotated</li>
 *   <li>v2 the previous model</li>
 *   <li>v3 the latest model</li>
 * </ul>
 * Registering a model moves v3 to v2 and puts the new one in v3. The registry
 * JSON is rewritten after every mutation; a crash between the file copies and
 * the registry write leaves them out of step.
 */
@Slf4j
@Service
public class VersionManager {

    public static final String REGISTRY_FILE = "version_registry.json";
    public static final List<String> SLOTS = Collections.unmodifiableList(Arrays.asList("1", "2", "3"));

    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path baseDir;
    private final Path registryPath;
    private final ObjectMapper mapper;
    private final Clock clock;
    private VersionRegistry registry;

    @Autowired
    public VersionManager(ForesightProperties props, ObjectMapper mapper, Clock clock) {
        this(Paths.get(props.getPaths().getModelsDir()), mapper, clock);
    }

    public VersionManager(Path baseDir, ObjectMapper mapper, Clock clock) {
        this.baseDir = baseDir;
        this.registryPath = baseDir.resolve(REGISTRY_FILE);
        this.mapper = mapper;
        this.clock = clock;
        this.registry = load();
    }

    /** Seeds slot 1. Does nothing when a baseline already exists. */
    public synchronized void initializeBaseline(ModelType type, Path modelPath, String description) {
        if (slot(type, "1") != null) {
            log.warn("v1 baseline already exists for {}. Skipping initialization.", type.getKey());
            return;
        }
        requireFile(modelPath);
        Path v1 = slotDir(type, "1");
        Path dest = copyModel(type, modelPath, v1);

        Instant now = clock.instant();
        put(type, "1", ModelVersionSlot.builder()
                .path(dest.toString())
                .createdAt(now)
                .source(modelPath.toString())
                .description(description)
                .build());
        record(type, "baseline_initialized", "1", dest, now);
        save();
        log.info("Initialized v1 baseline for {} at {}", type.getKey(), dest);
    }

    /**
     * Rotates v3 into v2 (or seeds v2 from v1 on the first registration after
     * a baseline) and stores the new model as v3.
     *
     * @return the slot the model landed in, always "3"
     */
    public synchronized String registerNewModel(ModelType type, Path modelPath, String description) {
        requireFile(modelPath);
        Instant now = clock.instant();

        ModelVersionSlot v1 = slot(type, "1");
        ModelVersionSlot v2 = slot(type, "2");
        ModelVersionSlot v3 = slot(type, "3");
        if (v3 != null) {
            promote(type, v3, "3", now);
        } else if (v1 != null && v2 == null) {
            promote(type, v1, "1", now);
        }

        Path dest = copyModel(type, modelPath, slotDir(type, "3"));
        put(type, "3", ModelVersionSlot.builder()
                .path(dest.toString())
                .createdAt(now)
                .source(modelPath.toString())
                .description(description)
                .build());
        record(type, "new_model_registered", "3", dest, now);
        save();
        log.info("Registered new model for {} as v3 at {}", type.getKey(), dest);
        return "3";
    }

    /**
     * Copies slot 1 or 2 into slot 3, after backing up the current v3
     * directory under {@code backups/v3_backup_yyyyMMdd_HHmmss}.
     */
    public synchronized void rollbackToVersion(ModelType type, String targetVersion) {
        String target = normalize(targetVersion);
        if (!"1".equals(target) && !"2".equals(target)) {
            throw new ValidationException("Can only rollback to v1 or v2");
        }
        Path targetPath = modelPath(type, target)
                .orElseThrow(() -> new VersionRegistryException(
                        "Version " + target + " not found for " + type.getKey()));
        Instant now = clock.instant();
        Path v3Dir = slotDir(type, "3");

        ModelVersionSlot current = slot(type, "3");
        if (current != null && Files.exists(Paths.get(current.getPath()))) {
            Path backup = baseDir.resolve(type.getKey()).resolve("backups")
                    .resolve("v3_backup_" + BACKUP_STAMP.format(now));
            copyTree(Paths.get(current.getPath()).getParent(), backup);
            log.info("Backed up v3 to {}", backup);
        }

        try {
            clearDir(v3Dir);
            Files.createDirectories(v3Dir);
            try (DirectoryStream<Path> files = Files.newDirectoryStream(targetPath.getParent())) {
                for (Path f : files) {
                    if (Files.isRegularFile(f)) {
                        Files.copy(f, v3Dir.resolve(f.getFileName().toString()),
                                StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    }
                }
            }
        } catch (IOException e) {
            throw new VersionRegistryException("Rollback of " + type.getKey() + " to v" + target + " failed", e);
        }

        ModelVersionSlot from = slot(type, target);
        Path dest = v3Dir.resolve(targetPath.getFileName().toString());
        put(type, "3", from.toBuilder()
                .path(dest.toString())
                .promotedFrom(null)
                .promotedAt(null)
                .rolledBackAt(now)
                .rolledBackFrom("v" + target)
                .build());
        record(type, "rollback", target, dest, now);
        save();
        log.info("Rolled back {} to v{}", type.getKey(), target);
    }

    /** Path of the slot's model file, empty when the slot is unset or the file is gone. */
    public Optional<Path> modelPath(ModelType type, String version) {
        ModelVersionSlot s = slot(type, normalize(version));
        if (s == null || s.getPath() == null) {
            return Optional.empty();
        }
        Path p = Paths.get(s.getPath());
        return Files.exists(p) ? Optional.of(p) : Optional.empty();
    }

    /** v1..v3 mapped to their model file; absent slots map to null. */
    public Map<String, Path> allVersions(ModelType type) {
        Map<String, Path> out = new LinkedHashMap<>();
        for (String v : SLOTS) {
            out.put("v" + v, modelPath(type, v).orElse(null));
        }
        return out;
    }

    public Optional<ModelVersionSlot> versionInfo(ModelType type, String version) {
        return Optional.ofNullable(slot(type, normalize(version)));
    }

    public synchronized Map<String, Map<String, ModelVersionSlot>> listAll() {
        Map<String, Map<String, ModelVersionSlot>> out = new LinkedHashMap<>();
        for (ModelType t : ModelType.values()) {
            out.put(t.getKey(), new LinkedHashMap<>(slots(t)));
        }
        return out;
    }

    public synchronized List<VersionRegistry.HistoryEntry> history() {
        return new ArrayList<>(registry.getMetadata().getVersionHistory());
    }

    // ---------- internals ----------

    private void promote(ModelType type, ModelVersionSlot from, String fromSlot, Instant now) {
        Path src = Paths.get(from.getPath());
        if (!Files.exists(src)) {
            log.warn("v{} file {} for {} is missing, v2 left unchanged", fromSlot, src, type.getKey());
            return;
        }
        Path dest = copyModel(type, src, slotDir(type, "2"));
        put(type, "2", from.toBuilder()
                .path(dest.toString())
                .promotedFrom("v" + fromSlot)
                .promotedAt(now)
                .rolledBackAt(null)
                .rolledBackFrom(null)
                .build());
        log.info("Promoted v{} to v2 for {}", fromSlot, type.getKey());
    }

    /** Replaces the slot directory's content with the model file and its side files. */
    private Path copyModel(ModelType type, Path model, Path slotDir) {
        try {
            if (model.toAbsolutePath().normalize().startsWith(slotDir.toAbsolutePath().normalize())) {
                throw new VersionRegistryException("Source " + model + " lies inside target slot " + slotDir);
            }
            clearDir(slotDir);
            Files.createDirectories(slotDir);
            Path dest = slotDir.resolve(model.getFileName().toString());
            Files.copy(model, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            if (type.getSideFileGlob() != null && model.getParent() != null) {
                try (DirectoryStream<Path> side = Files.newDirectoryStream(model.getParent(), type.getSideFileGlob())) {
                    for (Path f : side) {
                        Files.copy(f, slotDir.resolve(f.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    }
                }
            }
            return dest;
        } catch (IOException e) {
            throw new VersionRegistryException("Cannot copy " + model + " into " + slotDir, e);
        }
    }

    private Path slotDir(ModelType type, String version) {
        return baseDir.resolve(type.getKey()).resolve("v" + version);
    }

    private Map<String, ModelVersionSlot> slots(ModelType type) {
        return registry.getModels().computeIfAbsent(type.getKey(), k -> new LinkedHashMap<>());
    }

    private ModelVersionSlot slot(ModelType type, String version) {
        return slots(type).get("v" + version);
    }

    private void put(ModelType type, String version, ModelVersionSlot s) {
        slots(type).put("v" + version, s);
    }

    private void record(ModelType type, String action, String version, Path path, Instant at) {
        registry.getMetadata().getVersionHistory().add(VersionRegistry.HistoryEntry.builder()
                .modelType(type.getKey())
                .action(action)
                .version(version)
                .path(path.toString())
                .timestamp(at)
                .build());
    }

    private VersionRegistry load() {
        if (Files.exists(registryPath)) {
            try {
                VersionRegistry r = mapper.readValue(registryPath.toFile(), VersionRegistry.class);
                if (r.getModels() == null) r.setModels(new LinkedHashMap<>());
                if (r.getMetadata() == null) r.setMetadata(new VersionRegistry.Metadata());
                if (r.getMetadata().getVersionHistory() == null) {
                    r.getMetadata().setVersionHistory(new ArrayList<>());
                }
                return r;
            } catch (IOException e) {
                log.warn("Error loading registry {}: {}. Creating new registry.", registryPath, e.getMessage());
            }
        }
        return new VersionRegistry();
    }

    private void save() {
        registry.getMetadata().setLastUpdated(clock.instant());
        try {
            Files.createDirectories(baseDir);
            Path tmp = registryPath.resolveSibling(REGISTRY_FILE + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), registry);
            Files.move(tmp, registryPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new VersionRegistryException("Cannot write " + registryPath, e);
        }
    }

    private static String normalize(String version) {
        String v = version == null ? "" : version.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("v")) v = v.substring(1);
        if (!SLOTS.contains(v)) {
            throw new ValidationException("Invalid version: " + version + ". Must be 1, 2 or 3");
        }
        return v;
    }

    private static void requireFile(Path p) {
        if (p == null || !Files.isRegularFile(p)) {
            throw new VersionRegistryException("Model file not found: " + p);
        }
    }

    private static void clearDir(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> all = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(all::add);
            for (Path p : all) {
                if (!p.equals(dir)) Files.delete(p);
            }
        }
    }

    private static void copyTree(Path from, Path to) {
        try (Stream<Path> walk = Files.walk(from)) {
            List<Path> all = new ArrayList<>();
            walk.forEach(all::add);
            for (Path p : all) {
                Path dest = to.resolve(from.relativize(p).toString());
                if (Files.isDirectory(p)) {
                    Files.createDirectories(dest);
                } else {
                    Files.copy(p, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
        } catch (IOException e) {
            throw new VersionRegistryException("Backup of " + from + " failed", e);
        }
    }
}
