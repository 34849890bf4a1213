package com.trade.foresight.pipeline.service.jobs;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.JobDescriptorException;
import com.trade.foresight.pipeline.enums.JobKind;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.JobDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a job file into a {@link JobDescriptor}. Routing comes from the file
 * name ({@code BTCUSDT_lightgbm_v1.sh}, {@code ALL_producer_main.sh}); the
 * command line in the file is only read for its options and is never executed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDescriptorParser {

    public static final String SUFFIX = ".sh";

    private final ForesightProperties props;

    public static boolean isJobFile(Path file) {
        return file.getFileName() != null && file.getFileName().toString().endsWith(SUFFIX);
    }

    public JobDescriptor parse(Path file) {
        String name = file.getFileName().toString();
        if (!name.endsWith(SUFFIX)) {
            throw new JobDescriptorException("Not a job file: " + name);
        }
        String[] parts = name.substring(0, name.length() - SUFFIX.length()).split("_");
        if (parts.length < 3) {
            throw new JobDescriptorException("Invalid job file name: " + name);
        }

        String command;
        long modified;
        try {
            command = commandOf(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            modified = Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            throw new JobDescriptorException("Cannot read job file " + name, e);
        }
        Map<String, String> opts = options(command);

        final JobKind kind;
        final ControlEntity entity;
        final String marketSymbol;
        if (ControlEntity.PRODUCER_MODEL.equalsIgnoreCase(parts[1])) {
            kind = JobKind.PRODUCER;
            entity = ControlEntity.producer();
            marketSymbol = opts.getOrDefault("symbol", props.getSymbols().get(0)).toUpperCase(Locale.ROOT);
        } else {
            kind = JobKind.CONSUMER;
            try {
                entity = ControlEntity.of(parts[0], parts[1], parts[2]);
            } catch (IllegalArgumentException e) {
                throw new JobDescriptorException("Invalid job file name: " + name, e);
            }
            if (!entity.isConsumer()) {
                throw new JobDescriptorException("Not a dispatchable job: " + name);
            }
            marketSymbol = entity.getSymbol();
            warnOnMismatch(name, "crypto", opts, entity.getSymbol());
            warnOnMismatch(name, "model", opts, entity.getModel());
            warnOnMismatch(name, "version", opts, entity.getVersion());
        }

        return JobDescriptor.builder()
                .kind(kind)
                .entity(entity)
                .marketSymbol(marketSymbol)
                .jobId(kind.getCommand() + ":" + entity.key() + ":" + digest(command + "@" + modified))
                .source(file)
                .build();
    }

    /** The file content without shebang, comments and blank lines. */
    static String commandOf(String content) {
        StringBuilder sb = new StringBuilder();
        for (String line : content.split("\\R")) {
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(t);
        }
        return sb.toString();
    }

    /** --key value and --key=value pairs. */
    static Map<String, String> options(String command) {
        Map<String, String> out = new HashMap<>();
        String[] tok = command.trim().isEmpty() ? new String[0] : command.trim().split("\\s+");
        for (int i = 0; i < tok.length; i++) {
            if (!tok[i].startsWith("--")) continue;
            String k = tok[i].substring(2);
            int eq = k.indexOf('=');
            if (eq >= 0) {
                out.put(k.substring(0, eq).toLowerCase(Locale.ROOT), k.substring(eq + 1));
            } else if (i + 1 < tok.length && !tok[i + 1].startsWith("--")) {
                out.put(k.toLowerCase(Locale.ROOT), tok[++i]);
            }
        }
        return out;
    }

    private static void warnOnMismatch(String file, String key, Map<String, String> opts, String expected) {
        String v = opts.get(key);
        if (v != null && !v.equalsIgnoreCase(expected)) {
            log.warn("Job file {} says --{} {} but its name says {}; using the name", file, key, v, expected);
        }
    }

    private static String digest(String s) {
        try {
            byte[] h = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 8; i++) sb.append(String.format("%02x", h[i]));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
