package com.trade.foresight.pipeline.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * FastStateStore over a directory shared by every process on the host.
 * One JSON file per key: {"value": ..., "expires_at": epochMillis|0}.
 * <p>
 * put() writes a temp file and renames it over the target, so readers never
 * see a half-written record. setIfAbsent() relies on CREATE_NEW being atomic.
 */
@Slf4j
public final class FileFastStateStore implements FastStateStore {

    private static final String SUFFIX = ".json";

    private final Path dir;
    private final String prefix;
    private final ObjectMapper mapper;

    public FileFastStateStore(Path dir, String prefix, ObjectMapper mapper) {
        this.dir = dir;
        this.prefix = prefix == null ? "" : prefix;
        this.mapper = mapper;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create state dir " + dir, e);
        }
    }

    private Path file(String key) {
        return dir.resolve(URLEncoder.encode(prefix + key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private byte[] envelope(String value, Duration ttl) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("value", value);
        node.put("expires_at", (ttl == null || ttl.isZero() || ttl.isNegative())
                ? 0L : System.currentTimeMillis() + ttl.toMillis());
        return mapper.writeValueAsBytes(node);
    }

    /** Empty when the file is missing, expired or unreadable. */
    private Optional<String> readLive(Path f) {
        try {
            byte[] raw = Files.readAllBytes(f);
            ObjectNode node = (ObjectNode) mapper.readTree(raw);
            long exp = node.path("expires_at").asLong(0L);
            if (exp > 0 && System.currentTimeMillis() >= exp) {
                Files.deleteIfExists(f);
                return Optional.empty();
            }
            return node.hasNonNull("value") ? Optional.of(node.get("value").asText()) : Optional.empty();
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | ClassCastException e) {
            log.warn("Unreadable state file {}: {}", f.getFileName(), e.toString());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Path target = file(key);
        try {
            Path tmp = Files.createTempFile(dir, ".put-", ".tmp");
            Files.write(tmp, envelope(value, ttl));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write state " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return readLive(file(key));
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(file(key));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete state " + key, e);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Path target = file(key);
        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                Files.write(target, envelope(value, ttl), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return true;
            } catch (FileAlreadyExistsException e) {
                // readLive removes an expired record, which frees the name for the second attempt
                if (readLive(target).isPresent()) return false;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot claim state " + key, e);
            }
        }
        return false;
    }

    @Override
    public Set<String> keys(String keyPrefix) {
        final String full = prefix + (keyPrefix == null ? "" : keyPrefix);
        Set<String> out = new TreeSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path f : files) {
                String name = f.getFileName().toString();
                String decoded = URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
                if (decoded.startsWith(full) && readLive(f).isPresent()) {
                    out.add(decoded.substring(prefix.length()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list state dir " + dir, e);
        }
        return out;
    }
}
