package com.trade.foresight.pipeline.core;

import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Control records and job claims in Redis. Every key is stored under the
 * namespace prefix ({@code fs:} by default) so several pipelines can share
 * one Redis database.
 */
public final class RedisFastStateStore implements FastStateStore {

    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redis;
    private final String namespace;

    public RedisFastStateStore(StringRedisTemplate redis, String namespace) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.namespace = namespace == null ? "" : namespace;
    }

    private String ns(String key) {
        return namespace + key;
    }

    private static boolean expires(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (expires(ttl)) {
            redis.opsForValue().set(ns(key), value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            return;
        }
        redis.opsForValue().set(ns(key), value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(ns(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(ns(key));
    }

    /** SET NX, with PX when a ttl is given. */
    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean claimed = expires(ttl)
                ? redis.opsForValue().setIfAbsent(ns(key), value, ttl.toMillis(), TimeUnit.MILLISECONDS)
                : redis.opsForValue().setIfAbsent(ns(key), value);
        return Boolean.TRUE.equals(claimed);
    }

    /** SCAN rather than KEYS; the result is sorted and stripped of the namespace. */
    @Override
    public Set<String> keys(String keyPrefix) {
        ScanOptions match = ScanOptions.scanOptions()
                .match(ns(keyPrefix == null ? "" : keyPrefix) + "*")
                .count(SCAN_BATCH)
                .build();
        Set<String> found = new TreeSet<>();
        try (Cursor<String> cursor = redis.scan(match)) {
            cursor.forEachRemaining(k -> found.add(k.substring(namespace.length())));
        }
        return found;
    }
}
