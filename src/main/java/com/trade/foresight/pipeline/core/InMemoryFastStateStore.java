package com.trade.foresight.pipeline.core;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of FastStateStore.
 * Single JVM only: used by tests and by single-process runs.
 */
public final class InMemoryFastStateStore implements FastStateStore {

    private static final class Entry {
        final String v;
        final long expAtMillis; // 0 = no expiry

        Entry(String v, Duration ttl, long now) {
            this.v = v;
            this.expAtMillis = (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0L : (now + ttl.toMillis());
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final String prefix;

    public InMemoryFastStateStore(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    private static boolean isExpired(Entry e, long now) {
        return e != null && e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        map.put(k(key), new Entry(value, ttl, now()));
    }

    @Override
    public Optional<String> get(String key) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null) return Optional.empty();
        if (isExpired(e, now())) {
            map.remove(kk, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.v);
    }

    @Override
    public void delete(String key) {
        map.remove(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        final String kk = k(key);
        for (; ; ) {
            final long n = now();
            final Entry existing = map.get(kk);
            final Entry fresh = new Entry(value, ttl, n);
            if (existing == null) {
                if (map.putIfAbsent(kk, fresh) == null) return true;
            } else if (isExpired(existing, n)) {
                if (map.replace(kk, existing, fresh)) return true;
            } else {
                return false;
            }
            // lost race; retry
        }
    }

    @Override
    public Set<String> keys(String keyPrefix) {
        final String full = k(keyPrefix == null ? "" : keyPrefix);
        final long n = now();
        Set<String> out = new TreeSet<>();
        map.forEach((kk, e) -> {
            if (kk.startsWith(full) && !isExpired(e, n)) {
                out.add(kk.substring(prefix.length()));
            }
        });
        return out;
    }
}
