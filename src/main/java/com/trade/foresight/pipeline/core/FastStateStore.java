package com.trade.foresight.pipeline.core;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * A tiny abstraction over a fast key-value store with TTL semantics, shared
 * by every pipeline process. Holds control states and job claims.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - TTL of null or non-positive means "no expiry".
 *  - setIfAbsent(...) is atomic across the processes sharing the backend.
 *  - keys(prefix) returns keys without the store's own namespace prefix.
 */
public interface FastStateStore {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    // Atomic "set if absent" with TTL (job claims)
    boolean setIfAbsent(String key, String value, Duration ttl);

    Set<String> keys(String prefix);
}
