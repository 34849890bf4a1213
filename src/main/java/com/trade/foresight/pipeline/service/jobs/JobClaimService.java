package com.trade.foresight.pipeline.service.jobs;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.core.FastStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * First claim of a job id wins; later claims within the TTL are refused.
 * Keeps a watcher event and the startup drain from spawning the same job twice.
 */
@Slf4j
@Service
public class JobClaimService {

    private static final String PREFIX = "jobclaim:";

    private final FastStateStore fastStateStore;
    private final Duration ttl;

    // Fallback when the shared store is unreachable
    private final ConcurrentMap<String, Long> inMemoryClaims = new ConcurrentHashMap<>();

    public JobClaimService(FastStateStore fastStateStore, ForesightProperties props) {
        this.fastStateStore = fastStateStore;
        this.ttl = props.getControl().getJobClaimTtl();
    }

    public boolean claim(String jobId) {
        try {
            return fastStateStore.setIfAbsent(PREFIX + jobId, "1", ttl);
        } catch (RuntimeException t) {
            log.warn("FastStateStore failed for job claim {}, falling back to in-memory", jobId, t);
        }

        long now = System.currentTimeMillis();
        long expiry = now + ttl.toMillis();
        Long existing = inMemoryClaims.putIfAbsent(jobId, expiry);
        if (existing == null) {
            return true;
        }
        if (existing < now) {
            return inMemoryClaims.replace(jobId, existing, expiry);
        }
        return false;
    }
}
