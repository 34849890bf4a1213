package com.trade.foresight.pipeline.service.store;

import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.common.TransientErrors;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.StoreWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Splits a write into chunks of at most {@code batchLimit} items. A chunk
 * rejected for quota reasons is retried exactly once after {@code quotaBackoff};
 * any other failure, or a second quota failure, is raised as StoreWriteException.
 * Chunks already written stay written.
 */
@Slf4j
@Component
public class ChunkedBatchWriter {

    private final int batchLimit;
    private final Duration quotaBackoff;
    private final Sleeper sleeper;

    @Autowired
    public ChunkedBatchWriter(ForesightProperties props, Sleeper sleeper) {
        this(props.getStore().getBatchLimit(), props.getStore().getQuotaBackoff(), sleeper);
    }

    public ChunkedBatchWriter(int batchLimit, Duration quotaBackoff, Sleeper sleeper) {
        if (batchLimit <= 0) throw new IllegalArgumentException("batchLimit must be positive");
        this.batchLimit = batchLimit;
        this.quotaBackoff = quotaBackoff;
        this.sleeper = sleeper;
    }

    public int getBatchLimit() {
        return batchLimit;
    }

    /**
     * @return number of chunks written
     */
    public <T> int write(String label, List<T> items, Consumer<List<T>> chunkWriter) {
        if (items == null || items.isEmpty()) return 0;
        int chunks = 0;
        for (int from = 0; from < items.size(); from += batchLimit) {
            List<T> chunk = items.subList(from, Math.min(from + batchLimit, items.size()));
            writeChunk(label, from, chunk, chunkWriter);
            chunks++;
        }
        log.debug("{}: wrote {} items in {} chunks", label, items.size(), chunks);
        return chunks;
    }

    private <T> void writeChunk(String label, int offset, List<T> chunk, Consumer<List<T>> chunkWriter) {
        try {
            chunkWriter.accept(chunk);
            return;
        } catch (RuntimeException first) {
            if (!TransientErrors.isQuota(first)) {
                throw asStoreError(label, offset, first, false);
            }
            log.warn("{}: quota hit at offset {}, sleeping {}s before a single retry",
                    label, offset, quotaBackoff.getSeconds());
        }
        try {
            sleeper.sleep(quotaBackoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreWriteException(label + ": interrupted during quota backoff", ie, true);
        }
        try {
            chunkWriter.accept(chunk);
        } catch (RuntimeException second) {
            throw asStoreError(label, offset, second, TransientErrors.isQuota(second));
        }
    }

    private static StoreWriteException asStoreError(String label, int offset, RuntimeException e, boolean quota) {
        if (e instanceof StoreWriteException) return (StoreWriteException) e;
        return new StoreWriteException(label + ": chunk at offset " + offset + " failed: " + e.getMessage(), e, quota);
    }
}
