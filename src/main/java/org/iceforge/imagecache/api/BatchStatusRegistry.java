package org.iceforge.imagecache.api;

import org.iceforge.imagecache.download.BatchListener;
import org.iceforge.imagecache.download.DownloadTask;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Progress of the batch most recently started over HTTP. Only one batch runs at a time, so only
 * the latest entry is kept.
 */
@Component
public class BatchStatusRegistry {

    public static final class Entry implements BatchListener {
        private final long batchId;
        private final int total;
        private final Instant startedAt;
        private final AtomicInteger done = new AtomicInteger(0);
        private final AtomicInteger failed = new AtomicInteger(0);
        private volatile CacheApiModels.BatchState state = CacheApiModels.BatchState.RUNNING;
        private volatile Instant updatedAt;
        private volatile String message;

        private Entry(long batchId, int total) {
            this.batchId = batchId;
            this.total = total;
            this.startedAt = Instant.now();
            this.updatedAt = startedAt;
        }

        public long batchId() { return batchId; }
        public int total() { return total; }
        public int done() { return done.get(); }
        public int failed() { return failed.get(); }
        public CacheApiModels.BatchState state() { return state; }
        public String message() { return message; }

        @Override
        public void onItemFailed(DownloadTask task, Exception cause) {
            failed.incrementAndGet();
            updatedAt = Instant.now();
        }

        @Override
        public void onProgress(int done, int total) {
            this.done.set(done);
            updatedAt = Instant.now();
        }

        @Override
        public void onDone() {
            finish(CacheApiModels.BatchState.DONE, null);
        }

        @Override
        public void onError(String message) {
            finish(CacheApiModels.BatchState.FAILED, message);
        }

        void markCancelled() {
            finish(CacheApiModels.BatchState.CANCELLED, null);
        }

        // Terminal states are final; a late callback never overwrites them.
        private synchronized void finish(CacheApiModels.BatchState next, String message) {
            if (state != CacheApiModels.BatchState.RUNNING) {
                return;
            }
            this.state = next;
            this.message = message;
            this.updatedAt = Instant.now();
        }

        public CacheApiModels.BatchStatusResponse toResponse() {
            return new CacheApiModels.BatchStatusResponse(
                    batchId, state, done.get(), failed.get(), total, startedAt, updatedAt, message);
        }
    }

    private final AtomicLong ids = new AtomicLong();
    private final AtomicReference<Entry> current = new AtomicReference<>();

    /**
     * Registers a new batch. A still-running predecessor is marked cancelled, since starting a
     * batch supersedes it.
     */
    public Entry begin(int total) {
        Entry next = new Entry(ids.incrementAndGet(), total);
        Entry previous = current.getAndSet(next);
        if (previous != null) {
            previous.markCancelled();
        }
        return next;
    }

    public Optional<Entry> current() {
        return Optional.ofNullable(current.get());
    }

    /** Marks the current batch cancelled if it is still running. */
    public Optional<Entry> cancelCurrent() {
        Entry e = current.get();
        if (e != null) {
            e.markCancelled();
        }
        return Optional.ofNullable(e);
    }
}
