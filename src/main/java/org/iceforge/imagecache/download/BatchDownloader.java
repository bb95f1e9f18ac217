package org.iceforge.imagecache.download;

import org.iceforge.imagecache.cache.DiskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Drains one task list at a time into the {@link DiskStore}.
 * <p>
 * Tasks run strictly in order on a background thread. A task whose file already exists is
 * reported available without a network call. Cancellation is cooperative and checked between
 * tasks and between body chunks. Starting a new batch cancels the running one, waits up to
 * {@code stopWait} for it to finish and then interrupts it.
 */
public class BatchDownloader {
    private static final Logger logger = LoggerFactory.getLogger(BatchDownloader.class);

    private enum Outcome { AVAILABLE, FAILED, CANCELLED }

    private final DiskStore disk;
    private final ArtifactFetcher fetcher;
    private final ExecutorService executor;
    private final Duration stopWait;

    private final Object startLock = new Object();
    private final AtomicLong batchIds = new AtomicLong();
    private volatile BatchRun current;
    private volatile boolean shutdown;

    public BatchDownloader(DiskStore disk, ArtifactFetcher fetcher, ExecutorService executor, Duration stopWait) {
        this.disk = Objects.requireNonNull(disk);
        this.fetcher = Objects.requireNonNull(fetcher);
        this.executor = Objects.requireNonNull(executor);
        this.stopWait = Objects.requireNonNull(stopWait);
    }

    /**
     * Starts a batch, superseding any batch still running.
     *
     * @return false only if the batch could not be scheduled; fetch failures are reported
     * through the listener
     */
    public boolean start(List<DownloadTask> tasks, BatchListener listener) {
        Objects.requireNonNull(tasks, "tasks");
        synchronized (startLock) {
            if (shutdown) {
                logger.warn("Batch rejected: downloader is shut down");
                return false;
            }
            supersede(current);

            BatchRun run = new BatchRun(batchIds.incrementAndGet(), List.copyOf(tasks),
                    listener == null ? BatchListener.NOOP : listener);
            try {
                run.future = executor.submit(run);
            } catch (RejectedExecutionException e) {
                logger.error("Batch {} could not be scheduled", run.id, e);
                return false;
            }
            current = run;
            return true;
        }
    }

    /** Requests cancellation of the running batch, if any. Does not wait. */
    public void stop() {
        BatchRun run = current;
        if (run != null) {
            run.cancel();
        }
    }

    public boolean isRunning() {
        BatchRun run = current;
        return run != null && !run.isFinished();
    }

    /**
     * Waits for the current batch to finish (completed, cancelled or failed).
     *
     * @return true if no batch is running when this returns
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        BatchRun run = current;
        return run == null || run.await(timeout);
    }

    /**
     * Entity ids that still have unprocessed tasks in the running batch, including the one
     * being fetched right now.
     */
    public Set<String> inFlightEntityIds() {
        BatchRun run = current;
        if (run == null || run.isFinished()) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        List<DownloadTask> pending = run.tasks.subList(Math.min(run.position.get(), run.tasks.size()), run.tasks.size());
        for (DownloadTask t : pending) {
            out.add(t.key().entityId());
        }
        return out;
    }

    /**
     * Cancels the running batch (bounded wait, then interrupt).
     */
    public void cancelAndWait() {
        synchronized (startLock) {
            supersede(current);
        }
    }

    /**
     * Cancels any running batch and releases the worker threads. Further starts are rejected.
     */
    public void shutdown() {
        synchronized (startLock) {
            if (shutdown) return;
            shutdown = true;
            supersede(current);
        }
        executor.shutdownNow();
        logger.info("Batch downloader shut down");
    }

    private void supersede(BatchRun run) {
        if (run == null || run.isFinished()) {
            return;
        }
        run.cancel();
        boolean stopped;
        try {
            stopped = run.await(stopWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = false;
        }
        if (stopped) {
            return;
        }
        logger.warn("Batch {} did not stop within {}; interrupting it", run.id, stopWait);
        Future<?> f = run.future;
        if (f != null) {
            f.cancel(true);
        }
        try {
            if (!run.await(stopWait)) {
                logger.warn("Batch {} is still running after interrupt; continuing without it", run.id);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class BatchRun implements Runnable {
        private final long id;
        private final List<DownloadTask> tasks;
        private final BatchListener listener;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicInteger position = new AtomicInteger(0);
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile Future<?> future;

        private BatchRun(long id, List<DownloadTask> tasks, BatchListener listener) {
            this.id = id;
            this.tasks = tasks;
            this.listener = listener;
        }

        void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                logger.info("Batch {} cancellation requested", id);
            }
        }

        boolean isCancelled() {
            return cancelled.get() || Thread.currentThread().isInterrupted();
        }

        boolean isFinished() {
            return finished.getCount() == 0;
        }

        boolean await(Duration timeout) throws InterruptedException {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void run() {
            int total = tasks.size();
            int done = 0;
            int failed = 0;
            logger.info("Batch {} started: {} task(s)", id, total);
            try {
                for (DownloadTask task : tasks) {
                    if (isCancelled()) {
                        logger.info("Batch {} cancelled after {}/{} task(s)", id, done, total);
                        return;
                    }
                    Outcome outcome = fetchOne(task);
                    if (outcome == Outcome.CANCELLED) {
                        logger.info("Batch {} cancelled during {} after {}/{} task(s)", id, task.key(), done, total);
                        return;
                    }
                    if (outcome == Outcome.FAILED) {
                        failed++;
                    }
                    done++;
                    position.set(done);
                    final int progress = done;
                    notify("onProgress", () -> listener.onProgress(progress, total));
                }
                if (isCancelled()) {
                    logger.info("Batch {} cancelled after {}/{} task(s)", id, done, total);
                    return;
                }
                logger.info("Batch {} finished: {}/{} task(s), {} failed", id, done, total, failed);
                notify("onDone", listener::onDone);
            } catch (RuntimeException e) {
                if (isCancelled()) {
                    logger.debug("Batch {} stopped while cancelling", id, e);
                    return;
                }
                logger.error("Batch {} failed after {}/{} task(s)", id, done, total, e);
                String message = "Batch download failed: " + e;
                notify("onError", () -> listener.onError(message));
            } finally {
                position.set(total);
                finished.countDown();
            }
        }

        private Outcome fetchOne(DownloadTask task) {
            if (disk.isCached(task.key())) {
                Path path = disk.pathFor(task.key());
                logger.debug("Already cached: {}", task.key());
                notify("onItemAvailable", () -> listener.onItemAvailable(task, path));
                return Outcome.AVAILABLE;
            }

            Path part = null;
            try {
                part = disk.createPart(task.key());
                long written = 0;
                try (Stream<byte[]> body = fetcher.open(task.sourceUrl());
                     OutputStream out = Files.newOutputStream(part, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    Iterator<byte[]> chunks = body.iterator();
                    while (chunks.hasNext()) {
                        byte[] chunk = chunks.next();
                        if (isCancelled()) {
                            disk.discard(part);
                            return Outcome.CANCELLED;
                        }
                        out.write(chunk);
                        written += chunk.length;
                    }
                }
                if (written == 0) {
                    throw new ArtifactFetchException("Empty body");
                }
                Path path = disk.commit(part, task.key());
                logger.debug("Downloaded {} ({} bytes)", task.key(), written);
                notify("onItemAvailable", () -> listener.onItemAvailable(task, path));
                return Outcome.AVAILABLE;
            } catch (ArtifactFetchException | IOException e) {
                disk.discard(part);
                if (isCancelled()) {
                    return Outcome.CANCELLED;
                }
                if (task.isExpired(Instant.now())) {
                    logger.warn("Skipping {}: {} (source url expired at {})", task.key(), e.getMessage(), task.expiresHint());
                } else {
                    logger.warn("Skipping {}: {}", task.key(), e.getMessage());
                }
                notify("onItemFailed", () -> listener.onItemFailed(task, e));
                return Outcome.FAILED;
            } catch (RuntimeException e) {
                disk.discard(part);
                throw e;
            }
        }

        private void notify(String callback, Runnable r) {
            try {
                r.run();
            } catch (RuntimeException e) {
                logger.warn("Batch {} listener {} threw", id, callback, e);
            }
        }
    }
}
