package org.iceforge.imagecache.download;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Callbacks from a running batch. All of them are invoked on the download worker thread.
 * <p>
 * A cancelled batch calls neither {@link #onDone()} nor {@link #onError(String)}.
 */
public interface BatchListener {

    BatchListener NOOP = new BatchListener() {};

    /** The artifact is on disk, either freshly downloaded or already present. */
    default void onItemAvailable(DownloadTask task, Path path) {}

    /** The artifact could not be fetched; the batch carries on with the next task. */
    default void onItemFailed(DownloadTask task, Exception cause) {}

    /** {@code done} runs 1..total in task order. */
    default void onProgress(int done, int total) {}

    default void onDone() {}

    /** The batch aborted on an unexpected failure. */
    default void onError(String message) {}

    @FunctionalInterface
    interface Progress {
        void update(int done, int total);
    }

    static BatchListener of(Progress onProgress, Runnable onDone, Consumer<String> onError) {
        Objects.requireNonNull(onProgress, "onProgress");
        Objects.requireNonNull(onDone, "onDone");
        Objects.requireNonNull(onError, "onError");
        return new BatchListener() {
            @Override
            public void onProgress(int done, int total) {
                onProgress.update(done, total);
            }

            @Override
            public void onDone() {
                onDone.run();
            }

            @Override
            public void onError(String message) {
                onError.accept(message);
            }
        };
    }
}
