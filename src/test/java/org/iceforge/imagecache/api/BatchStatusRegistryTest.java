package org.iceforge.imagecache.api;

import org.iceforge.imagecache.download.DownloadTask;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchStatusRegistryTest {

    @Test
    void current_isEmpty_beforeAnyBatch() {
        BatchStatusRegistry registry = new BatchStatusRegistry();
        assertTrue(registry.current().isEmpty());
        assertTrue(registry.cancelCurrent().isEmpty());
    }

    @Test
    void entry_tracksProgressFailuresAndCompletion() {
        BatchStatusRegistry registry = new BatchStatusRegistry();
        BatchStatusRegistry.Entry e = registry.begin(3);

        e.onProgress(1, 3);
        e.onItemFailed(DownloadTask.of("p1", "detail", "a.jpg", "https://x/a"), new RuntimeException("404"));
        e.onProgress(2, 3);
        e.onProgress(3, 3);
        e.onDone();

        CacheApiModels.BatchStatusResponse r = e.toResponse();
        assertEquals(CacheApiModels.BatchState.DONE, r.state());
        assertEquals(3, r.done());
        assertEquals(1, r.failed());
        assertEquals(3, r.total());
        assertNull(r.message());
    }

    @Test
    void terminalState_isNotOverwritten() {
        BatchStatusRegistry registry = new BatchStatusRegistry();
        BatchStatusRegistry.Entry e = registry.begin(2);

        registry.cancelCurrent();
        e.onError("late failure");
        e.onDone();

        assertEquals(CacheApiModels.BatchState.CANCELLED, e.state());
        assertNull(e.message());
    }

    @Test
    void begin_supersedesRunningBatch() {
        BatchStatusRegistry registry = new BatchStatusRegistry();
        BatchStatusRegistry.Entry first = registry.begin(5);
        BatchStatusRegistry.Entry second = registry.begin(1);

        assertEquals(CacheApiModels.BatchState.CANCELLED, first.state());
        assertEquals(CacheApiModels.BatchState.RUNNING, second.state());
        assertSame(second, registry.current().orElseThrow());
        assertTrue(second.batchId() > first.batchId());
    }

    @Test
    void onError_recordsMessage() {
        BatchStatusRegistry.Entry e = new BatchStatusRegistry().begin(1);
        e.onError("Batch download failed: boom");

        assertEquals(CacheApiModels.BatchState.FAILED, e.state());
        assertEquals("Batch download failed: boom", e.message());
    }
}
