package org.iceforge.imagecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.imagecache.download.BatchDownloader;
import org.iceforge.imagecache.download.DownloadTask;
import org.iceforge.imagecache.download.FakeArtifactFetcher;
import org.iceforge.imagecache.download.RecordingListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProductImageCacheTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path root;

    DiskStore disk;
    FakeArtifactFetcher fetcher;
    ProductImageCache cache;

    @BeforeEach
    void setUp() {
        disk = new DiskStore(root);
        fetcher = new FakeArtifactFetcher();
        BatchDownloader downloader = new BatchDownloader(disk, fetcher, Executors.newCachedThreadPool(), Duration.ofMillis(200));
        cache = new ProductImageCache(disk, downloader, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        cache.shutdown();
    }

    private DownloadTask task(String entity, String folder, String filename) {
        String url = "https://img.example.com/" + entity + "/" + folder + "/" + filename + "?X-Amz-Signature=s";
        fetcher.body(url, entity + ":" + folder + ":" + filename);
        return DownloadTask.of(entity, folder, filename, url);
    }

    private DownloadTask sidecarTask(String entity, String json) {
        String url = "https://img.example.com/" + entity + "/meta.json";
        fetcher.body(url, json);
        return new DownloadTask(CacheKey.sidecar(entity), url, null);
    }

    private void runBatch(List<DownloadTask> tasks) throws InterruptedException {
        assertTrue(cache.startBatch(tasks, new RecordingListener()));
        assertTrue(cache.awaitBatch(WAIT));
    }

    private void cacheEntities(String... entities) throws InterruptedException {
        List<DownloadTask> tasks = new ArrayList<>();
        for (String e : entities) {
            tasks.add(task(e, "detail", "a.jpg"));
        }
        runBatch(tasks);
        for (String e : entities) {
            assertTrue(cache.lookup(e, "detail", "a.jpg").isPresent());
        }
    }

    @Test
    void batchOfTwo_isServedFromCache_andCountsTwoFiles() throws Exception {
        runBatch(List.of(task("p1", "detail", "a.jpg"), task("p1", "detail", "b.jpg")));

        Optional<CachedArtifact> a = cache.lookup("p1", "detail", "a.jpg");
        Optional<CachedArtifact> b = cache.lookup("p1", "detail", "b.jpg");

        assertTrue(a.isPresent());
        assertTrue(b.isPresent());
        assertEquals("p1:detail:a.jpg", new String(a.get().data()));
        assertEquals(disk.pathFor(CacheKey.of("p1", "detail", "b.jpg")), b.get().path());
        assertEquals(2, cache.stats().fileCount());
        assertEquals(1, cache.stats().entityCount());
    }

    @Test
    void scopeOfOne_evictsTheOther() throws Exception {
        cacheEntities("p1", "p2");

        cache.setPageScope(Set.of("p1"));
        assertEquals(1, cache.evictOutsideScope());

        assertEquals(1, cache.stats().entityCount());
        assertEquals(List.of("p1"), disk.entityIds());
    }

    @Test
    void evictOutsideScope_removesFromDiskAndMemory_andLeavesScopeUntouched() throws Exception {
        cacheEntities("A", "B", "C");
        assertEquals(3, cache.stats().memoryEntryCount());

        cache.setPageScope(Set.of("A"));
        assertEquals(2, cache.evictOutsideScope());

        assertEquals(List.of("A"), disk.entityIds());
        assertEquals(1, cache.stats().memoryEntryCount());
        CacheKey a = CacheKey.of("A", "detail", "a.jpg");
        assertTrue(cache.entry(a).orElseThrow().inMemory());
        assertTrue(cache.entry(CacheKey.of("B", "detail", "a.jpg")).isEmpty());
        assertTrue(cache.lookup("B", "detail", "a.jpg").isEmpty());
        assertTrue(cache.lookup("C", "detail", "a.jpg").isEmpty());
        assertEquals("A:detail:a.jpg", new String(cache.lookup(a).orElseThrow().data()));
    }

    @Test
    void afterEviction_noMemoryEntryPointsAtDeletedFile() throws Exception {
        cacheEntities("A", "B", "C", "D");
        cache.setPageScope(List.of("B", "D"));
        cache.evictOutsideScope();

        for (String e : List.of("A", "B", "C", "D")) {
            CacheKey key = CacheKey.of(e, "detail", "a.jpg");
            boolean inMemory = cache.entry(key).map(CacheEntry::inMemory).orElse(false);
            if (inMemory) {
                assertTrue(Files.exists(disk.pathFor(key)), key.toString());
            }
        }
        assertEquals(2, cache.stats().memoryEntryCount());
    }

    @Test
    void emptyScope_evictsEverything() throws Exception {
        cacheEntities("A", "B");

        assertEquals(2, cache.evictOutsideScope());

        assertEquals(0, cache.stats().entityCount());
        assertEquals(0, cache.stats().memoryEntryCount());
    }

    @Test
    void companionMetadata_isParsedAndCached() throws Exception {
        runBatch(List.of(task("p1", "detail", "a.jpg"), sidecarTask("p1", "{\"name\":\"linen shirt\",\"price\":39000}")));

        JsonNode meta = cache.lookupCompanionMetadata("p1").orElseThrow();
        assertEquals("linen shirt", meta.get("name").asText());
        assertEquals(39000, meta.get("price").asInt());
        assertTrue(cache.entry(CacheKey.sidecar("p1")).orElseThrow().inMemory());

        // The sidecar is stored at the entity root and never listed as an image.
        assertEquals(Set.of("detail"), cache.listCached("p1").keySet());
    }

    @Test
    void companionMetadata_missingOrInvalid_isAMiss() throws Exception {
        runBatch(List.of(sidecarTask("bad", "{not json")));

        assertTrue(cache.lookupCompanionMetadata("bad").isEmpty());
        assertTrue(cache.lookupCompanionMetadata("nobody").isEmpty());
    }

    @Test
    void entryStates_followTheDownload() throws Exception {
        DownloadTask ok = task("p1", "detail", "a.jpg");
        DownloadTask broken = DownloadTask.of("p1", "detail", "gone.jpg", "https://img.example.com/gone");
        DownloadTask slow = task("p2", "detail", "a.jpg");
        CountDownLatch gate = fetcher.gate(slow.sourceUrl());

        assertTrue(cache.startBatch(List.of(ok, broken, slow), new RecordingListener()));
        assertTrue(fetcher.awaitOpened(slow.sourceUrl(), 5_000));

        assertEquals(CacheEntryState.CACHED, cache.entry(ok.key()).orElseThrow().state());
        assertEquals(CacheEntryState.FAILED, cache.entry(broken.key()).orElseThrow().state());
        assertEquals(CacheEntryState.DOWNLOADING, cache.entry(slow.key()).orElseThrow().state());
        assertTrue(cache.lookup(slow.key()).isEmpty());

        gate.countDown();
        assertTrue(cache.awaitBatch(WAIT));

        CacheEntry done = cache.entry(slow.key()).orElseThrow();
        assertEquals(CacheEntryState.CACHED, done.state());
        assertEquals(disk.pathFor(slow.key()), done.diskPath());
        assertEquals(Long.valueOf("p2:detail:a.jpg".length()), done.sizeBytes());
        assertFalse(done.inMemory());
    }

    @Test
    void fileAlreadyOnDisk_isFoundWithoutABatch() throws IOException {
        CacheKey key = CacheKey.of("p9", "summary", "s.jpg");
        Files.createDirectories(disk.pathFor(key).getParent());
        Files.writeString(disk.pathFor(key), "pre-existing");

        assertTrue(cache.isEntityCached("p9"));
        assertEquals("pre-existing", new String(cache.lookup(key).orElseThrow().data()));
        assertEquals(CacheEntryState.CACHED, cache.entry(key).orElseThrow().state());
        assertTrue(cache.entry(key).orElseThrow().inMemory());
    }

    @Test
    void hitAndMissCounters() throws Exception {
        runBatch(List.of(task("p1", "detail", "a.jpg")));

        cache.lookup("p1", "detail", "a.jpg");
        cache.lookup("p1", "detail", "a.jpg");
        cache.lookup("p1", "detail", "nope.jpg");

        assertEquals(2, cache.hits());
        assertEquals(1, cache.misses());
        assertEquals(2.0 / 3, cache.hitRatio(), 1e-9);
        assertEquals("p1:detail:a.jpg".length(), cache.bytesUsed());
    }

    @Test
    void explicitEvict_neverTouchesScopedEntities() throws Exception {
        cacheEntities("p1", "p2");
        cache.setPageScope(Set.of("p1"));

        assertEquals(1, cache.evict(List.of("p1", "p2")));

        assertEquals(List.of("p1"), disk.entityIds());
        assertTrue(cache.lookup("p1", "detail", "a.jpg").isPresent());
        assertFalse(cache.isEntityCached("p2"));
    }

    @Test
    void eviction_skipsEntitiesTheRunningBatchStillNeeds() throws Exception {
        cacheEntities("old");
        DownloadTask pending = task("incoming", "detail", "a.jpg");
        CountDownLatch gate = fetcher.gate(pending.sourceUrl());
        assertTrue(cache.startBatch(List.of(pending), new RecordingListener()));
        assertTrue(fetcher.awaitOpened(pending.sourceUrl(), 5_000));

        cache.setPageScope(Set.of("current"));
        assertEquals(1, cache.evictOutsideScope());
        assertEquals(0, cache.evict(List.of("incoming")));

        gate.countDown();
        assertTrue(cache.awaitBatch(WAIT));
        assertTrue(cache.lookup(pending.key()).isPresent());
        assertFalse(cache.isEntityCached("old"));
    }

    @Test
    void clearAll_cancelsBatch_andEmptiesEverything() throws Exception {
        cacheEntities("p1", "p2");
        cache.setPageScope(Set.of("p1"));
        DownloadTask stuck = task("p3", "detail", "a.jpg");
        fetcher.gate(stuck.sourceUrl());
        RecordingListener l = new RecordingListener();
        assertTrue(cache.startBatch(List.of(stuck), l));
        assertTrue(fetcher.awaitOpened(stuck.sourceUrl(), 5_000));

        cache.clearAll();

        assertFalse(cache.isBatchRunning());
        assertEquals(0, l.doneCalls.get());
        assertTrue(Files.isDirectory(root));
        assertEquals(new CacheStats(0, 0, 0, 0), cache.stats());
        assertTrue(cache.pageScope().isEmpty());
        assertTrue(cache.entry(CacheKey.of("p1", "detail", "a.jpg")).isEmpty());
        assertTrue(cache.lookup("p1", "detail", "a.jpg").isEmpty());
    }

    @Test
    void stopBatch_keepsWhatWasAlreadyDownloaded() throws Exception {
        DownloadTask first = task("p1", "detail", "a.jpg");
        DownloadTask second = task("p1", "detail", "b.jpg");
        CountDownLatch gate = fetcher.gate(second.sourceUrl());
        RecordingListener l = new RecordingListener();

        assertTrue(cache.startBatch(List.of(first, second), l));
        assertTrue(fetcher.awaitOpened(second.sourceUrl(), 5_000));
        cache.stopBatch();
        gate.countDown();
        assertTrue(cache.awaitBatch(WAIT));

        assertTrue(cache.lookup(first.key()).isPresent());
        assertTrue(cache.lookup(second.key()).isEmpty());
        assertEquals(List.of(1), l.progress);
        assertTrue(l.errors.isEmpty());
        assertEquals(0, l.doneCalls.get());
    }

    @Test
    void callbackOverload_reportsProgressAndDone() throws Exception {
        List<Integer> progress = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        assertTrue(cache.startBatch(List.of(task("p1", "detail", "a.jpg"), task("p1", "detail", "b.jpg")),
                (d, total) -> progress.add(d), done::countDown, msg -> fail(msg)));

        assertTrue(cache.awaitBatch(WAIT));
        assertEquals(0, done.getCount());
        assertEquals(List.of(1, 2), progress);
    }

    @Test
    void shutdown_isIdempotent_andRejectsNewBatches() {
        cache.shutdown();
        cache.shutdown();

        assertFalse(cache.startBatch(List.of(task("p1", "detail", "a.jpg")), new RecordingListener()));
        assertEquals(0, fetcher.totalCalls());
    }

    @Test
    void mutatingAReturnedHandle_doesNotChangeWhatLaterReadersSee() throws IOException {
        CacheKey key = CacheKey.of("p1", "detail", "a.jpg");
        Files.createDirectories(disk.pathFor(key).getParent());
        Files.writeString(disk.pathFor(key), "ORIGINAL");

        byte[] first = cache.lookup(key).orElseThrow().data();
        first[0] = 'X';
        cache.lookup(key).orElseThrow().data()[1] = 'Y';

        assertEquals("ORIGINAL", new String(cache.lookup(key).orElseThrow().data(), StandardCharsets.UTF_8));
        assertArrayEquals(Files.readAllBytes(disk.pathFor(key)), cache.lookup(key).orElseThrow().data());
    }

    @Test
    void entityThatCannotBeDeleted_isSkipped_andTheSweepContinues() throws Exception {
        DiskStore flaky = spy(new DiskStore(root));
        doReturn(false).when(flaky).deleteEntity("B");
        BatchDownloader downloader = new BatchDownloader(flaky, fetcher, Executors.newCachedThreadPool(), Duration.ofMillis(200));
        ProductImageCache sweeping = new ProductImageCache(flaky, downloader, new ObjectMapper());
        try {
            assertTrue(sweeping.startBatch(List.of(
                    task("A", "detail", "a.jpg"), task("B", "detail", "a.jpg"), task("C", "detail", "a.jpg")),
                    new RecordingListener()));
            assertTrue(sweeping.awaitBatch(WAIT));
            for (String e : List.of("A", "B", "C")) {
                assertTrue(sweeping.lookup(e, "detail", "a.jpg").isPresent());
            }

            sweeping.setPageScope(Set.of("A"));
            assertEquals(1, sweeping.evictOutsideScope());

            assertEquals(List.of("A", "B"), flaky.entityIds());
            verify(flaky).deleteEntity("C");
            assertTrue(sweeping.entry(CacheKey.of("B", "detail", "a.jpg")).isEmpty());
            assertEquals(1, sweeping.stats().memoryEntryCount());
        } finally {
            sweeping.shutdown();
        }
    }

    @Test
    void batchThatCannotBeScheduled_restoresPreviousEntryStates() throws Exception {
        ExecutorService pool = Executors.newCachedThreadPool();
        BatchDownloader downloader = new BatchDownloader(disk, fetcher, pool, Duration.ofMillis(200));
        ProductImageCache local = new ProductImageCache(disk, downloader, new ObjectMapper());
        DownloadTask broken = DownloadTask.of("p1", "detail", "gone.jpg", "https://img.example.com/gone");
        assertTrue(local.startBatch(List.of(broken), new RecordingListener()));
        assertTrue(local.awaitBatch(WAIT));
        assertEquals(CacheEntryState.FAILED, local.entry(broken.key()).orElseThrow().state());

        pool.shutdown();
        DownloadTask fresh = task("p2", "detail", "a.jpg");
        assertFalse(local.startBatch(List.of(fresh, broken), new RecordingListener()));

        assertTrue(local.entry(fresh.key()).isEmpty());
        assertEquals(CacheEntryState.FAILED, local.entry(broken.key()).orElseThrow().state());
        assertEquals(0, fetcher.calls(fresh.sourceUrl()));
        local.shutdown();
    }

    @Test
    void invalidEntityIds_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.setPageScope(Arrays.asList("p1", null)));
        assertThrows(IllegalArgumentException.class, () -> cache.setPageScope(List.of("../etc")));
        assertThrows(IllegalArgumentException.class, () -> cache.evict(List.of("a/b")));
        assertThrows(IllegalArgumentException.class, () -> cache.lookup("p1", "detail", ".."));
    }
}
