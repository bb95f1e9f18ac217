package org.iceforge.imagecache.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * On-disk half of the cache. Layout:
 * <pre>
 *   {root}/{entityId}/{folder}/{filename}
 *   {root}/{entityId}/meta.json
 * </pre>
 * A non-empty regular file at the final path is the only definition of "cached". Downloads
 * are written to a sibling {@code *.part} file and moved into place once complete, so
 * {@code *.part} files are never reported as cached.
 */
public class DiskStore {
    private static final Logger logger = LoggerFactory.getLogger(DiskStore.class);

    public static final String PART_SUFFIX = ".part";

    private final Path root;

    public DiskStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        createRoot();
        int swept = sweepPartials();
        logger.info("Image cache directory set to: {} ({} stale partial file(s) removed)", this.root, swept);
    }

    public Path root() {
        return root;
    }

    public Path pathFor(CacheKey key) {
        Path p = entityDir(key.entityId());
        if (!key.folder().isEmpty()) {
            p = p.resolve(key.folder());
        }
        p = p.resolve(key.filename()).normalize();
        if (!p.startsWith(root)) {
            throw new IllegalArgumentException("Illegal key (path traversal): " + key);
        }
        return p;
    }

    public Path entityDir(String entityId) {
        Path p = root.resolve(entityId).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new IllegalArgumentException("Illegal entity id (path traversal): " + entityId);
        }
        return p;
    }

    public boolean isCached(CacheKey key) {
        return sizeIfCached(pathFor(key)).isPresent();
    }

    /**
     * Reads the artifact for {@code key}. A missing, empty or unreadable file is a miss.
     */
    public Optional<byte[]> read(CacheKey key) {
        Path p = pathFor(key);
        try {
            byte[] data = Files.readAllBytes(p);
            return data.length == 0 ? Optional.empty() : Optional.of(data);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Failed to read cache file: {}", p, e);
            return Optional.empty();
        }
    }

    /**
     * Creates a fresh, empty {@code *.part} file next to the final location of {@code key}.
     */
    public Path createPart(CacheKey key) throws IOException {
        Path dst = pathFor(key);
        Files.createDirectories(dst.getParent());
        return Files.createTempFile(dst.getParent(), key.filename() + ".", PART_SUFFIX);
    }

    /**
     * Moves a completed {@code *.part} file to the final location of {@code key}.
     */
    public Path commit(Path part, CacheKey key) throws IOException {
        Path dst = pathFor(key);
        try {
            Files.move(part, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, dst, StandardCopyOption.REPLACE_EXISTING);
        }
        return dst;
    }

    public void discard(Path part) {
        if (part == null) return;
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            logger.warn("Failed to delete partial download {}", part, e);
        }
    }

    /**
     * Names of the top-level entity directories currently on disk.
     */
    public List<String> entityIds() {
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path d : dirs) {
                out.add(d.getFileName().toString());
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            logger.warn("Failed to list cache directory {}", root, e);
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    /**
     * Cached artifacts of one entity grouped by folder. Partial downloads and the sidecar are
     * left out. Folders and files are sorted by name.
     */
    public Map<String, List<CachedFile>> listEntity(String entityId) {
        Map<String, List<CachedFile>> out = new TreeMap<>();
        Path dir = entityDir(entityId);
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> folders = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path folder : folders) {
                List<CachedFile> files = new ArrayList<>();
                try (Stream<Path> s = Files.list(folder)) {
                    s.filter(p -> !isPart(p)).forEach(p -> sizeIfCached(p).ifPresent(size ->
                            files.add(new CachedFile(p.getFileName().toString(), p, size))));
                }
                if (!files.isEmpty()) {
                    files.sort(Comparator.comparing(CachedFile::filename));
                    out.put(folder.getFileName().toString(), List.copyOf(files));
                }
            }
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to list cached files for entity {}", entityId, e);
        }
        return out;
    }

    /**
     * Recursively deletes one entity directory.
     *
     * @return false if anything could not be deleted; the failure is logged
     */
    public boolean deleteEntity(String entityId) {
        Path dir = entityDir(entityId);
        try {
            deleteRecursively(dir);
            return true;
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to delete cache directory for entity {}: {}", entityId, dir, e);
            return false;
        }
    }

    /**
     * Deletes the whole cache root and recreates it empty.
     */
    public void deleteAll() {
        try {
            deleteRecursively(root);
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to fully delete cache directory {}", root, e);
        }
        createRoot();
    }

    /**
     * Deletes every {@code *.part} file under the root.
     *
     * @return how many were removed
     */
    public int sweepPartials() {
        int removed = 0;
        try (Stream<Path> s = Files.walk(root)) {
            List<Path> parts = s.filter(Files::isRegularFile).filter(DiskStore::isPart).toList();
            for (Path p : parts) {
                if (Files.deleteIfExists(p)) {
                    removed++;
                }
            }
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to sweep partial downloads under {}", root, e);
        }
        return removed;
    }

    public DiskUsage usage() {
        List<String> entities = entityIds();
        long files = 0;
        long bytes = 0;
        for (String entityId : entities) {
            try (Stream<Path> s = Files.walk(entityDir(entityId))) {
                List<Path> candidates = s.filter(Files::isRegularFile).filter(p -> !isPart(p)).toList();
                for (Path p : candidates) {
                    Optional<Long> size = sizeIfCached(p);
                    if (size.isPresent()) {
                        files++;
                        bytes += size.get();
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                // Directory vanished or became unreadable mid-walk; count what we saw.
                logger.debug("Failed to walk cache directory for entity {}", entityId, e);
            }
        }
        return new DiskUsage(entities.size(), files, bytes);
    }

    public record DiskUsage(int entityCount, long fileCount, long totalBytes) {}

    static boolean isPart(Path p) {
        return p.getFileName().toString().endsWith(PART_SUFFIX);
    }

    private static Optional<Long> sizeIfCached(Path p) {
        try {
            if (!Files.isRegularFile(p)) return Optional.empty();
            long size = Files.size(p);
            return size > 0 ? Optional.of(size) : Optional.empty();
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private void createRoot() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cache directory: " + root, e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> s = Files.walk(dir)) {
            List<Path> paths = s.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }
}
