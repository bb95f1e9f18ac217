package org.iceforge.imagecache.cache;

/**
 * Identity of one cached artifact. Maps to {@code {root}/{entityId}/{folder}/{filename}} on disk.
 * <p>
 * An empty folder addresses the entity root; the {@code meta.json} sidecar is keyed that way.
 */
public record CacheKey(String entityId, String folder, String filename) {

    public static final String SIDECAR_FILENAME = "meta.json";

    public CacheKey {
        entityId = segment("entityId", entityId, false);
        folder = segment("folder", folder == null ? "" : folder, true);
        filename = segment("filename", filename, false);
        if (filename.endsWith(DiskStore.PART_SUFFIX)) {
            throw new IllegalArgumentException("filename collides with in-flight download suffix: " + filename);
        }
    }

    public static CacheKey of(String entityId, String folder, String filename) {
        return new CacheKey(entityId, folder, filename);
    }

    public static CacheKey sidecar(String entityId) {
        return new CacheKey(entityId, "", SIDECAR_FILENAME);
    }

    public boolean isSidecar() {
        return folder.isEmpty() && SIDECAR_FILENAME.equals(filename);
    }

    @Override
    public String toString() {
        return folder.isEmpty() ? entityId + "/" + filename : entityId + "/" + folder + "/" + filename;
    }

    private static String segment(String name, String value, boolean allowEmpty) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.isEmpty() && allowEmpty) {
            return value;
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " is blank");
        }
        // Each component becomes exactly one path segment under the cache root.
        if (value.equals(".") || value.equals("..")
                || value.indexOf('/') >= 0 || value.indexOf('\\') >= 0 || value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Illegal " + name + " (path traversal): " + value);
        }
        return value;
    }
}
