package org.iceforge.imagecache.cache;

import java.nio.file.Path;

public record CachedFile(String filename, Path path, long sizeBytes) {}
