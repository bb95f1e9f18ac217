package org.iceforge.imagecache.download;

import java.util.stream.Stream;

@FunctionalInterface
public interface ArtifactFetcher {

    /**
     * Opens a streaming GET of {@code sourceUrl}. Chunks are produced lazily as they arrive and
     * closing the stream abandons the transfer. Transport and HTTP failures surface as
     * {@link ArtifactFetchException}, either from this call or while iterating.
     */
    Stream<byte[]> open(String sourceUrl);
}
