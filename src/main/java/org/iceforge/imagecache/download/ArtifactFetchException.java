package org.iceforge.imagecache.download;

public class ArtifactFetchException extends RuntimeException {
    public ArtifactFetchException(String message, Throwable cause) { super(message, cause); }
    public ArtifactFetchException(String message) { super(message); }
}
