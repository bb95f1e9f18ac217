package org.iceforge.imagecache.aws.s3;

/** An S3 call failed for a reason other than the object not existing. */
public class S3AccessException extends RuntimeException {
    public S3AccessException(String message, Throwable cause) { super(message, cause); }
    public S3AccessException(String message) { super(message); }
}
