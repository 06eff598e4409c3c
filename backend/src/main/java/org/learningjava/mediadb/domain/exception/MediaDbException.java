package org.learningjava.mediadb.domain.exception;

/** Base type of the store's failures. */
public class MediaDbException extends RuntimeException {
    public MediaDbException(String message) {
        super(message);
    }

    public MediaDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
