package org.learningjava.mediadb.domain.exception;

/** Wraps I/O and SQL failures of the store. */
public class StorageException extends MediaDbException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
