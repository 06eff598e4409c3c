package org.learningjava.mediadb.domain.exception;

/** The bytes could not be decoded as the declared media type. */
public class InvalidMediaException extends MediaDbException {
    public InvalidMediaException(String message) {
        super(message);
    }

    public InvalidMediaException(String message, Throwable cause) {
        super(message, cause);
    }
}
