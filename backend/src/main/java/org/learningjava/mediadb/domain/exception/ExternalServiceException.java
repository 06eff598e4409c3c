package org.learningjava.mediadb.domain.exception;

public class ExternalServiceException extends MediaDbException {
    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
