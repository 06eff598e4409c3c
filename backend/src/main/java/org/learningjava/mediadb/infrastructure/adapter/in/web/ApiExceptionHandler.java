package org.learningjava.mediadb.infrastructure.adapter.in.web;

import org.learningjava.mediadb.domain.exception.ExternalServiceException;
import org.learningjava.mediadb.domain.exception.InvalidMediaException;
import org.learningjava.mediadb.domain.exception.MediaDbException;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps store failures to HTTP statuses with a {@code {"error","detail"}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MediaNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(MediaNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", detail);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> malformed(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage());
    }

    @ExceptionHandler(InvalidMediaException.class)
    public ResponseEntity<ErrorResponse> invalidMedia(InvalidMediaException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_media", e.getMessage());
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> external(ExternalServiceException e) {
        log.warn("External service failure: {}", e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "external_service_failure", e.getMessage());
    }

    @ExceptionHandler(MediaDbException.class)
    public ResponseEntity<ErrorResponse> storage(MediaDbException e) {
        log.error("Store failure: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "io_failure", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, detail));
    }
}
