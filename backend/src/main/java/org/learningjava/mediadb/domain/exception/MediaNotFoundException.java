package org.learningjava.mediadb.domain.exception;

import java.nio.file.Path;
import java.util.UUID;

public class MediaNotFoundException extends MediaDbException {
    public MediaNotFoundException(String message) {
        super(message);
    }

    public static MediaNotFoundException asset(UUID id) {
        return new MediaNotFoundException("Asset not found: " + id);
    }

    public static MediaNotFoundException file(Path path) {
        return new MediaNotFoundException("File not found: " + path);
    }

    public static MediaNotFoundException project(UUID id) {
        return new MediaNotFoundException("Project not found: " + id);
    }
}
