package org.learningjava.mediadb.domain.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Bulk import of a directory. Shared tags apply to every file; with {@code inferFromFilenames}
 * they are merged with what the filename reveals.
 */
public record DirectoryImportRequest(
        Path directory,
        String source,
        boolean recursive,
        String contentType,
        Set<String> subjects,
        Set<String> styleTags,
        boolean skipExisting,
        boolean inferFromFilenames
) {
    public DirectoryImportRequest {
        Objects.requireNonNull(directory, "directory");
        subjects = Classification.copyOf(subjects);
        styleTags = Classification.copyOf(styleTags);
    }

    public static DirectoryImportRequest of(Path directory, String source) {
        return new DirectoryImportRequest(directory, source, true, null, Set.of(), Set.of(), false, false);
    }
}
