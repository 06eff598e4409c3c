package org.learningjava.mediadb.application.port;

import org.learningjava.mediadb.domain.model.BackupReport;

import java.nio.file.Path;

public interface BackupPort {
    /** Replaces {@code destination} with a full recursive copy of {@code source}. */
    BackupReport mirror(Path source, Path destination);
}
