package org.learningjava.mediadb.domain.model;

import java.nio.file.Path;

public record BackupReport(Path destination, int files, long bytes) {
}
