package org.learningjava.mediadb.infrastructure.adapter.out.backup;

import org.learningjava.mediadb.application.port.BackupPort;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.domain.model.BackupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Full, non-incremental directory copy. The destination is removed first, so a failure midway
 * leaves a partial mirror.
 */
@Component
public class DirectoryMirrorAdapter implements BackupPort {

    private static final Logger log = LoggerFactory.getLogger(DirectoryMirrorAdapter.class);

    @Override
    public BackupReport mirror(Path source, Path destination) {
        Path src = source.toAbsolutePath().normalize();
        Path dest = destination.toAbsolutePath().normalize();
        if (dest.startsWith(src)) {
            throw new IllegalArgumentException("Backup destination must not be inside the store: " + dest);
        }
        try {
            deleteRecursively(dest);
            CopyVisitor visitor = new CopyVisitor(src, dest);
            Files.walkFileTree(src, visitor);
            log.info("Mirrored {} -> {} ({} files, {} bytes)", src, dest, visitor.files, visitor.bytes);
            return new BackupReport(dest, visitor.files, visitor.bytes);
        } catch (IOException e) {
            throw new StorageException("Backup to " + dest + " failed", e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> s = Files.walk(dir)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static final class CopyVisitor extends SimpleFileVisitor<Path> {
        private final Path src;
        private final Path dest;
        int files;
        long bytes;

        CopyVisitor(Path src, Path dest) {
            this.src = src;
            this.dest = dest;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
            Files.createDirectories(dest.resolve(src.relativize(dir)));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            Files.copy(file, dest.resolve(src.relativize(file)), StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.COPY_ATTRIBUTES);
            files++;
            bytes += attrs.size();
            return FileVisitResult.CONTINUE;
        }
    }
}
