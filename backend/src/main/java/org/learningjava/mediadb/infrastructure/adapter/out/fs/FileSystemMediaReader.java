package org.learningjava.mediadb.infrastructure.adapter.out.fs;

import org.learningjava.mediadb.application.port.MediaFilePort;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.domain.service.MediaFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

@Component
public class FileSystemMediaReader implements MediaFilePort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemMediaReader.class);

    @Override
    public List<Path> discover(Path root, boolean recursive) {
        if (!Files.isDirectory(root)) throw MediaNotFoundException.file(root);
        try (Stream<Path> s = recursive ? Files.walk(root) : Files.list(root)) {
            List<Path> out = s.filter(Files::isRegularFile)
                    .filter(p -> MediaFormats.classify(p).isPresent())
                    .sorted()
                    .toList();
            if (out.isEmpty()) {
                log.warn("No media files found under: {}", root);
            } else {
                log.info("Discovered {} media files under {}", out.size(), root);
            }
            return out;
        } catch (IOException e) {
            throw new StorageException("Cannot list " + root, e);
        }
    }

    @Override
    public byte[] readAll(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw MediaNotFoundException.file(file);
        } catch (IOException e) {
            throw new StorageException("Cannot read " + file, e);
        }
    }
}
