package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.domain.model.Content;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

@Service
public class ExportAssetUseCase {

    private static final Logger log = LoggerFactory.getLogger(ExportAssetUseCase.class);

    private final AssetStorePort store;

    public ExportAssetUseCase(AssetStorePort store) {
        this.store = store;
    }

    public Content content(UUID id) {
        return store.loadContent(id).orElseThrow(() -> MediaNotFoundException.asset(id));
    }

    /** Writes the stored bytes unchanged to {@code output}, creating parent directories. */
    public Path exportAsset(UUID id, Path output) {
        Content c = content(id);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(output, c.bytes());
        } catch (IOException e) {
            throw new StorageException("Cannot export " + id + " to " + output, e);
        }
        log.info("Exported asset {} to {} ({} bytes)", id, output, c.bytes().length);
        return output;
    }
}
