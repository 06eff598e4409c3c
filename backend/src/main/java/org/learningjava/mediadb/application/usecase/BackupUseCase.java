package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.application.port.BackupPort;
import org.learningjava.mediadb.config.StoreProperties;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.BackupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class BackupUseCase {

    private static final Logger log = LoggerFactory.getLogger(BackupUseCase.class);

    private final AssetStorePort store;
    private final BackupPort backup;
    private final StoreProperties props;

    public BackupUseCase(AssetStorePort store, BackupPort backup, StoreProperties props) {
        this.store = store;
        this.backup = backup;
        this.props = props;
    }

    /**
     * Mirrors the whole store directory to {@code destination}, or to the configured backup path
     * when null. Blocks until the copy completes.
     */
    public BackupReport backupTo(Path destination) {
        Path storeDir = props.getPath();
        if (storeDir == null || !Files.isDirectory(storeDir)) {
            throw new MediaNotFoundException("Store directory not found: " + storeDir);
        }
        Path dest = destination != null ? destination : props.getBackupPath();
        if (dest == null) throw new IllegalArgumentException("No backup destination given or configured");

        store.checkpoint();
        log.info("Backing up {} to {}", storeDir, dest);
        return backup.mirror(storeDir, dest);
    }
}
