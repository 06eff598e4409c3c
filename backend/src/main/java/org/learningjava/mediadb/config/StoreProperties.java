package org.learningjava.mediadb.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "mediadb.store")
public class StoreProperties {
    private Path path = Path.of("data", "mediadb");
    private Path backupPath;
    private int poolSize = 4;

    public Path getPath() { return path; }
    public void setPath(Path v) { this.path = v; }
    public Path getBackupPath() { return backupPath; }
    public void setBackupPath(Path v) { this.backupPath = v; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int v) { this.poolSize = v; }

    public Path databaseFile() {
        return path.resolve("media.sqlite");
    }
}
