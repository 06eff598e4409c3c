package org.learningjava.mediadb.infrastructure.adapter.out.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;

public abstract class SqliteTestBase {

    @TempDir
    protected Path storeDir;

    protected HikariDataSource ds;

    @BeforeEach
    void openDatabase() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + storeDir.resolve("media.sqlite").toAbsolutePath());
        cfg.setMaximumPoolSize(4);
        cfg.setConnectionInitSql("PRAGMA busy_timeout = 5000");
        ds = new HikariDataSource(cfg);
    }

    @AfterEach
    void closeDatabase() {
        if (ds != null) ds.close();
    }

    protected DataSource dataSource() {
        return ds;
    }
}
