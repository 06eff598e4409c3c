package org.learningjava.mediadb.infrastructure.adapter.out.sqlite;

import org.learningjava.mediadb.domain.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the {@code assets} and {@code projects} tables on first use and leaves existing ones
 * untouched. Tables are STRICT, so every column keeps its declared type.
 */
public class SqliteSchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SqliteSchemaManager.class);

    static final String ASSETS = "assets";
    static final String PROJECTS = "projects";

    private static final String SQL_CREATE_ASSETS = """
            CREATE TABLE IF NOT EXISTS assets (
             id TEXT PRIMARY KEY,
             filename TEXT NOT NULL,
             media_type TEXT NOT NULL CHECK (media_type IN ('image', 'video')),
             image_data BLOB,
             video_data BLOB,
             thumbnail BLOB,
             embedding BLOB,
             embedding_status TEXT NOT NULL CHECK (embedding_status IN ('computed', 'unavailable')),
             source TEXT,
             generation_prompt TEXT,
             generation_model TEXT,
             generation_time_seconds REAL,
             generation_cost_usd REAL,
             width INTEGER,
             height INTEGER,
             duration_seconds REAL,
             file_size_bytes INTEGER NOT NULL CHECK (file_size_bytes >= 0),
             format TEXT,
             content_type TEXT,
             subjects TEXT NOT NULL DEFAULT '[]',
             style_tags TEXT NOT NULL DEFAULT '[]',
             quality_rating INTEGER CHECK (quality_rating IS NULL OR quality_rating BETWEEN 1 AND 10),
             quality_notes TEXT,
             episode_assignments TEXT NOT NULL DEFAULT '[]',
             use_count INTEGER NOT NULL DEFAULT 0 CHECK (use_count >= 0),
             created_at TEXT NOT NULL,
             last_used_at TEXT,
             CHECK ((media_type = 'image' AND image_data IS NOT NULL AND video_data IS NULL AND thumbnail IS NULL)
                 OR (media_type = 'video' AND video_data IS NOT NULL AND image_data IS NULL)),
             CHECK ((embedding_status = 'computed') = (embedding IS NOT NULL))
            ) STRICT""";

    private static final String SQL_CREATE_PROJECTS = """
            CREATE TABLE IF NOT EXISTS projects (
             id TEXT PRIMARY KEY,
             project_name TEXT NOT NULL,
             theme TEXT,
             asset_ids TEXT NOT NULL DEFAULT '[]',
             created_at TEXT NOT NULL,
             published_at TEXT,
             engagement_likes INTEGER NOT NULL DEFAULT 0,
             engagement_comments INTEGER NOT NULL DEFAULT 0,
             engagement_shares INTEGER NOT NULL DEFAULT 0
            ) STRICT""";

    private static final List<String> SQL_INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_assets_media_type ON assets(media_type)",
            "CREATE INDEX IF NOT EXISTS idx_assets_source ON assets(source)",
            "CREATE INDEX IF NOT EXISTS idx_assets_filename ON assets(filename)",
            "CREATE INDEX IF NOT EXISTS idx_assets_created_at ON assets(created_at)"
    );

    private final DataSource dataSource;

    public SqliteSchemaManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return names of the tables created by this call; empty when the schema already existed
     */
    public synchronized List<String> ensureTables() {
        Map<String, String> ddl = new LinkedHashMap<>();
        ddl.put(ASSETS, SQL_CREATE_ASSETS);
        ddl.put(PROJECTS, SQL_CREATE_PROJECTS);

        List<String> created = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            try (Statement st = conn.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
            }
            for (Map.Entry<String, String> e : ddl.entrySet()) {
                if (!tableExists(conn, e.getKey())) {
                    try (Statement st = conn.createStatement()) {
                        st.execute(e.getValue());
                    }
                    created.add(e.getKey());
                }
            }
            try (Statement st = conn.createStatement()) {
                for (String idx : SQL_INDEXES) st.execute(idx);
            }
        } catch (SQLException e) {
            throw new StorageException("Schema initialization failed", e);
        }
        if (created.isEmpty()) {
            log.debug("Schema present, tables opened unchanged");
        } else {
            log.info("Created tables {}", created);
        }
        return created;
    }

    static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
