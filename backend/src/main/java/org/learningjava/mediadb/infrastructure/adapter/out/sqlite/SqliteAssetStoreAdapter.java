package org.learningjava.mediadb.infrastructure.adapter.out.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.domain.model.AssetFacts;
import org.learningjava.mediadb.domain.model.AssetFilter;
import org.learningjava.mediadb.domain.model.AssetPage;
import org.learningjava.mediadb.domain.model.Classification;
import org.learningjava.mediadb.domain.model.Content;
import org.learningjava.mediadb.domain.model.Embedding;
import org.learningjava.mediadb.domain.model.EpisodeUpdate;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.domain.model.Provenance;
import org.learningjava.mediadb.domain.model.ScoredAsset;
import org.learningjava.mediadb.domain.model.TechnicalSpecs;
import org.learningjava.mediadb.domain.service.NearestNeighbours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Asset table on SQLite. Each write is a single statement, so appends and mutations are atomic
 * without explicit transactions. Metadata queries never select the content blobs.
 */
public class SqliteAssetStoreAdapter implements AssetStorePort {

    private static final Logger log = LoggerFactory.getLogger(SqliteAssetStoreAdapter.class);

    private static final String STATUS_COMPUTED = "computed";
    private static final String STATUS_UNAVAILABLE = "unavailable";

    private static final String META_COLUMNS = """
            id, filename, media_type, embedding, embedding_status,
            source, generation_prompt, generation_model, generation_time_seconds, generation_cost_usd,
            width, height, duration_seconds, file_size_bytes, format,
            content_type, subjects, style_tags, quality_rating, quality_notes,
            episode_assignments, use_count, created_at, last_used_at,
            thumbnail IS NOT NULL AS has_thumbnail""";

    private static final String SQL_INSERT = """
            INSERT INTO assets (
             id, filename, media_type, image_data, video_data, thumbnail, embedding, embedding_status,
             source, generation_prompt, generation_model, generation_time_seconds, generation_cost_usd,
             width, height, duration_seconds, file_size_bytes, format,
             content_type, subjects, style_tags, quality_rating, quality_notes,
             episode_assignments, use_count, created_at, last_used_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String SQL_ADD_EPISODE = """
            UPDATE assets
               SET episode_assignments = json_insert(episode_assignments, '$[#]', ?)
             WHERE id = ?
               AND NOT EXISTS (SELECT 1 FROM json_each(assets.episode_assignments) WHERE value = ?)""";

    private static final String SQL_RATE = """
            UPDATE assets SET quality_rating = ?, quality_notes = ? WHERE id = ?""";

    private static final String SQL_MARK_USED = """
            UPDATE assets SET use_count = use_count + 1, last_used_at = ? WHERE id = ?""";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Integer>> INT_LIST = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final SqliteSchemaManager schema;
    private final ObjectMapper om = new ObjectMapper();

    public SqliteAssetStoreAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
        this.schema = new SqliteSchemaManager(dataSource);
    }

    @Override
    public void ensureSchema() {
        schema.ensureTables();
    }

    @Override
    public void append(MediaAsset a, Content content) {
        if (a.mediaType() != content.mediaType()) {
            throw new IllegalArgumentException("Content variant " + content.mediaType() + " does not match asset type " + a.mediaType());
        }
        byte[] imageData = content instanceof Content.Image img ? img.bytes() : null;
        byte[] videoData = null;
        byte[] thumbnail = null;
        if (content instanceof Content.Video vid) {
            videoData = vid.bytes();
            thumbnail = vid.thumbnail();
        }
        byte[] embedding = a.embedding() instanceof Embedding.Computed c ? EmbeddingCodec.encode(c.vector()) : null;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SQL_INSERT)) {
            int i = 1;
            ps.setString(i++, a.id().toString());
            ps.setString(i++, a.filename());
            ps.setString(i++, a.mediaType().wireName());
            setBytes(ps, i++, imageData);
            setBytes(ps, i++, videoData);
            setBytes(ps, i++, thumbnail);
            setBytes(ps, i++, embedding);
            ps.setString(i++, embedding != null ? STATUS_COMPUTED : STATUS_UNAVAILABLE);
            Provenance p = a.provenance();
            ps.setString(i++, p.source());
            ps.setString(i++, p.generationPrompt());
            ps.setString(i++, p.generationModel());
            setDouble(ps, i++, p.generationTimeSeconds());
            setDouble(ps, i++, p.generationCostUsd());
            TechnicalSpecs s = a.specs();
            setInt(ps, i++, s != null ? s.width() : null);
            setInt(ps, i++, s != null ? s.height() : null);
            setDouble(ps, i++, s != null ? s.durationSeconds() : null);
            ps.setLong(i++, s != null ? s.fileSizeBytes() : 0L);
            ps.setString(i++, s != null ? s.format() : null);
            Classification c = a.classification();
            ps.setString(i++, c.contentType());
            ps.setString(i++, toJson(c.subjects()));
            ps.setString(i++, toJson(c.styleTags()));
            setInt(ps, i++, a.qualityRating());
            ps.setString(i++, a.qualityNotes());
            ps.setString(i++, toJson(a.episodeAssignments()));
            ps.setInt(i++, a.useCount());
            ps.setString(i++, SqlTimestamps.format(a.createdAt()));
            ps.setString(i, SqlTimestamps.format(a.lastUsedAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to append asset " + a.id(), e);
        }
        log.debug("Appended asset {} ({}, {} bytes)", a.id(), a.mediaType().wireName(), content.bytes().length);
    }

    @Override
    public Optional<MediaAsset> findById(UUID id) {
        List<MediaAsset> rows = query("SELECT " + META_COLUMNS + " FROM assets WHERE id = ?", List.of(id.toString()));
        return rows.stream().findFirst();
    }

    @Override
    public Optional<Content> loadContent(UUID id) {
        String sql = "SELECT media_type, image_data, video_data, thumbnail FROM assets WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id.toString());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                MediaType type = MediaType.fromWire(rs.getString("media_type"));
                return Optional.of(type == MediaType.IMAGE
                        ? Content.image(rs.getBytes("image_data"))
                        : Content.video(rs.getBytes("video_data"), rs.getBytes("thumbnail")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load content of " + id, e);
        }
    }

    @Override
    public List<ScoredAsset> nearest(float[] query, AssetFilter filter, int limit) {
        Where where = Where.of(filter).and("embedding_status = '" + STATUS_COMPUTED + "'");
        NearestNeighbours<String> knn = new NearestNeighbours<>(query, limit);
        int scanned = 0;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT id, embedding FROM assets" + where.sql())) {
            bind(ps, where.params());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    knn.offer(rs.getString(1), EmbeddingCodec.decode(rs.getBytes(2)));
                    scanned++;
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Vector scan failed", e);
        }

        List<NearestNeighbours.Hit<String>> hits = knn.result();
        log.debug("Vector scan: {} candidates, {} hits", scanned, hits.size());
        if (hits.isEmpty()) return List.of();

        Map<String, MediaAsset> byId = new HashMap<>();
        List<Object> ids = new ArrayList<>();
        for (var h : hits) ids.add(h.key());
        String in = String.join(", ", Collections.nCopies(ids.size(), "?"));
        for (MediaAsset a : query("SELECT " + META_COLUMNS + " FROM assets WHERE id IN (" + in + ")", ids)) {
            byId.put(a.id().toString(), a);
        }

        List<ScoredAsset> out = new ArrayList<>(hits.size());
        for (var h : hits) {
            MediaAsset a = byId.get(h.key());
            if (a != null) out.add(new ScoredAsset(a, h.distance()));
        }
        return out;
    }

    @Override
    public List<MediaAsset> find(AssetFilter filter) {
        Where where = Where.of(filter);
        return query("SELECT " + META_COLUMNS + " FROM assets" + where.sql() + " ORDER BY created_at, rowid", where.params());
    }

    @Override
    public AssetPage list(MediaType mediaType, String source, int limit, int offset) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        Where where = Where.of(AssetFilter.none().withMediaType(mediaType).withSource(source));

        long total;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM assets" + where.sql())) {
            bind(ps, where.params());
            try (ResultSet rs = ps.executeQuery()) {
                total = rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count assets", e);
        }

        List<Object> params = new ArrayList<>(where.params());
        params.add(limit);
        params.add(offset);
        List<MediaAsset> rows = query("SELECT " + META_COLUMNS + " FROM assets" + where.sql()
                + " ORDER BY created_at DESC, rowid DESC LIMIT ? OFFSET ?", params);
        return new AssetPage(total, offset, limit, rows);
    }

    @Override
    public List<AssetFacts> scanFacts() {
        String sql = "SELECT media_type, source, file_size_bytes, quality_rating, embedding_status FROM assets";
        List<AssetFacts> out = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                out.add(new AssetFacts(
                        MediaType.fromWire(rs.getString(1)),
                        rs.getString(2),
                        rs.getLong(3),
                        getInt(rs, 4),
                        STATUS_COMPUTED.equals(rs.getString(5))));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to scan asset facts", e);
        }
        return out;
    }

    @Override
    public boolean updateRating(UUID id, int rating, String notes) {
        return executeUpdate(SQL_RATE, Arrays.asList(rating, notes, id.toString()), "rate " + id) > 0;
    }

    @Override
    public EpisodeUpdate addEpisode(UUID id, int episode) {
        int n = executeUpdate(SQL_ADD_EPISODE, List.of(episode, id.toString(), episode), "assign episode to " + id);
        if (n > 0) return EpisodeUpdate.ADDED;
        return exists(id) ? EpisodeUpdate.ALREADY_PRESENT : EpisodeUpdate.NOT_FOUND;
    }

    @Override
    public boolean markUsed(UUID id, Instant usedAt) {
        return executeUpdate(SQL_MARK_USED, List.of(SqlTimestamps.format(usedAt), id.toString()), "mark used " + id) > 0;
    }

    @Override
    public Set<String> existingFilenames() {
        Set<String> out = new LinkedHashSet<>();
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT DISTINCT filename FROM assets")) {
            while (rs.next()) out.add(rs.getString(1));
        } catch (SQLException e) {
            throw new StorageException("Failed to read filenames", e);
        }
        return out;
    }

    @Override
    public void checkpoint() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        } catch (SQLException e) {
            throw new StorageException("WAL checkpoint failed", e);
        }
    }

    // ---- helpers ----

    private boolean exists(UUID id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM assets WHERE id = ?")) {
            ps.setString(1, id.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to look up " + id, e);
        }
    }

    private int executeUpdate(String sql, List<Object> params, String what) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to " + what, e);
        }
    }

    private List<MediaAsset> query(String sql, List<Object> params) {
        List<MediaAsset> out = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Asset query failed", e);
        }
        return out;
    }

    private MediaAsset map(ResultSet rs) throws SQLException {
        byte[] blob = rs.getBytes("embedding");
        Embedding embedding = STATUS_COMPUTED.equals(rs.getString("embedding_status")) && blob != null
                ? Embedding.computed(EmbeddingCodec.decode(blob))
                : Embedding.unavailable();
        return new MediaAsset(
                UUID.fromString(rs.getString("id")),
                rs.getString("filename"),
                MediaType.fromWire(rs.getString("media_type")),
                embedding,
                new Provenance(
                        rs.getString("source"),
                        rs.getString("generation_prompt"),
                        rs.getString("generation_model"),
                        getDouble(rs, "generation_time_seconds"),
                        getDouble(rs, "generation_cost_usd")),
                new TechnicalSpecs(
                        getInt(rs, "width"),
                        getInt(rs, "height"),
                        getDouble(rs, "duration_seconds"),
                        rs.getLong("file_size_bytes"),
                        rs.getString("format")),
                new Classification(
                        rs.getString("content_type"),
                        new LinkedHashSet<>(fromJson(rs.getString("subjects"), STRING_LIST)),
                        new LinkedHashSet<>(fromJson(rs.getString("style_tags"), STRING_LIST))),
                getInt(rs, "quality_rating"),
                rs.getString("quality_notes"),
                new LinkedHashSet<>(fromJson(rs.getString("episode_assignments"), INT_LIST)),
                rs.getInt("use_count"),
                SqlTimestamps.parse(rs.getString("created_at")),
                SqlTimestamps.parse(rs.getString("last_used_at")),
                rs.getInt("has_thumbnail") == 1);
    }

    private String toJson(Collection<?> values) {
        try {
            return om.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize " + values, e);
        }
    }

    private <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt JSON column: " + json, e);
        }
    }

    static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            if (p == null) ps.setNull(i + 1, Types.NULL);
            else if (p instanceof Integer n) ps.setInt(i + 1, n);
            else if (p instanceof Long n) ps.setLong(i + 1, n);
            else ps.setObject(i + 1, p);
        }
    }

    private static void setBytes(PreparedStatement ps, int i, byte[] v) throws SQLException {
        if (v == null) ps.setNull(i, Types.BLOB);
        else ps.setBytes(i, v);
    }

    private static void setInt(PreparedStatement ps, int i, Integer v) throws SQLException {
        if (v == null) ps.setNull(i, Types.INTEGER);
        else ps.setInt(i, v);
    }

    private static void setDouble(PreparedStatement ps, int i, Double v) throws SQLException {
        if (v == null) ps.setNull(i, Types.REAL);
        else ps.setDouble(i, v);
    }

    private static Integer getInt(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    private static Integer getInt(ResultSet rs, int col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    private static Double getDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    /** WHERE clause with positional parameters, built from an {@link AssetFilter}. */
    record Where(List<String> clauses, List<Object> params) {

        static Where of(AssetFilter f) {
            List<String> c = new ArrayList<>();
            List<Object> p = new ArrayList<>();
            if (f == null) return new Where(c, p);
            if (f.mediaType() != null) {
                c.add("media_type = ?");
                p.add(f.mediaType().wireName());
            }
            if (f.minQuality() != null) {
                c.add("quality_rating IS NOT NULL AND quality_rating >= ?");
                p.add(f.minQuality());
            }
            if (f.subject() != null) {
                c.add("EXISTS (SELECT 1 FROM json_each(assets.subjects) WHERE value = ?)");
                p.add(f.subject());
            }
            if (f.episode() != null) {
                c.add("EXISTS (SELECT 1 FROM json_each(assets.episode_assignments) WHERE value = ?)");
                p.add(f.episode());
            }
            if (f.excludeEpisode() != null) {
                c.add("NOT EXISTS (SELECT 1 FROM json_each(assets.episode_assignments) WHERE value = ?)");
                p.add(f.excludeEpisode());
            }
            if (f.source() != null) {
                c.add("source = ?");
                p.add(f.source());
            }
            return new Where(c, p);
        }

        Where and(String clause) {
            List<String> c = new ArrayList<>(clauses);
            c.add(clause);
            return new Where(c, params);
        }

        String sql() {
            return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        }
    }
}
