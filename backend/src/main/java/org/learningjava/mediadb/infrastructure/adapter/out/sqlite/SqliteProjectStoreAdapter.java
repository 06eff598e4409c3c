package org.learningjava.mediadb.infrastructure.adapter.out.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.mediadb.application.port.ProjectStorePort;
import org.learningjava.mediadb.domain.exception.StorageException;
import org.learningjava.mediadb.domain.model.Project;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class SqliteProjectStoreAdapter implements ProjectStorePort {

    private static final String COLUMNS = """
            id, project_name, theme, asset_ids, created_at, published_at,
            engagement_likes, engagement_comments, engagement_shares""";

    private final DataSource dataSource;
    private final SqliteSchemaManager schema;
    private final ObjectMapper om = new ObjectMapper();

    public SqliteProjectStoreAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
        this.schema = new SqliteSchemaManager(dataSource);
    }

    @Override
    public void ensureSchema() {
        schema.ensureTables();
    }

    @Override
    public void save(Project p) {
        String sql = "INSERT INTO projects (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            List<String> ids = p.assetIds().stream().map(UUID::toString).toList();
            ps.setString(1, p.id().toString());
            ps.setString(2, p.projectName());
            ps.setString(3, p.theme());
            ps.setString(4, om.writeValueAsString(ids));
            ps.setString(5, SqlTimestamps.format(p.createdAt()));
            ps.setString(6, SqlTimestamps.format(p.publishedAt()));
            ps.setInt(7, p.engagementLikes());
            ps.setInt(8, p.engagementComments());
            ps.setInt(9, p.engagementShares());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to save project " + p.id(), e);
        }
    }

    @Override
    public Optional<Project> findById(UUID id) {
        List<Project> rows = query("SELECT " + COLUMNS + " FROM projects WHERE id = ?", id.toString());
        return rows.stream().findFirst();
    }

    @Override
    public List<Project> list() {
        return query("SELECT " + COLUMNS + " FROM projects ORDER BY created_at, rowid", null);
    }

    private List<Project> query(String sql, String param) {
        List<Project> out = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    List<String> ids = om.readValue(rs.getString("asset_ids"), new TypeReference<List<String>>() {
                    });
                    out.add(new Project(
                            UUID.fromString(rs.getString("id")),
                            rs.getString("project_name"),
                            rs.getString("theme"),
                            ids.stream().map(UUID::fromString).toList(),
                            SqlTimestamps.parse(rs.getString("created_at")),
                            SqlTimestamps.parse(rs.getString("published_at")),
                            rs.getInt("engagement_likes"),
                            rs.getInt("engagement_comments"),
                            rs.getInt("engagement_shares")));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Project query failed", e);
        }
        return out;
    }
}
