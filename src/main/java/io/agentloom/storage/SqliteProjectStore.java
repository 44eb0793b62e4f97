package io.agentloom.storage;

import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;
import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores each project as a JSON document in the {@code project_memory} table. Saves are
 * upserts keyed by {@code project_id}.
 */
public final class SqliteProjectStore implements ProjectStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteProjectStore.class);

    private final Database db;

    public SqliteProjectStore(Database db) {
        this.db = db;
    }

    @Override
    public Optional<ProjectState> load(String projectId, String ownerId) {
        String sql = "SELECT state FROM project_memory WHERE project_id=?";
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return ProjectAccess.authorize(decode(projectId, rs.getString("state")), ownerId);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load project " + projectId, e);
        }
    }

    @Override
    public void save(ProjectState state) {
        ProjectAccess.requireSavable(state);
        String sql = """
                INSERT INTO project_memory(project_id,owner_id,project_name,state,updated_at_ms)
                VALUES(?,?,?,?,?)
                ON CONFLICT(project_id) DO UPDATE SET
                    owner_id=excluded.owner_id,
                    project_name=excluded.project_name,
                    state=excluded.state,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.projectId());
            setNullable(ps, 2, state.ownerId());
            setNullable(ps, 3, state.projectName());
            ps.setString(4, Jsons.toCompactJson(state));
            ps.setLong(5, state.lastUpdated().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to save project " + state.projectId(), e);
        }
    }

    @Override
    public List<ProjectSummary> listProjects(String ownerId) {
        boolean scoped = ownerId != null && !ownerId.isBlank();
        String sql = scoped
                ? "SELECT project_id,state FROM project_memory WHERE owner_id IS NULL OR owner_id='' OR owner_id=?"
                : "SELECT project_id,state FROM project_memory";
        List<ProjectSummary> out = new ArrayList<>();
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (scoped) {
                ps.setString(1, ownerId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String projectId = rs.getString("project_id");
                    try {
                        out.add(ProjectSummary.of(decode(projectId, rs.getString("state"))));
                    } catch (StorageException e) {
                        log.warn("Skipping unreadable project row {}: {}", projectId, e.getMessage());
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list projects", e);
        }
        return ProjectAccess.sorted(out);
    }

    private static void setNullable(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static ProjectState decode(String projectId, String json) {
        try {
            return Jsons.mapper().readValue(json, ProjectState.class);
        } catch (IOException e) {
            throw new StorageException("Corrupt state document for project " + projectId, e);
        }
    }
}
