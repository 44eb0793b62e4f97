package io.agentloom.storage;

import io.agentloom.config.LoomConfig;
import io.agentloom.model.ProjectState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;

final class SqliteProjectStoreTest extends ProjectStoreContract {

    @Override
    protected ProjectStore newStore(Path root) {
        Database db = new Database(new LoomConfig(root));
        db.init();
        return new SqliteProjectStore(db);
    }

    @Test
    void upsertKeepsOneRowWithIndexedColumns() throws Exception {
        Database db = new Database(new LoomConfig(root));
        db.init();
        SqliteProjectStore store = new SqliteProjectStore(db);
        Instant t0 = Instant.parse("2026-03-01T00:00:00Z");

        store.save(ProjectState.initial("p1", t0));
        store.save(ProjectState.initial("p1", t0).withOwner("alice", t0.plusSeconds(1))
                .withProjectName("Todo", t0.plusSeconds(2)));

        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*), MAX(owner_id), MAX(project_name), MAX(updated_at_ms) FROM project_memory")) {
            try (ResultSet rs = ps.executeQuery()) {
                Assertions.assertTrue(rs.next());
                Assertions.assertEquals(1, rs.getInt(1));
                Assertions.assertEquals("alice", rs.getString(2));
                Assertions.assertEquals("Todo", rs.getString(3));
                Assertions.assertEquals(t0.plusSeconds(2).toEpochMilli(), rs.getLong(4));
            }
        }
    }

    @Test
    void corruptRowIsSkippedInListing() throws Exception {
        Database db = new Database(new LoomConfig(root));
        db.init();
        SqliteProjectStore store = new SqliteProjectStore(db);
        store.save(ProjectState.initial("good", Instant.parse("2026-03-01T00:00:00Z")));
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO project_memory(project_id,state,updated_at_ms) VALUES('bad','{not json',0)")) {
            ps.executeUpdate();
        }

        Assertions.assertEquals(1, store.listProjects(null).size());
        Assertions.assertEquals("good", store.listProjects("alice").get(0).id());
        Assertions.assertThrows(StorageException.class, () -> store.load("bad", null));
    }

    @Test
    void initIsIdempotentAndRecordsMigration() {
        Database db = new Database(new LoomConfig(root));
        db.init();
        db.init();
        Assertions.assertEquals(1, db.appliedMigrations().size());
    }
}
