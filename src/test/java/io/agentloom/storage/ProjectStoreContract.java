package io.agentloom.storage;

import io.agentloom.model.AgentContextUpdate;
import io.agentloom.model.Guideline;
import io.agentloom.model.Phase;
import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Behaviour every {@link ProjectStore} must share.
 */
abstract class ProjectStoreContract {
    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    protected Path root;

    protected abstract ProjectStore newStore(Path root) throws Exception;

    @BeforeEach
    void createRoot() throws IOException {
        root = Files.createTempDirectory("agentloom-store-");
    }

    @AfterEach
    void deleteRoot() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void roundTripsFullState() throws Exception {
        ProjectStore store = newStore(root);
        ProjectState state = ProjectState.initial("p1", T0)
                .withProjectName("Todo", T0.plusSeconds(1))
                .withPhase(Phase.DEVELOPMENT, T0.plusSeconds(2))
                .withDocument("requirements", Map.of("title", "Todo", "items", List.of("a", "b")), T0.plusSeconds(3))
                .withDocument("qa_report", Map.of(
                        "exitCode", 0,
                        "durationMs", 5_000_000_000L,
                        "coverage", 0.875,
                        "passed", true,
                        "suites", Map.of("unit", 12, "names", List.of("api", "ui"))
                ), T0.plusSeconds(3))
                .withCodeArtifact("api", Map.of("path", "src/api.ts"), T0.plusSeconds(4))
                .withAgentContext("architect",
                        AgentContextUpdate.working("draft").withNextTasks(List.of("review")), T0.plusSeconds(5))
                .withGuideline(new Guideline("t", "c", "r"), T0.plusSeconds(6))
                .withBlockers(List.of("need creds"), T0.plusSeconds(7))
                .withMilestone("requirements signed off", T0.plusSeconds(8));

        store.save(state);

        Assertions.assertEquals(state, store.load("p1", null).orElseThrow());
    }

    @Test
    void saveOverwritesExistingDocument() throws Exception {
        ProjectStore store = newStore(root);
        store.save(ProjectState.initial("p1", T0));
        store.save(ProjectState.initial("p1", T0).withPhase(Phase.TESTING, T0.plusSeconds(1)));

        Assertions.assertEquals(Phase.TESTING, store.load("p1", null).orElseThrow().phase());
        Assertions.assertEquals(1, store.listProjects(null).size());
    }

    @Test
    void missingProjectIsEmpty() throws Exception {
        Assertions.assertTrue(newStore(root).load("missing", null).isEmpty());
    }

    @Test
    void foreignOwnerSeesNothing() throws Exception {
        ProjectStore store = newStore(root);
        store.save(ProjectState.initial("p1", T0).withOwner("alice", T0.plusSeconds(1)));

        Assertions.assertTrue(store.load("p1", "bob").isEmpty());
        Assertions.assertTrue(store.load("p1", "alice").isPresent());
        Assertions.assertTrue(store.load("p1", null).isPresent());
    }

    @Test
    void unownedProjectIsVisibleToEveryone() throws Exception {
        ProjectStore store = newStore(root);
        store.save(ProjectState.initial("legacy", T0));

        Assertions.assertTrue(store.load("legacy", "bob").isPresent());
    }

    @Test
    void listingIsOwnerScopedAndNewestFirst() throws Exception {
        ProjectStore store = newStore(root);
        store.save(ProjectState.initial("old", T0).withOwner("alice", T0.plusSeconds(1)));
        store.save(ProjectState.initial("legacy", T0.plusSeconds(2)));
        store.save(ProjectState.initial("new", T0).withOwner("alice", T0.plusSeconds(3))
                .withProjectName("Shop", T0.plusSeconds(4)));
        store.save(ProjectState.initial("other", T0).withOwner("bob", T0.plusSeconds(5)));

        List<ProjectSummary> alice = store.listProjects("alice");
        Assertions.assertEquals(List.of("new", "legacy", "old"), alice.stream().map(ProjectSummary::id).toList());
        Assertions.assertEquals("Shop", alice.get(0).name());
        Assertions.assertEquals(ProjectSummary.UNTITLED, alice.get(1).name());
        Assertions.assertEquals(T0.plusSeconds(4), alice.get(0).lastUpdated());

        Assertions.assertEquals(4, store.listProjects(null).size());
    }

    @Test
    void emptyStoreListsNothing() throws Exception {
        Assertions.assertTrue(newStore(root).listProjects("anyone").isEmpty());
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
