package io.agentloom.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentloom.model.AgentContextUpdate;
import io.agentloom.model.Guideline;
import io.agentloom.model.Phase;
import io.agentloom.model.ProjectState;
import io.agentloom.storage.ProjectStore;
import io.agentloom.storage.StorageException;
import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Shared state of one project. Every mutator persists the next state through the
 * {@link ProjectStore} before it becomes visible here; a {@link StorageException} from
 * the store leaves the in-memory state untouched.
 *
 * <p>Mutators are synchronized, but the single-writer guarantee comes from the
 * coordinator's scheduling, not from this class.
 */
public final class ProjectMemory {
    private static final Logger log = LoggerFactory.getLogger(ProjectMemory.class);
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final ProjectStore store;
    private final Clock clock;
    private volatile ProjectState state;

    public ProjectMemory(String projectId, ProjectStore store) {
        this(projectId, store, Clock.systemUTC());
    }

    public ProjectMemory(String projectId, ProjectStore store, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.state = ProjectState.initial(projectId, this.clock.instant());
    }

    public String projectId() {
        return state.projectId();
    }

    /**
     * Independent deep copy of the current state.
     */
    public ProjectState snapshot() {
        return Jsons.deepCopy(state, ProjectState.class);
    }

    /**
     * Loads a stored project and adopts it. Empty when the project is missing or owned
     * by someone other than {@code ownerId}.
     */
    public synchronized Optional<ProjectState> load(String projectId, String ownerId) {
        Optional<ProjectState> loaded = store.load(projectId, ownerId);
        loaded.ifPresent(found -> {
            state = found;
            log.info("Loaded project {} (phase={})", found.projectId(), found.phase().wireName());
        });
        return loaded.map(found -> Jsons.deepCopy(found, ProjectState.class));
    }

    public void updatePhase(Phase phase) {
        if (phase == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
        commit(s -> s.withPhase(phase, nextTimestamp(s)));
        log.info("Project {} moved to phase {}", projectId(), phase.wireName());
    }

    public void updateProjectName(String name) {
        commit(s -> s.withProjectName(name, nextTimestamp(s)));
    }

    public void updateDocument(String name, Map<String, Object> partial) {
        requireName(name, "document");
        Map<String, Object> fields = jsonShaped(partial);
        commit(s -> s.withDocument(name, fields, nextTimestamp(s)));
    }

    public void updateCodeArtifact(String name, Map<String, Object> partial) {
        requireName(name, "artifact");
        Map<String, Object> fields = jsonShaped(partial);
        commit(s -> s.withCodeArtifact(name, fields, nextTimestamp(s)));
    }

    public void updateAgentContext(String role, AgentContextUpdate update) {
        requireName(role, "role");
        if (update == null) {
            throw new IllegalArgumentException("update must not be null");
        }
        commit(s -> s.withAgentContext(role, update, nextTimestamp(s)));
    }

    public void addGuideline(Guideline guideline) {
        if (guideline == null) {
            throw new IllegalArgumentException("guideline must not be null");
        }
        commit(s -> s.withGuideline(guideline, nextTimestamp(s)));
    }

    public void setOwner(String userId) {
        commit(s -> s.withOwner(userId, nextTimestamp(s)));
    }

    public void raiseBlocker(String description) {
        requireName(description, "blocker");
        commit(s -> {
            List<String> next = new ArrayList<>(s.blockers());
            if (!next.contains(description)) {
                next.add(description);
            }
            return s.withBlockers(next, nextTimestamp(s));
        });
    }

    public void resolveBlocker(String description) {
        commit(s -> {
            List<String> next = new ArrayList<>(s.blockers());
            next.remove(description);
            return s.withBlockers(next, nextTimestamp(s));
        });
    }

    public void recordMilestone(String milestone) {
        requireName(milestone, "milestone");
        commit(s -> s.withMilestone(milestone, nextTimestamp(s)));
    }

    /**
     * Record fields are kept in the shape a JSON reload produces (a small {@code long}
     * becomes an {@code Integer}, nested values become plain maps and lists), so the live
     * state, its snapshots and a stored copy compare equal.
     */
    private static Map<String, Object> jsonShaped(Map<String, Object> partial) {
        return Jsons.deepCopy(partial, FIELDS);
    }

    private synchronized void commit(UnaryOperator<ProjectState> change) {
        ProjectState next = change.apply(state);
        store.save(next);
        state = next;
    }

    // lastUpdated must strictly increase even when the clock has not moved.
    private Instant nextTimestamp(ProjectState current) {
        Instant now = clock.instant();
        Instant previous = current.lastUpdated();
        return now.isAfter(previous) ? now : previous.plusMillis(1);
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
