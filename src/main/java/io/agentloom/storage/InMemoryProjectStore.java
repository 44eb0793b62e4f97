package io.agentloom.storage;

import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;
import io.agentloom.util.Jsons;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile store for tests and throwaway runs. Documents are kept as JSON strings so
 * callers never share structure with stored values.
 */
public final class InMemoryProjectStore implements ProjectStore {
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<ProjectState> load(String projectId, String ownerId) {
        String json = documents.get(projectId);
        if (json == null) {
            return Optional.empty();
        }
        return ProjectAccess.authorize(decode(json), ownerId);
    }

    @Override
    public void save(ProjectState state) {
        ProjectAccess.requireSavable(state);
        documents.put(state.projectId(), Jsons.toCompactJson(state));
    }

    @Override
    public List<ProjectSummary> listProjects(String ownerId) {
        return ProjectAccess.sorted(documents.values().stream()
                .map(InMemoryProjectStore::decode)
                .filter(s -> ProjectAccess.isVisibleTo(s.ownerId(), ownerId))
                .map(ProjectSummary::of)
                .toList());
    }

    public int size() {
        return documents.size();
    }

    private static ProjectState decode(String json) {
        try {
            return Jsons.mapper().readValue(json, ProjectState.class);
        } catch (Exception e) {
            throw new StorageException("Corrupt in-memory project document", e);
        }
    }
}
