package io.agentloom.storage;

import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for project state. Each project is one JSON document keyed
 * by its id.
 */
public interface ProjectStore {

    /**
     * Loads a project. Returns empty when the project does not exist, or when
     * {@code ownerId} is given and the stored owner is set to a different user.
     */
    Optional<ProjectState> load(String projectId, String ownerId);

    /**
     * Upserts the full document. Throws {@link StorageException} on I/O failure.
     */
    void save(ProjectState state);

    /**
     * Lists projects visible to {@code ownerId} (all when null), newest first.
     * Records without an owner stay visible to everyone.
     */
    List<ProjectSummary> listProjects(String ownerId);
}
