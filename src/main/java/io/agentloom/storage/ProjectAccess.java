package io.agentloom.storage;

import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

final class ProjectAccess {
    private static final Logger log = LoggerFactory.getLogger(ProjectAccess.class);

    static final Comparator<ProjectSummary> NEWEST_FIRST =
            Comparator.comparing(ProjectSummary::lastUpdated).reversed()
                    .thenComparing(ProjectSummary::id);

    private ProjectAccess() {
    }

    static Optional<ProjectState> authorize(ProjectState state, String requesterId) {
        if (state == null) {
            return Optional.empty();
        }
        if (!isVisibleTo(state.ownerId(), requesterId)) {
            log.warn("Unauthorized access attempt to project {} by user {}", state.projectId(), requesterId);
            return Optional.empty();
        }
        return Optional.of(state);
    }

    static boolean isVisibleTo(String storedOwner, String requesterId) {
        if (requesterId == null || requesterId.isBlank()) {
            return true;
        }
        return storedOwner == null || storedOwner.isBlank() || storedOwner.equals(requesterId);
    }

    static List<ProjectSummary> sorted(List<ProjectSummary> summaries) {
        return summaries.stream().sorted(NEWEST_FIRST).toList();
    }

    static void requireSavable(ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
    }
}
