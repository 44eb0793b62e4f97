package io.agentloom.storage;

import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;
import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One {@code <projectId>.json} file per project. Writes go to a temp file in the same
 * directory and are moved into place.
 */
public final class FileProjectStore implements ProjectStore {
    private static final Logger log = LoggerFactory.getLogger(FileProjectStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path dir;

    public FileProjectStore(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    @Override
    public Optional<ProjectState> load(String projectId, String ownerId) {
        if (!isSafeId(projectId)) {
            log.debug("No project file can exist for id {}", projectId);
            return Optional.empty();
        }
        Path file = fileFor(projectId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return ProjectAccess.authorize(read(file), ownerId);
    }

    @Override
    public void save(ProjectState state) {
        ProjectAccess.requireSavable(state);
        Path target = fileFor(state.projectId());
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, state.projectId() + ".", ".tmp");
            Files.writeString(tmp, Jsons.toJson(state));
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Failed to save project " + state.projectId() + " to " + target, e);
        }
    }

    @Override
    public List<ProjectSummary> listProjects(String ownerId) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<ProjectSummary> out = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                ProjectState state;
                try {
                    state = read(file);
                } catch (StorageException e) {
                    log.warn("Skipping unreadable project file {}: {}", file, e.getMessage());
                    continue;
                }
                if (ProjectAccess.isVisibleTo(state.ownerId(), ownerId)) {
                    out.add(ProjectSummary.of(state));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list projects in " + dir, e);
        }
        return ProjectAccess.sorted(out);
    }

    private static boolean isSafeId(String projectId) {
        return projectId != null && SAFE_ID.matcher(projectId).matches();
    }

    private Path fileFor(String projectId) {
        if (!isSafeId(projectId)) {
            throw new IllegalArgumentException("Invalid projectId for file storage: " + projectId);
        }
        return dir.resolve(projectId + ".json");
    }

    private static ProjectState read(Path file) {
        try {
            return Jsons.mapper().readValue(file.toFile(), ProjectState.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read project file " + file, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}
