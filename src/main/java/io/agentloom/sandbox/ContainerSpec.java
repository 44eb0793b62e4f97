package io.agentloom.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Engine-neutral description of a sandbox container.
 */
public record ContainerSpec(
        String image,
        List<String> command,
        long memoryBytes,
        String networkMode,
        Path hostWorkDir,
        String containerWorkDir,
        Map<String, String> labels
) {
    public ContainerSpec {
        command = command == null ? List.of() : List.copyOf(command);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public boolean mountsWorkDir() {
        return hostWorkDir != null;
    }
}
