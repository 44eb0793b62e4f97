package io.agentloom.sandbox;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Minimal container-engine operations used by {@link ExecutionSandbox}. Failures are
 * reported as unchecked exceptions.
 */
public interface ContainerRuntime extends AutoCloseable {

    boolean imageExists(String image);

    /**
     * Pulls the image and blocks until the pull has finished.
     */
    void pullImage(String image) throws InterruptedException;

    String createContainer(ContainerSpec spec);

    void startContainer(String containerId);

    /**
     * Waits for the container to exit. Empty when the deadline passed first.
     */
    OptionalInt awaitExit(String containerId, long timeoutMs) throws InterruptedException;

    ContainerLogs fetchLogs(String containerId) throws InterruptedException;

    void killContainer(String containerId);

    void removeContainer(String containerId);

    /**
     * Ids of all containers, running or not, carrying every given label.
     */
    List<String> listContainers(Map<String, String> labels);

    @Override
    void close();
}
