package io.agentloom.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContainerRuntime} backed by the Docker Engine API through docker-java.
 */
public final class DockerContainerRuntime implements ContainerRuntime {
    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);
    private static final long PULL_TIMEOUT_MINUTES = 10L;

    private final DockerClient client;

    public DockerContainerRuntime(DockerClient client) {
        this.client = client;
    }

    /**
     * Connects to {@code dockerHost}, or to the engine found by docker-java's default
     * discovery ({@code DOCKER_HOST}, local socket) when blank.
     */
    public static DockerContainerRuntime connect(String dockerHost) {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (dockerHost != null && !dockerHost.isBlank()) {
            builder.withDockerHost(dockerHost.trim());
        }
        DockerClientConfig config = builder.build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(32)
                .connectionTimeout(Duration.ofSeconds(10))
                .build();
        return new DockerContainerRuntime(DockerClientImpl.getInstance(config, httpClient));
    }

    public boolean ping() {
        try {
            client.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.debug("Docker engine not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean imageExists(String image) {
        try {
            client.inspectImageCmd(image).exec();
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    @Override
    public void pullImage(String image) throws InterruptedException {
        ImageReference ref = ImageReference.parse(image);
        PullImageCmd cmd = ref.digest() == null
                ? client.pullImageCmd(ref.repository()).withTag(ref.tag())
                : client.pullImageCmd(ref.canonical());
        boolean done = cmd.exec(new PullImageResultCallback())
                .awaitCompletion(PULL_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        if (!done) {
            throw new IllegalStateException("Timed out pulling image " + image);
        }
    }

    @Override
    public String createContainer(ContainerSpec spec) {
        HostConfig hostConfig = HostConfig.newHostConfig()
                .withMemory(spec.memoryBytes())
                .withNetworkMode(spec.networkMode());
        CreateContainerCmd cmd = client.createContainerCmd(spec.image())
                .withCmd(spec.command())
                .withLabels(spec.labels())
                .withTty(false)
                .withAttachStdout(true)
                .withAttachStderr(true);
        if (spec.mountsWorkDir()) {
            Volume volume = new Volume(spec.containerWorkDir());
            hostConfig.withBinds(new Bind(spec.hostWorkDir().toString(), volume, AccessMode.rw));
            cmd.withWorkingDir(spec.containerWorkDir());
        }
        return cmd.withHostConfig(hostConfig).exec().getId();
    }

    @Override
    public void startContainer(String containerId) {
        client.startContainerCmd(containerId).exec();
    }

    @Override
    public OptionalInt awaitExit(String containerId, long timeoutMs) throws InterruptedException {
        WaitContainerResultCallback callback = client.waitContainerCmd(containerId)
                .exec(new WaitContainerResultCallback());
        try {
            if (!callback.awaitCompletion(timeoutMs, TimeUnit.MILLISECONDS)) {
                return OptionalInt.empty();
            }
            Integer status = callback.awaitStatusCode();
            return OptionalInt.of(status == null ? SandboxResult.ERROR_EXIT_CODE : status);
        } finally {
            closeQuietly(callback);
        }
    }

    @Override
    public ContainerLogs fetchLogs(String containerId) throws InterruptedException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                if (frame.getStreamType() == StreamType.STDERR) {
                    stderr.append(text);
                } else {
                    stdout.append(text);
                }
            }
        };
        client.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(false)
                .exec(callback)
                .awaitCompletion();
        return new ContainerLogs(stdout.toString(), stderr.toString());
    }

    @Override
    public void killContainer(String containerId) {
        client.killContainerCmd(containerId).exec();
    }

    @Override
    public void removeContainer(String containerId) {
        try {
            client.removeContainerCmd(containerId)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec();
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        }
    }

    @Override
    public List<String> listContainers(Map<String, String> labels) {
        return client.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(labels)
                .exec()
                .stream()
                .map(Container::getId)
                .toList();
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (IOException e) {
            log.warn("Failed to close docker client: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Failed to close docker callback: {}", e.getMessage());
        }
    }
}
