package io.agentloom.sandbox;

public record ContainerLogs(String stdout, String stderr) {
    public static final ContainerLogs EMPTY = new ContainerLogs("", "");

    public ContainerLogs {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
