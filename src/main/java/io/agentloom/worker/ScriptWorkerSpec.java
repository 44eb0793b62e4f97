package io.agentloom.worker;

/**
 * One entry of {@code workers/scripts.json}. Optional fields are null when absent.
 */
public record ScriptWorkerSpec(
        String role,
        String trigger,
        String image,
        String command,
        String workDir,
        Long timeoutMs,
        Boolean network,
        String phase,
        String successEvent,
        String task
) {
    public static ScriptWorkerSpec of(String role, String trigger, String image, String command) {
        return new ScriptWorkerSpec(role, trigger, image, command, null, null, null, null, null, null);
    }
}
