package io.agentloom.coordinator;

/**
 * A scheduled participant. The coordinator calls {@link #initialize()} once when the
 * worker is registered, then polls {@link #act()} on every tick it is eligible.
 */
public interface Worker {
    String role();

    /**
     * Wires bus subscriptions and any other one-time setup.
     */
    void initialize();

    /**
     * Performs at most one unit of work. Returns true when state was changed, which ends
     * the current tick.
     */
    boolean act() throws Exception;
}
