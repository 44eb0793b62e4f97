/**
 * Process-level wiring.
 *
 * <p>{@link io.agentloom.runtime.LoomRuntime} chooses the project store from settings,
 * opens the bus and sandbox, and assembles the worker roster before handing control to
 * the coordinator.
 */
package io.agentloom.runtime;
