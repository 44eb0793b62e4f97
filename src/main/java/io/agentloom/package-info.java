/**
 * AgentLoom source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentloom.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentloom.runtime.LoomRuntime} wires storage, bus, sandbox and workers.</li>
 *   <li>{@code io.agentloom.coordinator.Coordinator} schedules workers one tick at a time.</li>
 *   <li>{@code io.agentloom.memory.ProjectMemory} owns the shared project state.</li>
 * </ul>
 */
package io.agentloom;
