package io.agentloom.coordinator;

import io.agentloom.bus.EventBus;
import io.agentloom.bus.InProcessEventBus;
import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventHandler;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.AgentContextUpdate;
import io.agentloom.model.ProjectState;
import io.agentloom.storage.InMemoryProjectStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;

final class CoordinatorTest {

    @Test
    void busyProjectOnlyLetsTheWorkingWorkerAct() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();

        StubWorker a = new StubWorker("a", calls);
        a.then(() -> {
            memory.updateAgentContext("a", AgentContextUpdate.working("step 1"));
            return true;
        });
        a.then(() -> {
            memory.updateAgentContext("a", AgentContextUpdate.idle());
            return true;
        });
        StubWorker b = new StubWorker("b", calls);
        b.then(() -> true);
        StubWorker c = new StubWorker("c", calls);

        coordinator.register(a);
        coordinator.register(b);
        coordinator.register(c);

        TickOutcome first = coordinator.tick();
        Assertions.assertEquals("a", first.actedRole());

        TickOutcome second = coordinator.tick();
        Assertions.assertEquals("a", second.actedRole());
        Assertions.assertEquals(List.of(), second.skippedRoles());

        TickOutcome third = coordinator.tick();
        Assertions.assertEquals("b", third.actedRole());

        Assertions.assertEquals(List.of("a", "a", "a", "b"), calls);
    }

    @Test
    void atMostOnePointerIsWorkingAfterEveryTick() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> violations = new ArrayList<>();
        PointerWorker a = new PointerWorker("a", memory, 1, 1, violations);
        PointerWorker b = new PointerWorker("b", memory, 0, 0, violations);
        PointerWorker c = new PointerWorker("c", memory, 1, 1, violations);
        b.resumeWorking(3);
        coordinator.register(a);
        coordinator.register(b);
        coordinator.register(c);

        List<String> acted = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            TickOutcome outcome = coordinator.tick();
            acted.add(outcome.actedRole());
            long working = memory.snapshot().agentContextPointers().values().stream()
                    .filter(pointer -> pointer.currentlyWorkingOn().working())
                    .count();
            Assertions.assertTrue(working <= 1, "tick " + outcome.iteration() + " left " + working + " working");
        }

        Assertions.assertEquals(List.of(), violations);
        Assertions.assertEquals(
                Arrays.asList("b", "b", "b", "a", "a", "c", "c", null, null, null),
                acted
        );
    }

    @Test
    void idleWorkersAreSkippedWhileAnotherWorks() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        memory.updateAgentContext("c", AgentContextUpdate.working("long task"));
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();
        coordinator.register(new StubWorker("a", calls));
        coordinator.register(new StubWorker("b", calls));
        coordinator.register(new StubWorker("c", calls));

        TickOutcome outcome = coordinator.tick();

        Assertions.assertEquals(List.of("c"), calls);
        Assertions.assertEquals(List.of("a", "b"), outcome.skippedRoles());
        Assertions.assertFalse(outcome.acted());
    }

    @Test
    void tickStopsAtFirstWorkerThatActs() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();
        StubWorker a = new StubWorker("a", calls);
        a.then(() -> false);
        StubWorker b = new StubWorker("b", calls);
        b.then(() -> true);
        StubWorker c = new StubWorker("c", calls);
        c.then(() -> true);
        coordinator.register(a);
        coordinator.register(b);
        coordinator.register(c);

        TickOutcome outcome = coordinator.tick();

        Assertions.assertEquals("b", outcome.actedRole());
        Assertions.assertEquals(List.of("a", "b"), calls);
    }

    @Test
    void throwingWorkerIsIsolated() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();
        StubWorker a = new StubWorker("a", calls);
        a.then(() -> {
            throw new IllegalStateException("llm timeout");
        });
        StubWorker b = new StubWorker("b", calls);
        b.then(() -> true);
        coordinator.register(a);
        coordinator.register(b);

        TickOutcome outcome = coordinator.tick();

        Assertions.assertEquals(List.of("a"), outcome.faultedRoles());
        Assertions.assertEquals("b", outcome.actedRole());
    }

    @Test
    void concurrentWorkingPointersFromLegacyStateCanAllAct() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        memory.updateAgentContext("a", AgentContextUpdate.working("x"));
        memory.updateAgentContext("b", AgentContextUpdate.working("y"));
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();
        coordinator.register(new StubWorker("a", calls));
        coordinator.register(new StubWorker("b", calls));

        coordinator.tick();

        Assertions.assertEquals(List.of("a", "b"), calls);
    }

    @Test
    void busyStateIsRecheckedForEachWorker() {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();
        StubWorker a = new StubWorker("a", calls);
        a.then(() -> {
            memory.updateAgentContext("a", AgentContextUpdate.working("started, no change reported"));
            return false;
        });
        coordinator.register(a);
        coordinator.register(new StubWorker("b", calls));

        TickOutcome outcome = coordinator.tick();

        Assertions.assertEquals(List.of("a"), calls);
        Assertions.assertEquals(List.of("b"), outcome.skippedRoles());
    }

    @Test
    void eachTickDrainsPendingBusEvents() {
        CountingBus bus = new CountingBus();
        Coordinator coordinator = new Coordinator(
                new ProjectMemory("p1", new InMemoryProjectStore()), bus, 0L, ms -> { });

        coordinator.tick();
        TickOutcome second = coordinator.tick();

        Assertions.assertEquals(2, bus.dispatchCalls);
        Assertions.assertEquals(7, second.dispatchedEvents());
        Assertions.assertEquals(2L, second.iteration());
    }

    @Test
    void runHonoursIterationLimitAndSleepsBetweenTicks() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        Coordinator coordinator = new Coordinator(
                new ProjectMemory("p1", new InMemoryProjectStore()), new InProcessEventBus(), 500L, sleeps::add);
        List<String> calls = new ArrayList<>();
        coordinator.register(new StubWorker("a", calls));

        coordinator.run(3);

        Assertions.assertEquals(3L, coordinator.iterations());
        Assertions.assertEquals(List.of(500L, 500L), sleeps);
        Assertions.assertEquals(3, calls.size());
        Assertions.assertFalse(coordinator.isRunning());
    }

    @Test
    void stopEndsUnboundedRunAfterCurrentTick() throws Exception {
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, new InProcessEventBus(), 0L, ms -> { });
        List<String> calls = new ArrayList<>();
        StubWorker a = new StubWorker("a", calls);
        a.then(() -> false);
        a.then(() -> {
            coordinator.stop();
            return false;
        });
        coordinator.register(a);

        coordinator.run(0);

        Assertions.assertEquals(2L, coordinator.iterations());
    }

    @Test
    void registrationInitializesOnceAndRejectsDuplicates() {
        Coordinator coordinator = new Coordinator(
                new ProjectMemory("p1", new InMemoryProjectStore()), new InProcessEventBus(), 0L, ms -> { });
        StubWorker a = new StubWorker("a", new ArrayList<>());
        coordinator.register(a);

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> coordinator.register(new StubWorker("a", new ArrayList<>())));
        Assertions.assertEquals(1, a.initializations);
        Assertions.assertEquals(List.of("a"), coordinator.roles());
    }

    private static final class StubWorker implements Worker {
        private final String role;
        private final List<String> calls;
        private final Deque<Callable<Boolean>> script = new ArrayDeque<>();
        int initializations;

        StubWorker(String role, List<String> calls) {
            this.role = role;
            this.calls = calls;
        }

        StubWorker then(Callable<Boolean> step) {
            script.add(step);
            return this;
        }

        @Override
        public String role() {
            return role;
        }

        @Override
        public void initialize() {
            initializations++;
        }

        @Override
        public boolean act() throws Exception {
            calls.add(role);
            Callable<Boolean> step = script.poll();
            return step != null && step.call();
        }
    }

    /**
     * Starts a task when idle (while it has rounds left), then needs {@code steps} more
     * ticks with its own pointer WORKING to finish it.
     */
    private static final class PointerWorker implements Worker {
        private final String role;
        private final ProjectMemory memory;
        private final int steps;
        private final List<String> violations;
        private int rounds;
        private int stepsLeft;

        PointerWorker(String role, ProjectMemory memory, int rounds, int steps, List<String> violations) {
            this.role = role;
            this.memory = memory;
            this.rounds = rounds;
            this.steps = steps;
            this.violations = violations;
        }

        void resumeWorking(int remaining) {
            stepsLeft = remaining;
            memory.updateAgentContext(role, AgentContextUpdate.working(role + " task"));
        }

        @Override
        public String role() {
            return role;
        }

        @Override
        public void initialize() {
        }

        @Override
        public boolean act() {
            ProjectState state = memory.snapshot();
            boolean mine = state.pointerFor(role).currentlyWorkingOn().working();
            state.agentContextPointers().forEach((other, pointer) -> {
                if (!other.equals(role) && pointer.currentlyWorkingOn().working()) {
                    violations.add(role + " called while " + other + " works");
                }
            });
            if (mine) {
                stepsLeft--;
                if (stepsLeft <= 0) {
                    memory.updateAgentContext(role, AgentContextUpdate.idle());
                }
                return true;
            }
            if (rounds > 0) {
                rounds--;
                resumeWorking(steps);
                return true;
            }
            return false;
        }
    }

    private static final class CountingBus implements EventBus {
        int dispatchCalls;

        @Override
        public void subscribe(EventType type, EventHandler handler) {
        }

        @Override
        public AgentEvent emit(EventType type, String emittedBy, EventPayload payload) {
            return AgentEvent.create(type, emittedBy, payload);
        }

        @Override
        public int dispatchPending() {
            dispatchCalls++;
            return 7;
        }
    }
}
