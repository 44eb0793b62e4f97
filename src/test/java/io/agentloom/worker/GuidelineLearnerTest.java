package io.agentloom.worker;

import io.agentloom.bus.InProcessEventBus;
import io.agentloom.coordinator.Coordinator;
import io.agentloom.event.ActionFailed;
import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventType;
import io.agentloom.event.GuidelineAdded;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.Guideline;
import io.agentloom.storage.InMemoryProjectStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class GuidelineLearnerTest {

    @Test
    void validProposalIsAppendedAndAnnounced() {
        InProcessEventBus bus = new InProcessEventBus();
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        List<ActionFailed> asked = new ArrayList<>();
        GuidelineLearner learner = new GuidelineLearner(memory, bus, (failure, snapshot) -> {
            asked.add(failure);
            return "{\"trigger\":\"" + failure.action() + "\",\"condition\":\"always\",\"rule\":\"check inputs\"}";
        });
        learner.initialize();
        List<AgentEvent> announced = new ArrayList<>();
        bus.subscribe(EventType.NEW_GUIDELINE, announced::add);

        bus.emit(EventType.ACTION_FAILED, "qa", new ActionFailed("deploy", "timeout"));
        Assertions.assertTrue(asked.isEmpty());
        Assertions.assertEquals(1, learner.pendingFailures());

        Assertions.assertTrue(learner.act());

        List<Guideline> guidelines = memory.snapshot().knowledgeBase().guidelines();
        Assertions.assertEquals(List.of(new Guideline("deploy", "always", "check inputs")), guidelines);
        Assertions.assertEquals(1, announced.size());
        Assertions.assertEquals("deploy", announced.get(0).payload(GuidelineAdded.class).guideline().trigger());
        Assertions.assertEquals(GuidelineLearner.DEFAULT_ROLE, announced.get(0).emittedBy());
    }

    @Test
    void invalidProposalIsDiscarded() {
        InProcessEventBus bus = new InProcessEventBus();
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        GuidelineLearner learner = new GuidelineLearner(memory, bus, (failure, snapshot) -> "I cannot help");
        learner.initialize();

        bus.emit(EventType.ACTION_FAILED, "qa", new ActionFailed("build", "exit=2"));

        Assertions.assertFalse(learner.act());
        Assertions.assertTrue(memory.snapshot().knowledgeBase().guidelines().isEmpty());
        Assertions.assertEquals(0, learner.pendingFailures());
    }

    @Test
    void throwingSourceIsContained() {
        InProcessEventBus bus = new InProcessEventBus();
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        GuidelineLearner learner = new GuidelineLearner(memory, bus, (failure, snapshot) -> {
            throw new IllegalStateException("model offline");
        });
        learner.initialize();

        bus.emit(EventType.ACTION_FAILED, "qa", new ActionFailed("build", "exit=2"));

        Assertions.assertFalse(learner.act());
        Assertions.assertTrue(memory.snapshot().knowledgeBase().guidelines().isEmpty());
    }

    @Test
    void ledgerKeepsFailureOrderAcrossTicks() throws Exception {
        InProcessEventBus bus = new InProcessEventBus();
        ProjectMemory memory = new ProjectMemory("p1", new InMemoryProjectStore());
        Coordinator coordinator = new Coordinator(memory, bus, 0L, ms -> { });
        coordinator.register(new GuidelineLearner(memory, bus, (failure, snapshot) ->
                "{\"trigger\":\"" + failure.action() + "\",\"condition\":\"c\",\"rule\":\"r\"}"));

        bus.emit(EventType.ACTION_FAILED, "a", new ActionFailed("first", "e"));
        bus.emit(EventType.ACTION_FAILED, "b", new ActionFailed("second", "e"));
        coordinator.run(3);

        List<Guideline> guidelines = memory.snapshot().knowledgeBase().guidelines();
        Assertions.assertEquals(2, guidelines.size());
        Assertions.assertEquals("first", guidelines.get(0).trigger());
        Assertions.assertEquals("second", guidelines.get(1).trigger());
    }
}
