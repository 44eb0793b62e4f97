package io.agentloom.worker;

import io.agentloom.bus.EventBus;
import io.agentloom.event.ActionFailed;
import io.agentloom.event.EventType;
import io.agentloom.event.GuidelineAdded;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.Guideline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Turns reported failures into knowledge-base guidelines. Failures are queued by the
 * bus handler and handled one per {@link #act()}.
 */
public final class GuidelineLearner extends AbstractWorker {
    public static final String DEFAULT_ROLE = "guideline_learner";
    private static final Logger log = LoggerFactory.getLogger(GuidelineLearner.class);

    private final GuidelineSource source;
    private final Queue<ActionFailed> failures = new ConcurrentLinkedQueue<>();

    public GuidelineLearner(ProjectMemory memory, EventBus bus, GuidelineSource source) {
        this(DEFAULT_ROLE, memory, bus, source);
    }

    public GuidelineLearner(String role, ProjectMemory memory, EventBus bus, GuidelineSource source) {
        super(role, memory, bus);
        if (source == null) {
            throw new IllegalArgumentException("guideline source must not be null");
        }
        this.source = source;
    }

    @Override
    public void initialize() {
        on(EventType.ACTION_FAILED, event -> failures.add(event.payload(ActionFailed.class)));
    }

    public int pendingFailures() {
        return failures.size();
    }

    @Override
    public boolean act() {
        ActionFailed failure = failures.poll();
        if (failure == null) {
            return false;
        }
        String proposal;
        try {
            proposal = source.propose(failure, memory.snapshot());
        } catch (Exception e) {
            log.warn("Guideline source failed for action '{}': {}", failure.action(), e.getMessage());
            return false;
        }
        Optional<Guideline> guideline = GuidelineParser.parse(proposal);
        if (guideline.isEmpty()) {
            log.warn("Discarded guideline proposal for action '{}'", failure.action());
            return false;
        }
        memory.addGuideline(guideline.get());
        emit(EventType.NEW_GUIDELINE, new GuidelineAdded(guideline.get()));
        log.info("Learned guideline for trigger '{}'", guideline.get().trigger());
        return true;
    }
}
