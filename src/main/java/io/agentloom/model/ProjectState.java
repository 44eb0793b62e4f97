package io.agentloom.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One project's shared state. Instances are immutable; every change produces a new
 * value through the {@code with*} methods.
 */
public record ProjectState(
        String projectId,
        String projectName,
        String ownerId,
        Phase phase,
        Map<String, AgentContextPointer> agentContextPointers,
        Map<String, Map<String, Object>> livingDocuments,
        Map<String, Map<String, Object>> codeArtifacts,
        KnowledgeBase knowledgeBase,
        List<String> blockers,
        List<String> completedMilestones,
        Instant lastUpdated
) {
    public ProjectState {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId cannot be empty");
        }
        phase = phase == null ? Phase.IDEATION : phase;
        agentContextPointers = agentContextPointers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(agentContextPointers));
        livingDocuments = freezeRecords(livingDocuments);
        codeArtifacts = freezeRecords(codeArtifacts);
        knowledgeBase = knowledgeBase == null ? KnowledgeBase.empty() : knowledgeBase;
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
        completedMilestones = completedMilestones == null ? List.of() : List.copyOf(completedMilestones);
        lastUpdated = lastUpdated == null ? Instant.EPOCH : lastUpdated;
    }

    public static ProjectState initial(String projectId, Instant now) {
        return new ProjectState(
                projectId,
                null,
                null,
                Phase.IDEATION,
                Map.of(),
                Map.of(),
                Map.of(),
                KnowledgeBase.empty(),
                List.of(),
                List.of(),
                now
        );
    }

    public AgentContextPointer pointerFor(String role) {
        AgentContextPointer pointer = agentContextPointers.get(role);
        return pointer == null ? AgentContextPointer.empty() : pointer;
    }

    public ProjectState withPhase(Phase next, Instant now) {
        return new ProjectState(projectId, projectName, ownerId, next, agentContextPointers, livingDocuments,
                codeArtifacts, knowledgeBase, blockers, completedMilestones, now);
    }

    public ProjectState withProjectName(String name, Instant now) {
        return new ProjectState(projectId, name, ownerId, phase, agentContextPointers, livingDocuments,
                codeArtifacts, knowledgeBase, blockers, completedMilestones, now);
    }

    public ProjectState withOwner(String owner, Instant now) {
        return new ProjectState(projectId, projectName, owner, phase, agentContextPointers, livingDocuments,
                codeArtifacts, knowledgeBase, blockers, completedMilestones, now);
    }

    public ProjectState withDocument(String name, Map<String, Object> partial, Instant now) {
        return new ProjectState(projectId, projectName, ownerId, phase, agentContextPointers,
                mergeRecord(livingDocuments, name, partial), codeArtifacts, knowledgeBase, blockers,
                completedMilestones, now);
    }

    public ProjectState withCodeArtifact(String name, Map<String, Object> partial, Instant now) {
        return new ProjectState(projectId, projectName, ownerId, phase, agentContextPointers, livingDocuments,
                mergeRecord(codeArtifacts, name, partial), knowledgeBase, blockers, completedMilestones, now);
    }

    public ProjectState withAgentContext(String role, AgentContextUpdate update, Instant now) {
        Map<String, AgentContextPointer> next = new LinkedHashMap<>(agentContextPointers);
        next.put(role, pointerFor(role).merge(update));
        return new ProjectState(projectId, projectName, ownerId, phase, next, livingDocuments, codeArtifacts,
                knowledgeBase, blockers, completedMilestones, now);
    }

    public ProjectState withGuideline(Guideline guideline, Instant now) {
        return new ProjectState(projectId, projectName, ownerId, phase, agentContextPointers, livingDocuments,
                codeArtifacts, knowledgeBase.append(guideline), blockers, completedMilestones, now);
    }

    public ProjectState withBlockers(List<String> nextBlockers, Instant now) {
        return new ProjectState(projectId, projectName, ownerId, phase, agentContextPointers, livingDocuments,
                codeArtifacts, knowledgeBase, nextBlockers, completedMilestones, now);
    }

    public ProjectState withMilestone(String milestone, Instant now) {
        List<String> next = new ArrayList<>(completedMilestones);
        next.add(milestone);
        return new ProjectState(projectId, projectName, ownerId, phase, agentContextPointers, livingDocuments,
                codeArtifacts, knowledgeBase, blockers, next, now);
    }

    private static Map<String, Map<String, Object>> mergeRecord(
            Map<String, Map<String, Object>> records,
            String name,
            Map<String, Object> partial
    ) {
        Map<String, Map<String, Object>> next = new LinkedHashMap<>(records);
        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, Object> existing = records.get(name);
        if (existing != null) {
            merged.putAll(existing);
        }
        if (partial != null) {
            merged.putAll(partial);
        }
        next.put(name, merged);
        return next;
    }

    private static Map<String, Map<String, Object>> freezeRecords(Map<String, Map<String, Object>> records) {
        if (records == null || records.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        records.forEach((name, fields) -> out.put(
                name,
                fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields))
        ));
        return Collections.unmodifiableMap(out);
    }
}
