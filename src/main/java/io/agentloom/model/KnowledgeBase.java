package io.agentloom.model;

import java.util.ArrayList;
import java.util.List;

public record KnowledgeBase(List<Guideline> guidelines) {
    public KnowledgeBase {
        guidelines = guidelines == null ? List.of() : List.copyOf(guidelines);
    }

    public static KnowledgeBase empty() {
        return new KnowledgeBase(List.of());
    }

    public KnowledgeBase append(Guideline guideline) {
        List<Guideline> next = new ArrayList<>(guidelines);
        next.add(guideline);
        return new KnowledgeBase(next);
    }
}
