package com.bko.planner.graph;

import com.bko.planner.resolver.Archetype;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphFactoryTest {

    private final TaskGraphFactory factory = new TaskGraphFactory();

    @Test
    void testSingleLaneUsesUnprefixedIds() {
        TaskGraph graph = factory.build("plan_1", List.of(Archetype.PROCESS_AUDITOR));

        assertEquals(List.of("signal_enrichment", "event_summary", "summary_20_80", "followup_questions",
                "clinical_review_plan"), graph.getNodes().stream().map(TaskNode::id).toList());
        assertEquals(Set.of("event_summary"), graph.node("summary_20_80").orElseThrow().dependencies());
        assertTrue(graph.node(TaskGraphFactory.SYNTHESIS_NODE_ID).isEmpty());
    }

    @Test
    void testReviewTemplateHasNoSummary2080() {
        TaskGraph graph = factory.build("plan_2", List.of(Archetype.OUTCOME_TRACKER));

        assertEquals(4, graph.size());
        assertTrue(graph.node("summary_20_80").isEmpty());
    }

    @Test
    void testMultiLaneGraphAddsSynthesisOverLaneTerminals() {
        TaskGraph graph = factory.build("plan_3", List.of(Archetype.PROCESS_AUDITOR, Archetype.EXCLUSION_HUNTER,
                Archetype.PREVENTABILITY_DETECTIVE));

        TaskNode synthesis = graph.node(TaskGraphFactory.SYNTHESIS_NODE_ID).orElseThrow();
        assertEquals(TaskType.MULTI_ARCHETYPE_SYNTHESIS, synthesis.type());
        assertEquals(Set.of("process_auditor:summary_20_80", "exclusion_hunter:event_summary",
                "preventability_detective:followup_questions"), synthesis.dependencies());
        assertEquals(5 + 2 + 4 + 1, graph.size());
        assertEquals(TaskGraphFactory.SYNTHESIS_NODE_ID,
                graph.executionOrder().get(graph.size() - 1).id());
    }

    @Test
    void testDuplicateLanesCollapse() {
        TaskGraph graph = factory.build("plan_4", List.of(Archetype.DATA_SCAVENGER, Archetype.DATA_SCAVENGER));

        assertEquals(2, graph.size());
    }

    @Test
    void testNoLanesRejected() {
        assertThrows(IllegalArgumentException.class, () -> factory.build("plan_5", List.of()));
    }
}
