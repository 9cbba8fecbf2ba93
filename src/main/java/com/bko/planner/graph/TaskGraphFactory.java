package com.bko.planner.graph;

import com.bko.planner.resolver.Archetype;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.bko.planner.graph.TaskType.CLINICAL_REVIEW_PLAN;
import static com.bko.planner.graph.TaskType.EVENT_SUMMARY;
import static com.bko.planner.graph.TaskType.FOLLOWUP_QUESTIONS;
import static com.bko.planner.graph.TaskType.MULTI_ARCHETYPE_SYNTHESIS;
import static com.bko.planner.graph.TaskType.SIGNAL_ENRICHMENT;
import static com.bko.planner.graph.TaskType.SUMMARY_20_80;

/**
 * Builds the task graph for a plan request from the per-archetype task catalog.
 */
@Service
@Slf4j
public class TaskGraphFactory {

    public static final String SYNTHESIS_NODE_ID = "synthesis:" + MULTI_ARCHETYPE_SYNTHESIS.key();

    private static final LaneTemplate FULL_AUDIT = new LaneTemplate(
            List.of(SIGNAL_ENRICHMENT, EVENT_SUMMARY, SUMMARY_20_80, FOLLOWUP_QUESTIONS, CLINICAL_REVIEW_PLAN),
            Map.of(EVENT_SUMMARY, List.of(SIGNAL_ENRICHMENT),
                    SUMMARY_20_80, List.of(EVENT_SUMMARY),
                    FOLLOWUP_QUESTIONS, List.of(EVENT_SUMMARY),
                    CLINICAL_REVIEW_PLAN, List.of(EVENT_SUMMARY)));

    private static final LaneTemplate REVIEW = new LaneTemplate(
            List.of(SIGNAL_ENRICHMENT, EVENT_SUMMARY, FOLLOWUP_QUESTIONS, CLINICAL_REVIEW_PLAN),
            Map.of(EVENT_SUMMARY, List.of(SIGNAL_ENRICHMENT),
                    FOLLOWUP_QUESTIONS, List.of(EVENT_SUMMARY),
                    CLINICAL_REVIEW_PLAN, List.of(EVENT_SUMMARY)));

    private static final LaneTemplate EXTRACTION = new LaneTemplate(
            List.of(SIGNAL_ENRICHMENT, EVENT_SUMMARY),
            Map.of(EVENT_SUMMARY, List.of(SIGNAL_ENRICHMENT)));

    public TaskGraph build(String graphId, List<Archetype> lanes) {
        if (lanes == null || lanes.isEmpty()) {
            throw new IllegalArgumentException("At least one archetype is required to build a task graph.");
        }
        Set<Archetype> distinct = new LinkedHashSet<>(lanes);
        if (distinct.size() == 1) {
            Archetype archetype = distinct.iterator().next();
            TaskGraph graph = new TaskGraph(graphId, templateFor(archetype).nodes(null));
            log.info("Built single-lane graph {} for {} with {} tasks.", graphId, archetype.key(), graph.size());
            return graph;
        }

        List<TaskNode> nodes = new ArrayList<>();
        Set<String> laneTerminals = new LinkedHashSet<>();
        for (Archetype archetype : distinct) {
            LaneTemplate template = templateFor(archetype);
            String prefix = archetype.laneId();
            nodes.addAll(template.nodes(prefix));
            laneTerminals.add(prefixed(prefix, template.firstTerminal()));
        }
        nodes.add(new TaskNode(SYNTHESIS_NODE_ID, MULTI_ARCHETYPE_SYNTHESIS, laneTerminals));
        TaskGraph graph = new TaskGraph(graphId, nodes);
        log.info("Built multi-lane graph {} with lanes {} and {} tasks.", graphId, distinct, graph.size());
        return graph;
    }

    LaneTemplate templateFor(Archetype archetype) {
        return switch (archetype) {
            case PROCESS_AUDITOR, DELAY_DRIVER_PROFILER -> FULL_AUDIT;
            case PREVENTABILITY_DETECTIVE, PREVENTABILITY_DETECTIVE_METRIC, OUTCOME_TRACKER -> REVIEW;
            case EXCLUSION_HUNTER, DATA_SCAVENGER -> EXTRACTION;
        };
    }

    private static String prefixed(String prefix, TaskType type) {
        return prefix == null ? type.key() : prefix + ":" + type.key();
    }

    record LaneTemplate(List<TaskType> types, Map<TaskType, List<TaskType>> dependencies) {

        List<TaskNode> nodes(String prefix) {
            return types.stream()
                    .map(type -> {
                        Set<String> deps = new LinkedHashSet<>();
                        dependencies.getOrDefault(type, List.of()).forEach(dep -> deps.add(prefixed(prefix, dep)));
                        return new TaskNode(prefixed(prefix, type), type, deps);
                    })
                    .toList();
        }

        /**
         * First task in declaration order that nothing else in the lane depends on.
         */
        TaskType firstTerminal() {
            return types.stream()
                    .filter(type -> dependencies.values().stream().noneMatch(deps -> deps.contains(type)))
                    .findFirst()
                    .orElse(types.get(types.size() - 1));
        }
    }
}
