package com.bko.planner.plan;

import com.bko.planner.execution.ExecutionResult;
import com.bko.planner.execution.TaskOutput;
import com.bko.planner.graph.TaskType;
import com.bko.planner.resolver.Archetype;
import com.bko.planner.resolver.ResolvedContext;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a plan from task outputs. Generated sections replace the template ones; sections no task
 * produced keep their archetype defaults.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanAssembler {

    private final TemplatePlanFactory templates;

    public ClinicalPlan assemble(String planId,
                                 PlanRequest request,
                                 ResolvedContext resolved,
                                 List<Archetype> lanes,
                                 ExecutionResult result) {
        List<ClinicalConfig.SignalGroup> groups = signalGroups(result);
        List<ClinicalConfig.MetricQuestion> questions = questions(result);

        List<ClinicalConfig.ClinicalTool> tools = new ArrayList<>();
        List<ClinicalConfig.CriteriaRule> criteria = new ArrayList<>();
        for (TaskOutput output : result.outputsOfType(TaskType.CLINICAL_REVIEW_PLAN)) {
            output.payload().path("clinical_tools").forEach(tool -> tools.add(new ClinicalConfig.ClinicalTool(
                    tool.path("tool_id").asText(null), tool.path("name").asText(null),
                    tool.path("use_case").asText(null))));
            output.payload().path("review_criteria").forEach(rule -> {
                if (StringUtils.hasText(rule.path("rule_id").asText(""))) {
                    criteria.add(new ClinicalConfig.CriteriaRule(rule.path("rule_id").asText(),
                            rule.path("description").asText(null), textOrNull(rule.path("provenance"))));
                }
            });
        }
        if (criteria.isEmpty()) {
            criteria.addAll(templates.criteria(resolved.archetype()));
        }

        ClinicalConfig config = templates.config(request, resolved, lanes, groups, questions, tools, criteria);
        Provenance provenance = tools.isEmpty()
                ? null
                : new Provenance(List.of(), tools.stream().map(ClinicalConfig.ClinicalTool::name)
                        .filter(StringUtils::hasText).toList());
        log.info("Assembled plan {} with {} signal groups, {} questions and {} criteria.", planId, groups.size(),
                questions.size(), criteria.size());
        return new ClinicalPlan(templates.metadata(planId, request, resolved), config, provenance,
                rationale(resolved, lanes, result), null);
    }

    /**
     * Signal groups come from the verified synthesis when the graph had one, otherwise from the
     * extraction outputs merged by group id.
     */
    List<ClinicalConfig.SignalGroup> signalGroups(ExecutionResult result) {
        List<TaskOutput> synthesis = result.outputsOfType(TaskType.MULTI_ARCHETYPE_SYNTHESIS);
        if (!synthesis.isEmpty()) {
            return mergeGroups(List.of(synthesis.get(0).payload().path("merged_signal_groups")));
        }
        return mergeGroups(result.outputsOfType(TaskType.SIGNAL_ENRICHMENT).stream()
                .map(output -> output.payload().path("signal_groups"))
                .toList());
    }

    private List<ClinicalConfig.SignalGroup> mergeGroups(List<JsonNode> groupArrays) {
        Map<String, Map<String, ClinicalConfig.Signal>> merged = new LinkedHashMap<>();
        for (JsonNode groups : groupArrays) {
            for (JsonNode group : groups) {
                String groupId = group.path("group_id").asText("");
                if (!StringUtils.hasText(groupId)) {
                    continue;
                }
                Map<String, ClinicalConfig.Signal> signals = merged.computeIfAbsent(groupId, key -> new LinkedHashMap<>());
                for (JsonNode signal : group.path("signals")) {
                    String signalId = signal.path("signal_id").asText("");
                    if (StringUtils.hasText(signalId)) {
                        signals.putIfAbsent(signalId, new ClinicalConfig.Signal(signalId,
                                signal.path("description").asText(null),
                                signal.path("trigger_expr").asText(null),
                                textOrNull(signal.path("provenance"))));
                    }
                }
            }
        }
        List<ClinicalConfig.SignalGroup> groups = new ArrayList<>();
        merged.forEach((groupId, signals) -> groups.add(new ClinicalConfig.SignalGroup(groupId,
                TemplatePlanFactory.displayName(groupId), List.copyOf(signals.values()))));
        return groups;
    }

    List<ClinicalConfig.MetricQuestion> questions(ExecutionResult result) {
        Set<String> texts = new LinkedHashSet<>();
        for (TaskOutput output : result.outputsOfType(TaskType.FOLLOWUP_QUESTIONS)) {
            output.payload().path("followup_questions").forEach(question -> {
                String text = question.asText("").trim();
                if (!text.isEmpty()) {
                    texts.add(text);
                }
            });
        }
        List<ClinicalConfig.MetricQuestion> questions = new ArrayList<>();
        int index = 1;
        for (String text : texts) {
            questions.add(new ClinicalConfig.MetricQuestion("q" + index++, text));
        }
        return questions;
    }

    private Rationale rationale(ResolvedContext resolved, List<Archetype> lanes, ExecutionResult result) {
        String summary = result.outputsOfType(TaskType.EVENT_SUMMARY).stream()
                .map(output -> output.payload().path("event_summary").asText(""))
                .filter(StringUtils::hasText)
                .findFirst()
                .orElse(null);
        List<String> decisions = new ArrayList<>();
        decisions.add("Primary archetype " + resolved.archetype().key() + " in domain " + resolved.domain().label());
        if (lanes.size() > 1) {
            decisions.add("Analysis lanes " + lanes.stream().map(Archetype::key).toList() + " merged by synthesis");
        }
        if (resolved.fallback()) {
            decisions.add("Concern not in the archetype registry; default archetype applied");
        }
        synthesisSummary(result).ifPresent(decisions::add);
        return new Rationale(summary, decisions);
    }

    private Optional<String> synthesisSummary(ExecutionResult result) {
        return result.outputsOfType(TaskType.MULTI_ARCHETYPE_SYNTHESIS).stream()
                .map(output -> output.payload().path("synthesis_summary").asText(""))
                .filter(StringUtils::hasText)
                .findFirst();
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() || node.asText("").isBlank() ? null : node.asText();
    }
}
