package com.bko.planner.execution;

import static com.bko.planner.execution.PlannerConstants.*;

import com.bko.planner.graph.TaskNode;
import com.bko.planner.graph.TaskType;
import com.bko.planner.resolver.Archetype;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class TaskPromptService {

    private static final Map<TaskType, String> TASK_PROMPTS = Map.of(
            TaskType.SIGNAL_ENRICHMENT, SIGNAL_ENRICHMENT_PROMPT,
            TaskType.EVENT_SUMMARY, EVENT_SUMMARY_PROMPT,
            TaskType.SUMMARY_20_80, SUMMARY_20_80_PROMPT,
            TaskType.FOLLOWUP_QUESTIONS, FOLLOWUP_QUESTIONS_PROMPT,
            TaskType.CLINICAL_REVIEW_PLAN, CLINICAL_REVIEW_PLAN_PROMPT,
            TaskType.MULTI_ARCHETYPE_SYNTHESIS, SYNTHESIS_DRAFT_PROMPT);

    private static final Map<TaskType, String> SCHEMAS = Map.of(
            TaskType.SIGNAL_ENRICHMENT, SIGNAL_ENRICHMENT_SCHEMA,
            TaskType.EVENT_SUMMARY, EVENT_SUMMARY_SCHEMA,
            TaskType.FOLLOWUP_QUESTIONS, FOLLOWUP_QUESTIONS_SCHEMA,
            TaskType.MULTI_ARCHETYPE_SYNTHESIS, SYNTHESIS_SCHEMA);

    private final JsonProcessingService jsonProcessingService;

    public String defaultTaskPrompt(TaskType type) {
        return TASK_PROMPTS.get(type);
    }

    public String taskPrompt(TaskType type, Map<TaskType, String> overrides) {
        String override = overrides.get(type);
        return StringUtils.hasText(override) ? override : defaultTaskPrompt(type);
    }

    public @Nullable String schemaFor(TaskType type) {
        return SCHEMAS.get(type);
    }

    public String systemPrompt(TaskType type, Archetype archetype, ExecutionContext context) {
        return TASK_SYSTEM_TEMPLATE.formatted(
                context.resolved().domain().label(),
                archetype.key(),
                context.concernId(),
                taskPrompt(type, context.promptOverrides()));
    }

    public String verifySystemPrompt(Archetype archetype, ExecutionContext context, JsonNode draft) {
        return TASK_SYSTEM_TEMPLATE.formatted(
                context.resolved().domain().label(),
                archetype.key(),
                context.concernId(),
                SYNTHESIS_VERIFY_PROMPT.formatted(jsonProcessingService.toJson(draft)));
    }

    /**
     * User prompt for a task: the narrative plus the outputs of the task's direct dependencies.
     * The synthesis task instead receives every lane's extraction and summary findings.
     */
    public String userPrompt(TaskNode node, ExecutionContext context, Map<String, TaskOutput> outputs) {
        String narrative = context.hasNarrative() ? context.narrative() : NO_NARRATIVE;
        Map<String, JsonNode> upstream = new LinkedHashMap<>();
        if (node.type() == TaskType.MULTI_ARCHETYPE_SYNTHESIS) {
            outputs.values().stream()
                    .filter(output -> output.type() == TaskType.SIGNAL_ENRICHMENT || output.type() == TaskType.EVENT_SUMMARY)
                    .forEach(output -> upstream.put(output.taskId(), output.payload()));
        } else {
            node.dependencies().stream()
                    .sorted()
                    .filter(outputs::containsKey)
                    .forEach(dep -> upstream.put(dep, outputs.get(dep).payload()));
        }
        String upstreamText = upstream.isEmpty() ? NO_PRIOR_OUTPUT : jsonProcessingService.toJson(upstream);
        return TASK_USER_TEMPLATE.formatted(narrative, upstreamText);
    }

    public Map<String, String> taskPromptsByKey(Map<TaskType, String> overrides) {
        Map<String, String> prompts = new LinkedHashMap<>();
        for (TaskType type : TaskType.values()) {
            prompts.put(type.key(), taskPrompt(type, overrides).trim());
        }
        return prompts;
    }
}
