package com.bko.planner.execution;

import static com.bko.planner.execution.PlannerConstants.*;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.graph.TaskGraph;
import com.bko.planner.graph.TaskNode;
import com.bko.planner.graph.TaskType;
import com.bko.planner.resolver.Archetype;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a task graph sequentially in topological order. Each task sees the outputs of the tasks
 * executed before it; independent tasks are not parallelized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskExecutor {

    private final GenerationClient generationClient;
    private final TaskPromptService promptService;
    private final TaskOutputValidator outputValidator;
    private final PlannerProperties properties;
    private final PlannerMetricsService metricsService;

    public ExecutionResult execute(TaskGraph graph, ExecutionContext context) {
        List<TaskNode> order = graph.executionOrder();
        log.info("Execution {} running {} tasks of graph {}: {}.", context.executionId(), order.size(),
                graph.getGraphId(), order.stream().map(TaskNode::id).toList());

        Map<String, TaskOutput> outputs = new LinkedHashMap<>();
        for (TaskNode node : order) {
            if (node.type().requiresNarrative() && !context.hasNarrative()) {
                throw new MissingTaskInputException(node.id(), node.type());
            }
            Archetype archetype = laneArchetype(node, context);
            JsonNode payload = node.type() == TaskType.MULTI_ARCHETYPE_SYNTHESIS
                    ? runVerifiedSynthesis(node, archetype, context, outputs)
                    : runTask(node, archetype, context, outputs);
            TaskValidation validation = outputValidator.validate(node.type(), payload);
            if (!validation.passed()) {
                log.warn("Task {} failed validation: {}.", node.id(), validation.errors());
                throw new TaskValidationException(node.id(), node.type(), validation.errors().get(0));
            }
            if (!validation.warnings().isEmpty()) {
                log.info("Task {} passed validation with warnings: {}.", node.id(), validation.warnings());
            }
            outputs.put(node.id(), new TaskOutput(node.id(), node.type(), payload, validation));
        }

        List<String> missing = order.stream().map(TaskNode::id).filter(id -> !outputs.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new TaskExecutionException(missing.get(0), "Execution " + context.executionId()
                    + " finished without output for tasks " + missing);
        }
        metricsService.recordTasksExecuted(context.executionId(), outputs.size());
        return new ExecutionResult(context.executionId(), order.stream().map(TaskNode::id).toList(), outputs);
    }

    private JsonNode runTask(TaskNode node, Archetype archetype, ExecutionContext context,
                             Map<String, TaskOutput> outputs) {
        TaskType type = node.type();
        return generationClient.generate(request(
                PURPOSE_TASK_PREFIX + type.key(),
                type,
                promptService.systemPrompt(type, archetype, context),
                promptService.userPrompt(node, context, outputs),
                context,
                null));
    }

    /**
     * Draft then verify: the verify call receives the draft and must return a corrected synthesis.
     * Both outputs are validated; the verified one is kept.
     */
    private JsonNode runVerifiedSynthesis(TaskNode node, Archetype archetype, ExecutionContext context,
                                          Map<String, TaskOutput> outputs) {
        TaskType type = node.type();
        String userPrompt = promptService.userPrompt(node, context, outputs);
        JsonNode draft = generationClient.generate(request(PURPOSE_SYNTHESIS_DRAFT, type,
                promptService.systemPrompt(type, archetype, context), userPrompt, context, null));
        TaskValidation draftValidation = outputValidator.validate(type, draft);
        if (!draftValidation.passed()) {
            throw new TaskValidationException(node.id(), type, "draft " + draftValidation.errors().get(0));
        }
        log.info("Synthesis draft for {} accepted; running verification.", node.id());
        return generationClient.generate(request(PURPOSE_SYNTHESIS_VERIFY, type,
                promptService.verifySystemPrompt(archetype, context, draft), userPrompt, context, 0.3));
    }

    private GenerationRequest request(String purpose, TaskType type, String systemPrompt, String userPrompt,
                                      ExecutionContext context, Double temperatureOverride) {
        PlannerProperties.TaskModelConfig config = properties.getGeneration().getTaskConfig(type);
        return new GenerationRequest(
                purpose,
                systemPrompt,
                userPrompt,
                type.contract(),
                promptService.schemaFor(type),
                context.timeout(),
                config.getModel(),
                temperatureOverride != null ? temperatureOverride : config.getTemperature(),
                config.getMaxTokens());
    }

    private Archetype laneArchetype(TaskNode node, ExecutionContext context) {
        String lane = node.lane();
        if (lane == null) {
            return context.resolved().archetype();
        }
        return Archetype.find(lane).orElse(context.resolved().archetype());
    }
}
