package com.bko.planner.refinement;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.ExecutionContext;
import com.bko.planner.execution.ExecutionResult;
import com.bko.planner.execution.GenerationException;
import com.bko.planner.execution.TaskExecutionException;
import com.bko.planner.execution.TaskExecutor;
import com.bko.planner.execution.TaskOutput;
import com.bko.planner.graph.TaskGraph;
import com.bko.planner.graph.TaskGraphFactory;
import com.bko.planner.graph.TaskNode;
import com.bko.planner.graph.TaskType;
import com.bko.planner.resolver.ArchetypeResolver;
import com.bko.planner.resolver.ResolvedContext;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a prompt variant by running each case's task graph with the variant as the prompt
 * override. A case whose run fails scores as if it produced nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationBatchEvaluator implements BatchEvaluator {

    static final Set<TaskType> SCORED_TASK_TYPES = EnumSet.of(TaskType.SIGNAL_ENRICHMENT, TaskType.EVENT_SUMMARY,
            TaskType.SUMMARY_20_80, TaskType.FOLLOWUP_QUESTIONS);

    private final ArchetypeResolver archetypeResolver;
    private final TaskGraphFactory graphFactory;
    private final TaskExecutor taskExecutor;
    private final SafeScorer safeScorer;
    private final PlannerProperties properties;

    @Override
    public void checkTarget(EvaluationBatch batch, RefinementKey key) {
        if (!SCORED_TASK_TYPES.contains(key.taskType())) {
            throw new IllegalArgumentException("Task type " + key.taskType().key()
                    + " has no scored output; refinable types are " + SCORED_TASK_TYPES.stream().map(TaskType::key).toList());
        }
        for (EvaluationCase evaluationCase : batch.cases()) {
            TaskGraph graph = graphFor(batch, evaluationCase, key);
            boolean present = graph.getNodes().stream().anyMatch(node -> node.type() == key.taskType());
            if (!present) {
                throw new IllegalArgumentException("Task type " + key.taskType().key() + " does not run for evaluation case "
                        + evaluationCase.testId() + " (graph " + graph.getNodes().stream().map(TaskNode::id).toList() + ")");
            }
        }
    }

    @Override
    public BatchScore evaluate(EvaluationBatch batch, RefinementKey key, String candidatePrompt) {
        Map<String, CaseOutput> outputs = new LinkedHashMap<>();
        for (EvaluationCase evaluationCase : batch.cases()) {
            outputs.put(evaluationCase.testId(), run(batch, evaluationCase, key, candidatePrompt));
        }
        BatchScore score = safeScorer.scoreBatch(batch, outputs, properties.getRefinement().isStrictScoring());
        log.info("Batch {} v{} scored {} for {}.", batch.batchId(), batch.version(),
                String.format("%.3f", score.score()), key.slug());
        return score;
    }

    private CaseOutput run(EvaluationBatch batch, EvaluationCase evaluationCase, RefinementKey key, String prompt) {
        String concernId = concernId(evaluationCase, key);
        TaskGraph graph = graphFor(batch, evaluationCase, key);
        ExecutionContext context = new ExecutionContext(graph.getGraphId(), concernId,
                archetypeResolver.resolve(concernId, null), evaluationCase.patientPayload(),
                properties.getGeneration().getTimeout(), Map.of(key.taskType(), prompt));
        try {
            return toCaseOutput(evaluationCase.testId(), taskExecutor.execute(graph, context));
        } catch (GenerationException | TaskExecutionException ex) {
            log.warn("Evaluation case {} failed and scores as empty output: {}", evaluationCase.testId(), ex.getMessage());
            return CaseOutput.empty(evaluationCase.testId());
        }
    }

    private TaskGraph graphFor(EvaluationBatch batch, EvaluationCase evaluationCase, RefinementKey key) {
        ResolvedContext resolved = archetypeResolver.resolve(concernId(evaluationCase, key), null);
        return graphFactory.build("eval_" + batch.batchId() + "_" + evaluationCase.testId(), List.of(resolved.archetype()));
    }

    private static String concernId(EvaluationCase evaluationCase, RefinementKey key) {
        return StringUtils.hasText(evaluationCase.concernId()) ? evaluationCase.concernId() : key.concernId();
    }

    static CaseOutput toCaseOutput(String testId, ExecutionResult result) {
        List<String> signals = new ArrayList<>();
        for (TaskOutput output : result.outputsOfType(TaskType.SIGNAL_ENRICHMENT)) {
            for (JsonNode group : output.payload().path("signal_groups")) {
                group.path("signals").forEach(signal -> signals.add(signal.path("signal_id").asText("")));
            }
        }
        StringBuilder summary = new StringBuilder();
        result.outputsOfType(TaskType.EVENT_SUMMARY)
                .forEach(output -> summary.append(output.payload().path("event_summary").asText("")).append('\n'));
        result.outputsOfType(TaskType.SUMMARY_20_80)
                .forEach(output -> summary.append(output.payload().path("result").asText("")).append('\n'));
        List<String> questions = new ArrayList<>();
        result.outputsOfType(TaskType.FOLLOWUP_QUESTIONS)
                .forEach(output -> output.payload().path("followup_questions")
                        .forEach(question -> questions.add(question.asText(""))));
        return new CaseOutput(testId, signals, summary.toString().trim(), questions);
    }
}
