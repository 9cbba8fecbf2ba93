package com.bko.planner.plan;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.ExecutionContext;
import com.bko.planner.execution.ExecutionResult;
import com.bko.planner.execution.GenerationException;
import com.bko.planner.execution.TaskExecutor;
import com.bko.planner.graph.TaskGraph;
import com.bko.planner.graph.TaskGraphFactory;
import com.bko.planner.quality.QualityAssessmentService;
import com.bko.planner.quality.QualityVerdict;
import com.bko.planner.resolver.Archetype;
import com.bko.planner.resolver.ArchetypeResolver;
import com.bko.planner.resolver.ResolvedContext;
import com.bko.planner.storage.ArtifactStorageException;
import com.bko.planner.storage.ArtifactStore;
import com.bko.planner.validation.ValidationCoupler;
import com.bko.planner.validation.ValidationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanGenerationService {

    static final String STRICT_FAILURE_SUFFIX = ". Strict mode enforces strict compliance with no auto-filling";

    private final ArchetypeResolver archetypeResolver;
    private final TaskGraphFactory graphFactory;
    private final TaskExecutor taskExecutor;
    private final PlanAssembler planAssembler;
    private final TemplatePlanFactory templatePlanFactory;
    private final QualityAssessmentService qualityAssessmentService;
    private final ValidationCoupler validationCoupler;
    private final PlanIdGenerator planIdGenerator;
    private final ArtifactStore artifactStore;
    private final PlannerProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Resolves the concern, runs the task graph, assembles, scores and validates the plan.
     * Generation-call failures fall back to a template plan unless strict mode is on; task
     * validation failures and missing inputs always propagate.
     */
    public PlanGenerationResult generate(PlanRequest request) {
        if (request == null || !StringUtils.hasText(request.concernId())) {
            throw new IllegalArgumentException("A concern id is required to generate a plan.");
        }
        boolean strict = request.strict() != null ? request.strict() : properties.isStrictMode();
        ResolvedContext resolved = archetypeResolver.resolve(request.concernId(), request.domainHint());
        List<Archetype> lanes = archetypeResolver.deriveLanes(resolved.archetype(), request.riskFactors());
        String planId = planIdGenerator.generate(request.concernId(), resolved.domain());
        log.info("Generating plan {} for concern {} ({} / {}, lanes={}, strict={}).", planId, request.concernId(),
                resolved.domain().label(), resolved.archetype().key(), lanes.size(), strict);

        TaskGraph graph = graphFactory.build(planId, lanes);
        ExecutionContext context = new ExecutionContext(planId, request.concernId(), resolved, request.narrative(),
                properties.getGeneration().getTimeout(), Map.of());

        List<String> warnings = new ArrayList<>();
        ClinicalPlan draft;
        List<String> executionOrder;
        boolean fallback = false;
        try {
            ExecutionResult execution = taskExecutor.execute(graph, context);
            executionOrder = execution.executionOrder();
            draft = planAssembler.assemble(planId, request, resolved, lanes, execution);
        } catch (GenerationException ex) {
            if (strict) {
                log.error("Strict generation of plan {} failed during {}: {}", planId, ex.getPurpose(), ex.getMessage());
                throw new PlanGenerationException("Plan generation failed: " + ex.getMessage() + STRICT_FAILURE_SUFFIX, ex);
            }
            log.warn("Generation of plan {} failed during {}; using template fallback: {}", planId, ex.getPurpose(),
                    ex.getMessage());
            warnings.add("LLM generation failed (" + ex.getMessage()
                    + "). Using template-based fallback with placeholder data.");
            draft = templatePlanFactory.create(planId, request, resolved, lanes);
            executionOrder = List.of();
            fallback = true;
        }

        QualityVerdict verdict = qualityAssessmentService.assess(draft);
        ClinicalPlan plan = draft.withQuality(verdict.toSummary());
        PlanDocument document = new PlanDocument.V9(objectMapper.valueToTree(plan), plan);
        ValidationResult validation = validationCoupler.validate(document, verdict);
        PlanGenerationResult result = new PlanGenerationResult(plan, verdict, validation, executionOrder, fallback,
                warnings);
        persist(result);
        log.info("Plan {} scored {} (grade {}, deploymentReady={}, valid={}).", planId,
                String.format("%.3f", verdict.overallScore()), verdict.grade(), verdict.deploymentReady(),
                validation.valid());
        return result;
    }

    private void persist(PlanGenerationResult result) {
        String directory = "plans/" + result.plan().planId() + "/";
        try {
            artifactStore.writeJson(directory + "plan.json", result.plan());
            artifactStore.writeJson(directory + "verdict.json", result.verdict());
            artifactStore.writeJson(directory + "validation.json", result.validation());
        } catch (ArtifactStorageException ex) {
            log.warn("Unable to persist plan {}: {}", result.plan().planId(), ex.getMessage());
        }
    }
}
