package com.bko.planner.plan;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.ExecutionResult;
import com.bko.planner.execution.GenerationTimeoutException;
import com.bko.planner.execution.MissingTaskInputException;
import com.bko.planner.execution.TaskExecutor;
import com.bko.planner.execution.TaskOutput;
import com.bko.planner.graph.TaskGraphFactory;
import com.bko.planner.graph.TaskType;
import com.bko.planner.resolver.ArchetypeRegistry;
import com.bko.planner.resolver.ArchetypeResolver;
import com.bko.planner.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bko.planner.plan.PlanTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PlanGenerationServiceTest {

    @TempDir
    Path tempDir;

    private TaskExecutor taskExecutor;
    private PlanGenerationService service;

    @BeforeEach
    void setUp() {
        PlannerProperties properties = new PlannerProperties();
        properties.getStorage().setOutputDir(tempDir.toString());
        taskExecutor = mock(TaskExecutor.class);
        TemplatePlanFactory templates = templatePlanFactory();
        service = new PlanGenerationService(
                new ArchetypeResolver(new ArchetypeRegistry(properties, OBJECT_MAPPER)),
                new TaskGraphFactory(),
                taskExecutor,
                new PlanAssembler(templates),
                templates,
                qualityAssessmentService(properties),
                validationCoupler(properties),
                new PlanIdGenerator(),
                new ArtifactStore(properties, OBJECT_MAPPER),
                properties,
                OBJECT_MAPPER);
    }

    @Test
    void testGeneratedPlanIsScoredValidatedAndStored() {
        Map<String, TaskOutput> outputs = new LinkedHashMap<>();
        outputs.put("signal_enrichment", output("signal_enrichment", TaskType.SIGNAL_ENRICHMENT,
                signalGroups("signal_groups", "safety_signals", 18, "signal_")));
        outputs.put("event_summary", output("event_summary", TaskType.EVENT_SUMMARY,
                eventSummary("Central line placed on admission; fever and positive blood culture on line day 4 with "
                        + "no alternate source documented.")));
        outputs.put("followup_questions", output("followup_questions", TaskType.FOLLOWUP_QUESTIONS,
                followupQuestions("Was daily line necessity documented?")));
        outputs.put("clinical_review_plan", output("clinical_review_plan", TaskType.CLINICAL_REVIEW_PLAN, reviewPlan()));
        when(taskExecutor.execute(any(), any())).thenAnswer(invocation ->
                new ExecutionResult("exec", List.copyOf(outputs.keySet()), outputs));

        PlanGenerationResult result = service.generate(new PlanRequest("CLABSI", null, "Case narrative", null, false,
                null, "input_42"));

        assertFalse(result.templateFallback());
        assertTrue(result.warnings().isEmpty());
        assertEquals(List.copyOf(outputs.keySet()), result.executionOrder());
        assertEquals(0.965, result.verdict().overallScore(), 1e-9);
        assertTrue(result.verdict().deploymentReady());
        assertTrue(result.validation().valid());
        assertEquals("input_42", result.plan().planMetadata().planningInputId());
        assertEquals("ready", result.plan().planMetadata().status().state());
        assertEquals("A", result.plan().quality().grade());
        Path stored = tempDir.resolve("plans").resolve(result.plan().planId());
        assertTrue(Files.isRegularFile(stored.resolve("plan.json")));
        assertTrue(Files.isRegularFile(stored.resolve("verdict.json")));
        assertTrue(Files.isRegularFile(stored.resolve("validation.json")));
    }

    @Test
    void testGenerationFailureFallsBackToTemplate() {
        when(taskExecutor.execute(any(), any()))
                .thenThrow(new GenerationTimeoutException("task:signal_enrichment", Duration.ofSeconds(90)));

        PlanGenerationResult result = service.generate(new PlanRequest("CLABSI", null, "Case narrative", null, false,
                null, null));

        assertTrue(result.templateFallback());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith(
                "LLM generation failed (Generation call for task:signal_enrichment timed out after 90000 ms)"));
        assertEquals(4, result.plan().clinicalConfig().allSignals().size());
        assertEquals(0.0, result.verdict().dimension("data_feasibility").orElseThrow().score());
        assertFalse(result.verdict().deploymentReady());
        assertTrue(result.plan().planMetadata().reviewRequired());
        assertTrue(result.executionOrder().isEmpty());
    }

    @Test
    void testStrictModeRaisesInsteadOfFallingBack() {
        when(taskExecutor.execute(any(), any()))
                .thenThrow(new GenerationTimeoutException("task:signal_enrichment", Duration.ofSeconds(90)));

        PlanGenerationException ex = assertThrows(PlanGenerationException.class, () -> service.generate(
                new PlanRequest("CLABSI", null, "Case narrative", null, false, true, null)));

        assertTrue(ex.getMessage().startsWith("Plan generation failed: Generation call for task:signal_enrichment"));
        assertTrue(ex.getMessage().endsWith(PlanGenerationService.STRICT_FAILURE_SUFFIX));
        assertFalse(Files.exists(tempDir.resolve("plans")));
    }

    @Test
    void testMissingInputIsNeverMaskedByFallback() {
        when(taskExecutor.execute(any(), any()))
                .thenThrow(new MissingTaskInputException("signal_enrichment", TaskType.SIGNAL_ENRICHMENT));

        assertThrows(MissingTaskInputException.class, () -> service.generate(
                new PlanRequest("CLABSI", null, null, null, false, false, null)));
    }

    @Test
    void testBlankConcernRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.generate(
                new PlanRequest(" ", null, "narrative", null, false, null, null)));
        verifyNoInteractions(taskExecutor);
    }
}
