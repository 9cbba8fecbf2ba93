package com.bko.planner.plan;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.JsonProcessingService;
import com.bko.planner.execution.PlannerMetricsService;
import com.bko.planner.execution.TaskOutput;
import com.bko.planner.execution.TaskPromptService;
import com.bko.planner.execution.TaskValidation;
import com.bko.planner.graph.TaskType;
import com.bko.planner.quality.ClinicalAccuracyScorer;
import com.bko.planner.quality.CompletenessScorer;
import com.bko.planner.quality.DataFeasibilityScorer;
import com.bko.planner.quality.GateEvaluator;
import com.bko.planner.quality.ImplementationReadinessScorer;
import com.bko.planner.quality.ParsimonyScorer;
import com.bko.planner.quality.QualityAssessmentService;
import com.bko.planner.quality.ResearchCoverageScorer;
import com.bko.planner.quality.SpecComplianceScorer;
import com.bko.planner.validation.BusinessRuleValidator;
import com.bko.planner.validation.PlanSchemaValidator;
import com.bko.planner.validation.ValidationCoupler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Validation;

import java.util.List;

/**
 * Real collaborators and canned task outputs for plan service tests.
 */
final class PlanTestSupport {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private PlanTestSupport() {
    }

    static TemplatePlanFactory templatePlanFactory() {
        return new TemplatePlanFactory(new TaskPromptService(new JsonProcessingService(OBJECT_MAPPER)));
    }

    static QualityAssessmentService qualityAssessmentService(PlannerProperties properties) {
        return new QualityAssessmentService(List.of(
                new ClinicalAccuracyScorer(),
                new DataFeasibilityScorer(),
                new ParsimonyScorer(properties),
                new CompletenessScorer(OBJECT_MAPPER),
                new ResearchCoverageScorer(),
                new SpecComplianceScorer(),
                new ImplementationReadinessScorer()),
                new GateEvaluator(properties), properties, new PlannerMetricsService());
    }

    static ValidationCoupler validationCoupler(PlannerProperties properties) {
        return new ValidationCoupler(new PlanSchemaValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                new BusinessRuleValidator(), properties);
    }

    static TaskOutput output(String taskId, TaskType type, JsonNode payload) {
        return new TaskOutput(taskId, type, payload, TaskValidation.of(List.of(), List.of()));
    }

    static ObjectNode signalGroups(String field, String groupId, int count, String prefix) {
        ObjectNode payload = OBJECT_MAPPER.createObjectNode();
        ObjectNode group = payload.putArray(field).addObject();
        group.put("group_id", groupId);
        ArrayNode signals = group.putArray("signals");
        for (int i = 1; i <= count; i++) {
            signals.addObject()
                    .put("signal_id", prefix + i)
                    .put("description", "Signal " + i)
                    .put("trigger_expr", "lab.result == 'positive'");
        }
        return payload;
    }

    static ObjectNode eventSummary(String text) {
        return OBJECT_MAPPER.createObjectNode().put("event_summary", text);
    }

    static ObjectNode followupQuestions(String... questions) {
        ObjectNode payload = OBJECT_MAPPER.createObjectNode();
        ArrayNode array = payload.putArray("followup_questions");
        for (String question : questions) {
            array.add(question);
        }
        return payload;
    }

    static ObjectNode reviewPlan() {
        ObjectNode payload = OBJECT_MAPPER.createObjectNode();
        payload.putArray("clinical_tools").addObject()
                .put("tool_id", "nhsn_lcbi")
                .put("name", "NHSN LCBI criteria")
                .put("use_case", "Confirm laboratory-confirmed bloodstream infection");
        payload.putArray("review_criteria").addObject()
                .put("rule_id", "lcbi_1")
                .put("description", "Recognized pathogen from one or more blood cultures")
                .put("provenance", "CDC NHSN 2026");
        return payload;
    }
}
