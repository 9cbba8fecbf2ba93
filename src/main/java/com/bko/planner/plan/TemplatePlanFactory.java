package com.bko.planner.plan;

import com.bko.planner.execution.TaskPromptService;
import com.bko.planner.resolver.Archetype;
import com.bko.planner.resolver.Domain;
import com.bko.planner.resolver.ResolvedContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Archetype-driven plan sections that do not come from generation: metadata, timeline, default
 * criteria and prompts. Also produces the placeholder plan used when generation fails outside
 * strict mode.
 */
@Component
@RequiredArgsConstructor
public class TemplatePlanFactory {

    public static final String PLAN_VERSION = "9.1";
    public static final List<String> STANDARD_SIGNAL_GROUPS =
            List.of("delay_drivers", "outcome_risks", "safety_signals", "documentation_gaps");

    static final String SYSTEM_PROMPT_TEMPLATE = "You are a clinical surveillance reviewer for %s in the %s domain. "
            + "Review the patient record against the surveillance criteria, cite the clinical evidence for every "
            + "finding, and flag documentation gaps for manual review.";

    private final TaskPromptService promptService;
    private final Clock clock = Clock.systemUTC();

    public ClinicalPlan create(String planId, PlanRequest request, ResolvedContext resolved, List<Archetype> lanes) {
        List<ClinicalConfig.SignalGroup> groups = STANDARD_SIGNAL_GROUPS.stream()
                .map(group -> new ClinicalConfig.SignalGroup(group, displayName(group), List.of(
                        new ClinicalConfig.Signal(group + "_placeholder", "Placeholder signal pending generation",
                                "manual_review", null))))
                .toList();
        ClinicalConfig config = config(request, resolved, lanes, groups, List.of(), List.of(), criteria(resolved.archetype()));
        Rationale rationale = new Rationale("Template-based plan with placeholder data; generation was unavailable.",
                List.of("Primary archetype " + resolved.archetype().key()));
        return new ClinicalPlan(metadata(planId, request, resolved), config, null, rationale, null);
    }

    public PlanMetadata metadata(String planId, PlanRequest request, ResolvedContext resolved) {
        PlanMetadata.Concern concern = new PlanMetadata.Concern(request.concernId(),
                resolved.domain() == Domain.HAC ? ClinicalPlan.HAC_CONCERN_TYPE : "USNWR",
                resolved.domain().label(), resolved.archetype().key());
        PlanMetadata.Workflow workflow = new PlanMetadata.Workflow(request.researchMode()
                ? PlanMetadata.RESEARCH_WORKFLOW
                : "fast");
        String planningInputId = request.planningInputId() != null ? request.planningInputId() : "input_" + planId;
        return new PlanMetadata(planId, planningInputId, PLAN_VERSION, Instant.now(clock).toString(), concern,
                workflow, new PlanMetadata.Status(true, "draft"), null);
    }

    public ClinicalConfig config(PlanRequest request,
                                 ResolvedContext resolved,
                                 List<Archetype> lanes,
                                 List<ClinicalConfig.SignalGroup> groups,
                                 List<ClinicalConfig.MetricQuestion> questions,
                                 List<ClinicalConfig.ClinicalTool> tools,
                                 List<ClinicalConfig.CriteriaRule> criteria) {
        return new ClinicalConfig(
                new ClinicalConfig.ConfigMetadata("config_" + PlanIdGenerator.slug(request.concernId()),
                        request.concernId() + " surveillance", PLAN_VERSION),
                new ClinicalConfig.DomainInfo(resolved.domain().label(), resolved.archetype().key(),
                        lanes.stream().map(Archetype::key).toList()),
                new ClinicalConfig.Surveillance("Identify and review " + request.concernId() + " events",
                        "Inpatient encounters", 30),
                new ClinicalConfig.Signals(groups),
                timeline(resolved.archetype()),
                prompts(request.concernId(), resolved),
                new ClinicalConfig.Criteria(criteria),
                new ClinicalConfig.Questions(questions),
                tools);
    }

    public ClinicalConfig.Prompts prompts(String concernId, ResolvedContext resolved) {
        return new ClinicalConfig.Prompts(SYSTEM_PROMPT_TEMPLATE.formatted(concernId, resolved.domain().label()),
                promptService.taskPromptsByKey(Map.of()));
    }

    public ClinicalConfig.Timeline timeline(Archetype archetype) {
        List<ClinicalConfig.Phase> phases = switch (archetype) {
            case PROCESS_AUDITOR, DELAY_DRIVER_PROFILER -> List.of(
                    phase("arrival", "Arrival", "Presentation and triage"),
                    phase("intervention", "Intervention", "Time-critical care steps"),
                    phase("follow_up", "Follow-up", "Post-intervention monitoring"));
            case PREVENTABILITY_DETECTIVE, PREVENTABILITY_DETECTIVE_METRIC -> List.of(
                    phase("pre_event", "Pre-event", "Device days and prevention bundle adherence"),
                    phase("event_window", "Event window", "Onset and diagnostic workup"),
                    phase("post_event", "Post-event", "Treatment and outcome"));
            case EXCLUSION_HUNTER -> List.of(
                    phase("index_event", "Index event", "Qualifying event"),
                    phase("exclusion_review", "Exclusion review", "Documented exclusions and contraindications"));
            case OUTCOME_TRACKER -> List.of(
                    phase("index_procedure", "Index procedure", "Procedure or admission of interest"),
                    phase("outcome_window", "Outcome window", "Survival and complication follow-up"));
            case DATA_SCAVENGER -> List.of(
                    phase("data_collection", "Data collection", "Source data gathering"));
        };
        return new ClinicalConfig.Timeline(phases);
    }

    public List<ClinicalConfig.CriteriaRule> criteria(Archetype archetype) {
        return switch (archetype) {
            case PROCESS_AUDITOR, DELAY_DRIVER_PROFILER -> List.of(
                    rule("timeliness", "Care steps completed within the protocol time window"));
            case PREVENTABILITY_DETECTIVE, PREVENTABILITY_DETECTIVE_METRIC -> List.of(
                    rule("case_definition", "Event meets the surveillance case definition"),
                    rule("bundle_adherence", "Prevention bundle elements documented before onset"));
            case EXCLUSION_HUNTER -> List.of(
                    rule("exclusion_check", "No documented exclusion applies to the index event"));
            case OUTCOME_TRACKER -> List.of(
                    rule("outcome_capture", "Outcome recorded within the follow-up window"));
            case DATA_SCAVENGER -> List.of(
                    rule("data_availability", "Required data elements are present in the record"));
        };
    }

    private static ClinicalConfig.Phase phase(String id, String name, String description) {
        return new ClinicalConfig.Phase(id, name, description);
    }

    private static ClinicalConfig.CriteriaRule rule(String id, String description) {
        return new ClinicalConfig.CriteriaRule(id, description, null);
    }

    static String displayName(String groupId) {
        String spaced = groupId.replace('_', ' ');
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
