package com.bko.planner.plan;

import com.bko.planner.resolver.Domain;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Input to plan generation.
 *
 * @param concernId       concern identifier, e.g. {@code CLABSI}
 * @param domainHint      domain used only when the concern is not in the registry
 * @param narrative       primary case narrative fed to the extraction tasks
 * @param riskFactors     free-text risk factors used to add analysis lanes
 * @param researchMode    whether the plan is produced by the research workflow
 * @param strict          strict mode override; {@code null} uses the configured default
 * @param planningInputId identifier of the planning input document
 */
public record PlanRequest(
        String concernId,
        @Nullable Domain domainHint,
        @Nullable String narrative,
        @Nullable List<String> riskFactors,
        boolean researchMode,
        @Nullable Boolean strict,
        @Nullable String planningInputId
) {

    public PlanRequest {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }
}
