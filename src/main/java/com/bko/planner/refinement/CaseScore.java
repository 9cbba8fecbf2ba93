package com.bko.planner.refinement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Per-case scores: recall of expected signals (cr), avoidance of forbidden terms (ah) and
 * coverage of expected summary phrases (ac).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseScore(
        String testId,
        double cr,
        double ah,
        double ac,
        double composite,
        SafeLabel label,
        List<String> missedSignals,
        List<String> missedPhrases,
        List<String> violations
) {

    public CaseScore {
        missedSignals = List.copyOf(missedSignals);
        missedPhrases = List.copyOf(missedPhrases);
        violations = List.copyOf(violations);
    }
}
