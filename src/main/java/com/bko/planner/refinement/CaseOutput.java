package com.bko.planner.refinement;

import java.util.List;

/**
 * What one evaluation case produced: extracted signal ids, the narrative summary and the
 * follow-up questions.
 */
public record CaseOutput(String testId, List<String> signals, String summary, List<String> followupQuestions) {

    public CaseOutput {
        signals = signals == null ? List.of() : List.copyOf(signals);
        summary = summary == null ? "" : summary;
        followupQuestions = followupQuestions == null ? List.of() : List.copyOf(followupQuestions);
    }

    public static CaseOutput empty(String testId) {
        return new CaseOutput(testId, List.of(), "", List.of());
    }
}
