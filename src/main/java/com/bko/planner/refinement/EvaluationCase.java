package com.bko.planner.refinement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One frozen evaluation case: a patient narrative plus the signals, phrases and forbidden terms
 * the generated output is checked against.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationCase(
        String testId,
        String concernId,
        String description,
        String patientPayload,
        Expectations expectations
) {

    public EvaluationCase {
        expectations = expectations == null ? new Expectations(null, null, null) : expectations;
    }

    public List<String> mustFindSignals() {
        return expectations.signalGeneration() == null ? List.of() : expectations.signalGeneration().mustFindSignals();
    }

    public List<String> mustContainPhrases() {
        return expectations.eventSummary() == null ? List.of() : expectations.eventSummary().mustContainPhrases();
    }

    public List<String> forbiddenTerms() {
        return expectations.followupQuestions() == null ? List.of() : expectations.followupQuestions().forbiddenTerms();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Expectations(
            SignalExpectation signalGeneration,
            SummaryExpectation eventSummary,
            QuestionExpectation followupQuestions
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SignalExpectation(List<String> mustFindSignals) {
        public SignalExpectation {
            mustFindSignals = mustFindSignals == null ? List.of() : List.copyOf(mustFindSignals);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SummaryExpectation(List<String> mustContainPhrases) {
        public SummaryExpectation {
            mustContainPhrases = mustContainPhrases == null ? List.of() : List.copyOf(mustContainPhrases);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QuestionExpectation(List<String> forbiddenTerms) {
        public QuestionExpectation {
            forbiddenTerms = forbiddenTerms == null ? List.of() : List.copyOf(forbiddenTerms);
        }
    }
}
