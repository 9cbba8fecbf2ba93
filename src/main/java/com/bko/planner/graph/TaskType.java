package com.bko.planner.graph;

import com.bko.planner.execution.ResponseContract;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TaskType {
    SIGNAL_ENRICHMENT("signal_enrichment", true, ResponseContract.JSON_SCHEMA, 0.2, 1200),
    EVENT_SUMMARY("event_summary", true, ResponseContract.JSON_SCHEMA, 0.3, 800),
    SUMMARY_20_80("summary_20_80", true, ResponseContract.TEXT, 0.4, 600),
    FOLLOWUP_QUESTIONS("followup_questions", true, ResponseContract.JSON_SCHEMA, 0.2, 800),
    CLINICAL_REVIEW_PLAN("clinical_review_plan", false, ResponseContract.JSON, 0.2, 1200),
    MULTI_ARCHETYPE_SYNTHESIS("multi_archetype_synthesis", false, ResponseContract.JSON_SCHEMA, 0.7, 1200);

    private final String key;
    private final boolean requiresNarrative;
    private final ResponseContract contract;
    private final double defaultTemperature;
    private final int defaultMaxTokens;

    TaskType(String key, boolean requiresNarrative, ResponseContract contract, double defaultTemperature,
             int defaultMaxTokens) {
        this.key = key;
        this.requiresNarrative = requiresNarrative;
        this.contract = contract;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Whether the task reads the case narrative directly and cannot run without it.
     */
    public boolean requiresNarrative() {
        return requiresNarrative;
    }

    public ResponseContract contract() {
        return contract;
    }

    public double defaultTemperature() {
        return defaultTemperature;
    }

    public int defaultMaxTokens() {
        return defaultMaxTokens;
    }

    @JsonCreator
    public static TaskType fromKey(String value) {
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + value));
    }
}
