package com.bko.planner.resolver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Behavioral templates that decide which generation tasks run for a concern.
 * Declaration order is the lane order used when several archetypes apply to one plan.
 */
public enum Archetype {
    PROCESS_AUDITOR("Process_Auditor"),
    DELAY_DRIVER_PROFILER("Delay_Driver_Profiler"),
    EXCLUSION_HUNTER("Exclusion_Hunter"),
    PREVENTABILITY_DETECTIVE("Preventability_Detective"),
    PREVENTABILITY_DETECTIVE_METRIC("Preventability_Detective_Metric"),
    OUTCOME_TRACKER("Outcome_Tracker"),
    DATA_SCAVENGER("Data_Scavenger");

    private final String key;

    Archetype(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String laneId() {
        return key.toLowerCase();
    }

    @JsonCreator
    public static Archetype fromKey(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown archetype: " + value));
    }

    public static Optional<Archetype> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(archetype -> archetype.key.equalsIgnoreCase(value) || archetype.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
