package com.bko.planner.resolver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Domain {
    HAC("HAC"),
    SAFETY("Safety"),
    ORTHOPEDICS("Orthopedics"),
    ENDOCRINOLOGY("Endocrinology"),
    CARDIOLOGY("Cardiology"),
    NEUROLOGY("Neurology"),
    GASTROENTEROLOGY("Gastroenterology"),
    NEONATOLOGY("Neonatology"),
    NEPHROLOGY("Nephrology"),
    PULMONOLOGY("Pulmonology"),
    UROLOGY("Urology"),
    BEHAVIORAL_HEALTH("Behavioral Health"),
    QUALITY("Quality");

    private final String label;

    Domain(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Domain fromLabel(String value) {
        return Arrays.stream(values())
                .filter(domain -> domain.label.equalsIgnoreCase(value) || domain.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown domain: " + value));
    }
}
