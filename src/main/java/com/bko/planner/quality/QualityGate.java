package com.bko.planner.quality;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityGate(String name, double minimum, double actual, boolean passed) {

    public static final String OVERALL = "overall";

    public static QualityGate evaluate(String name, double minimum, double actual) {
        return new QualityGate(name, minimum, actual, actual >= minimum);
    }

    public String flaggedArea() {
        return name.replace('_', ' ') + " below minimum threshold";
    }
}
