package com.bko.planner.plan;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A plan document as received, tagged with the version it was recognised as.
 */
public sealed interface PlanDocument permits PlanDocument.V1, PlanDocument.V2, PlanDocument.V9 {

    PlanVersion version();

    JsonNode source();

    ClinicalPlan plan();

    record V1(JsonNode source, ClinicalPlan plan) implements PlanDocument {
        @Override
        public PlanVersion version() {
            return PlanVersion.V1;
        }
    }

    record V2(JsonNode source, ClinicalPlan plan) implements PlanDocument {
        @Override
        public PlanVersion version() {
            return PlanVersion.V2;
        }
    }

    record V9(JsonNode source, ClinicalPlan plan) implements PlanDocument {
        @Override
        public PlanVersion version() {
            return PlanVersion.V9;
        }
    }
}
