package com.bko.planner.plan;

public enum PlanVersion {
    /** Legacy documents with {@code hac_config}, a plan confidence and a rationale block. */
    V1,
    /** {@code clinical_config} documents with quality and provenance blocks. */
    V2,
    /** Archetype-driven documents, {@code plan_metadata.version} 9.x. */
    V9
}
