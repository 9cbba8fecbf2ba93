package com.bko.planner.refinement;

public enum StopReason {
    PERFECT_SCORE,
    NO_IMPROVEMENT_LIMIT,
    MAX_ITERATIONS,
    REWRITE_FAILED
}
