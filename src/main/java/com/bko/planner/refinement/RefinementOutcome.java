package com.bko.planner.refinement;

public enum RefinementOutcome {
    ACCEPTED,
    ROLLED_BACK,
    UNCHANGED
}
