package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalPlan;

public enum AssessmentMode {
    FAST,
    RESEARCH;

    public static AssessmentMode of(ClinicalPlan plan) {
        return plan.researchMode() ? RESEARCH : FAST;
    }
}
