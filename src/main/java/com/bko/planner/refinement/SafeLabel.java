package com.bko.planner.refinement;

public enum SafeLabel {
    PASS, REVIEW, FAIL
}
