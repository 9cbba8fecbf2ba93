package com.bko.planner.validation;

public enum IssueSource {
    SCHEMA,
    BUSINESS_RULE,
    QUALITY
}
