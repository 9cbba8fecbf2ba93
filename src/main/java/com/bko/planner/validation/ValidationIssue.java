package com.bko.planner.validation;

public record ValidationIssue(IssueSource source, String path, String message) {

    public static ValidationIssue schema(String path, String message) {
        return new ValidationIssue(IssueSource.SCHEMA, path, message);
    }

    public static ValidationIssue rule(String path, String message) {
        return new ValidationIssue(IssueSource.BUSINESS_RULE, path, message);
    }

    public static ValidationIssue quality(String message) {
        return new ValidationIssue(IssueSource.QUALITY, "quality", message);
    }

    @Override
    public String toString() {
        return source + " " + path + ": " + message;
    }
}
