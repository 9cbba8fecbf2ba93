package com.bko.planner.execution;

/**
 * Shape the generation call is asked to return.
 */
public enum ResponseContract {
    /** Plain text, wrapped as {@code {"result": text}}. */
    TEXT,
    /** Any JSON object. */
    JSON,
    /** JSON constrained by the task's schema. */
    JSON_SCHEMA
}
