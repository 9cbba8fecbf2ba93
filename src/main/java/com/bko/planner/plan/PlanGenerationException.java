package com.bko.planner.plan;

/**
 * Plan generation failed in strict mode, where no template data may be substituted.
 */
public class PlanGenerationException extends RuntimeException {

    public PlanGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
