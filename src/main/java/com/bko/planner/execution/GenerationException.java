package com.bko.planner.execution;

/**
 * Failure of the external generation call. Subclasses distinguish timeouts, unusable output and
 * transport errors.
 */
public class GenerationException extends RuntimeException {

    private final String purpose;

    public GenerationException(String purpose, String message) {
        super(message);
        this.purpose = purpose;
    }

    public GenerationException(String purpose, String message, Throwable cause) {
        super(message, cause);
        this.purpose = purpose;
    }

    public String getPurpose() {
        return purpose;
    }
}
