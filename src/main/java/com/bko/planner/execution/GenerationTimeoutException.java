package com.bko.planner.execution;

import java.time.Duration;

public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(String purpose, Duration timeout) {
        super(purpose, "Generation call for " + purpose + " timed out after " + timeout.toMillis() + " ms");
    }
}
