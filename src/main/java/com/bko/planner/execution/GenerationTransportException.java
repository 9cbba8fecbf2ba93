package com.bko.planner.execution;

public class GenerationTransportException extends GenerationException {

    public GenerationTransportException(String purpose, Throwable cause) {
        super(purpose, "Generation call for " + purpose + " failed: " + cause.getMessage(), cause);
    }
}
