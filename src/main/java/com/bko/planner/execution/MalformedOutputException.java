package com.bko.planner.execution;

public class MalformedOutputException extends GenerationException {

    private final String snippet;

    public MalformedOutputException(String purpose, String snippet) {
        super(purpose, "Generation call for " + purpose + " returned malformed structured output: " + snippet);
        this.snippet = snippet;
    }

    public String getSnippet() {
        return snippet;
    }
}
