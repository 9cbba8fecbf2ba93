package com.bko.planner.refinement;

public record PromptRevision(String prompt, String changeDescription) {
}
