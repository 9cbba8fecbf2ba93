package com.bko.planner.execution;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * One call to the generation backend.
 *
 * @param purpose      label used in logs and metrics, e.g. {@code task:event_summary}
 * @param systemPrompt instructions for the model
 * @param userPrompt   task input
 * @param contract     expected response shape
 * @param schema       JSON schema text, required for {@link ResponseContract#JSON_SCHEMA}
 * @param timeout      upper bound on the call
 * @param model        model name
 * @param temperature  sampling temperature
 * @param maxTokens    completion budget
 */
public record GenerationRequest(
        String purpose,
        String systemPrompt,
        String userPrompt,
        ResponseContract contract,
        @Nullable String schema,
        Duration timeout,
        String model,
        double temperature,
        int maxTokens
) {

    public GenerationRequest {
        if (contract == ResponseContract.JSON_SCHEMA && (schema == null || schema.isBlank())) {
            throw new IllegalArgumentException("A schema is required for " + purpose + " with a JSON_SCHEMA contract.");
        }
    }
}
