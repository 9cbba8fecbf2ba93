package com.bko.planner.execution;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Opaque model call used by every generation step.
 */
public interface GenerationClient {

    /**
     * Runs one generation call and returns its payload as JSON. Text responses are wrapped as
     * {@code {"result": text}}.
     *
     * @param request The prompt, response contract and limits for the call.
     * @return The parsed payload; never {@code null}.
     * @throws GenerationTimeoutException if the call exceeds {@link GenerationRequest#timeout()}.
     * @throws MalformedOutputException if a structured contract was requested and the output is not JSON.
     * @throws GenerationTransportException if the backend fails.
     */
    JsonNode generate(GenerationRequest request);
}
