package com.bko.planner.refinement;

import static com.bko.planner.execution.PlannerConstants.*;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.GenerationClient;
import com.bko.planner.execution.GenerationException;
import com.bko.planner.execution.GenerationRequest;
import com.bko.planner.execution.ResponseContract;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the model for a revised prompt given the failure evidence of the last batch. Adds
 * regression guidance when the last change lowered the score past the configured delta.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmPromptRewriter implements PromptRewriter {

    static final double REWRITE_TEMPERATURE = 0.4;
    static final int REWRITE_MAX_TOKENS = 2000;

    private final GenerationClient generationClient;
    private final PlannerProperties properties;

    @Override
    public Optional<PromptRevision> rewrite(RefinementKey key, String currentPrompt, BatchScore score, double delta) {
        String guidance = delta < properties.getRefinement().getRegressionDelta()
                ? REGRESSION_GUIDANCE.formatted(String.format(Locale.ROOT, "%.3f", delta))
                : "";
        String userPrompt = PROMPT_OPTIMIZER_USER_TEMPLATE.formatted(key.taskType().key(),
                String.format(Locale.ROOT, "%.3f", score.score()), currentPrompt, score.failureEvidence(), guidance);
        GenerationRequest request = new GenerationRequest(PURPOSE_PROMPT_REWRITE, PROMPT_OPTIMIZER_SYSTEM_PROMPT,
                userPrompt, ResponseContract.JSON, null, properties.getGeneration().getTimeout(),
                properties.getGeneration().getDefaultModel(), REWRITE_TEMPERATURE, REWRITE_MAX_TOKENS);
        JsonNode response;
        try {
            response = generationClient.generate(request);
        } catch (GenerationException ex) {
            log.warn("Prompt rewrite for {} failed: {}", key.slug(), ex.getMessage());
            return Optional.empty();
        }
        String newPrompt = response.path("new_prompt").asText("");
        if (!StringUtils.hasText(newPrompt)) {
            log.warn("Prompt rewrite for {} returned no new_prompt.", key.slug());
            return Optional.empty();
        }
        return Optional.of(new PromptRevision(newPrompt.trim(), describe(response)));
    }

    private static String describe(JsonNode response) {
        List<String> parts = new ArrayList<>();
        String analysis = response.path("analysis").asText("");
        if (StringUtils.hasText(analysis)) {
            parts.add(analysis.trim());
        }
        List<String> improvements = new ArrayList<>();
        response.path("expected_improvements").forEach(item -> improvements.add(item.asText("")));
        improvements.removeIf(item -> !StringUtils.hasText(item));
        if (!improvements.isEmpty()) {
            parts.add("Expected: " + String.join("; ", improvements));
        }
        return parts.isEmpty() ? "Prompt rewritten" : String.join(" ", parts);
    }
}
