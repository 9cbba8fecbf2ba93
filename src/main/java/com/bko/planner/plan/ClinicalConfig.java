package com.bko.planner.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Surveillance configuration section of a plan. Older documents carry it under {@code hac_config}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClinicalConfig(
        @NotNull ConfigMetadata configMetadata,
        @NotNull DomainInfo domain,
        Surveillance surveillance,
        @NotNull @Valid Signals signals,
        @NotNull @Valid Timeline timeline,
        @NotNull Prompts prompts,
        @NotNull @Valid Criteria criteria,
        Questions questions,
        List<ClinicalTool> clinicalTools
) {

    public List<Signal> allSignals() {
        if (signals == null || signals.signalGroups() == null) {
            return List.of();
        }
        return signals.signalGroups().stream()
                .filter(group -> group.signals() != null)
                .flatMap(group -> group.signals().stream())
                .toList();
    }

    public List<CriteriaRule> criteriaRules() {
        return criteria == null || criteria.rules() == null ? List.of() : criteria.rules();
    }

    public List<MetricQuestion> metricQuestions() {
        return questions == null || questions.metricQuestions() == null ? List.of() : questions.metricQuestions();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConfigMetadata(String configId, String name, String version) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DomainInfo(String name, String archetype, List<String> lanes) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Surveillance(String objective, String population, Integer windowDays) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Signals(@NotNull @Valid List<SignalGroup> signalGroups) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SignalGroup(@NotBlank String groupId, String displayName, @Valid List<Signal> signals) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Signal(@NotBlank String signalId, String description, String triggerExpr, String provenance) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Timeline(@NotNull @Valid List<Phase> phases) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Phase(@NotBlank String phaseId, String displayName, String description) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Prompts(String systemPrompt, Map<String, String> taskPrompts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Criteria(@NotNull @Valid List<CriteriaRule> rules) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CriteriaRule(@NotBlank String ruleId, String description, String provenance) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Questions(List<MetricQuestion> metricQuestions) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MetricQuestion(String questionId, String text) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClinicalTool(String toolId, String name, String useCase) {
    }
}
