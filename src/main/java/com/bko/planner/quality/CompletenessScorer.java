package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalPlan;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CompletenessScorer implements DimensionScorer {

    static final List<String> REQUIRED_FIELDS = List.of(
            "plan_metadata.plan_id",
            "plan_metadata.concern.concern_id",
            "clinical_config.config_metadata",
            "clinical_config.domain",
            "clinical_config.surveillance",
            "clinical_config.signals",
            "clinical_config.timeline",
            "clinical_config.prompts",
            "clinical_config.criteria");

    private final ObjectMapper objectMapper;

    @Override
    public String dimension() {
        return QualityDimension.COMPLETENESS;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        JsonNode tree = objectMapper.valueToTree(plan);
        List<String> missing = REQUIRED_FIELDS.stream()
                .filter(path -> absent(tree.at("/" + path.replace('.', '/'))))
                .toList();
        double score = (double) (REQUIRED_FIELDS.size() - missing.size()) / REQUIRED_FIELDS.size();
        String rationale = missing.isEmpty()
                ? "All required fields present"
                : "Missing: " + String.join(", ", missing);
        return new QualityDimension(dimension(), score, rationale, Map.of("missing_fields", missing));
    }

    private static boolean absent(JsonNode node) {
        return node.isMissingNode() || node.isNull() || (node.isTextual() && node.asText().isBlank());
    }
}
