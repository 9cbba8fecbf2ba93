package com.bko.planner.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recognises the version of an incoming plan document and converts it to {@link ClinicalPlan}.
 * Version-specific field names are handled here and nowhere else.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanDocumentReader {

    static final String LEGACY_CONFIG_FIELD = "hac_config";
    static final String CONFIG_FIELD = "clinical_config";

    private final ObjectMapper objectMapper;

    public PlanDocument read(JsonNode source) {
        if (source == null || !source.isObject()) {
            throw new PlanFormatException("Plan document must be a JSON object.");
        }
        PlanVersion version = detect(source);
        ObjectNode canonical = source.deepCopy();
        if (version == PlanVersion.V1) {
            canonical.set(CONFIG_FIELD, canonical.remove(LEGACY_CONFIG_FIELD));
        }
        ClinicalPlan plan = bind(canonical);
        log.debug("Read plan {} as {}.", plan.planId(), version);
        return switch (version) {
            case V1 -> new PlanDocument.V1(source, plan);
            case V2 -> new PlanDocument.V2(source, plan);
            case V9 -> new PlanDocument.V9(source, plan);
        };
    }

    public PlanDocument read(String json) {
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new PlanFormatException("Plan document is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    PlanVersion detect(JsonNode source) {
        if (source.has(LEGACY_CONFIG_FIELD) && !source.has(CONFIG_FIELD)) {
            return PlanVersion.V1;
        }
        String declared = source.path("plan_metadata").path("version").asText("");
        if (declared.startsWith("9")) {
            return PlanVersion.V9;
        }
        return PlanVersion.V2;
    }

    private ClinicalPlan bind(ObjectNode canonical) {
        try {
            return objectMapper.treeToValue(canonical, ClinicalPlan.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new PlanFormatException("Plan document does not match the plan structure: " + ex.getMessage(), ex);
        }
    }
}
