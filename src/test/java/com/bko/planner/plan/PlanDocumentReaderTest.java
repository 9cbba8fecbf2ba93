package com.bko.planner.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

class PlanDocumentReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PlanDocumentReader reader = new PlanDocumentReader(objectMapper);

    @Test
    void testLegacyDocumentIsNormalized() throws Exception {
        JsonNode source;
        try (InputStream in = new ClassPathResource("plans/v1-plan.json").getInputStream()) {
            source = objectMapper.readTree(in);
        }

        PlanDocument document = reader.read(source);

        assertEquals(PlanVersion.V1, document.version());
        assertInstanceOf(PlanDocument.V1.class, document);
        assertEquals("plan_clabsi_hac_20240101_abcd1234", document.plan().planId());
        assertEquals(0.82, document.plan().planMetadata().confidence());
        assertEquals("positive_blood_culture", document.plan().clinicalConfig().allSignals().get(0).signalId());
        assertTrue(document.plan().hacCategory());
        assertTrue(document.source().has("hac_config"));
    }

    @Test
    void testCurrentDocumentRoundTrip() {
        ClinicalPlan plan = PlanFixtures.hacPlan(3, PlanFixtures.CLINICAL_SYSTEM_PROMPT);

        PlanDocument document = reader.read(objectMapper.valueToTree(plan));

        assertEquals(PlanVersion.V9, document.version());
        assertEquals(plan, document.plan());
    }

    @Test
    void testClinicalConfigWithoutVersion9IsV2() {
        ObjectNode source = objectMapper.valueToTree(PlanFixtures.hacPlan(3, PlanFixtures.CLINICAL_SYSTEM_PROMPT));
        ((ObjectNode) source.get("plan_metadata")).put("version", "2.0");

        assertEquals(PlanVersion.V2, reader.read(source).version());
    }

    @Test
    void testRejectsNonObject() {
        assertThrows(PlanFormatException.class, () -> reader.read(objectMapper.createArrayNode()));
        assertThrows(PlanFormatException.class, () -> reader.read("{not json"));
    }

    @Test
    void testRejectsMismatchedStructure() {
        PlanFormatException ex = assertThrows(PlanFormatException.class,
                () -> reader.read("{\"plan_metadata\":{\"version\":\"9.1\"},\"clinical_config\":\"oops\"}"));

        assertTrue(ex.getMessage().startsWith("Plan document does not match the plan structure"));
    }
}
