package com.bko.planner.plan;

import com.bko.planner.quality.QualityAssessmentService;
import com.bko.planner.quality.QualityVerdict;
import com.bko.planner.validation.ValidationCoupler;
import com.bko.planner.validation.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Assesses and validates an existing plan document of any supported version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanReviewService {

    private final PlanDocumentReader documentReader;
    private final QualityAssessmentService qualityAssessmentService;
    private final ValidationCoupler validationCoupler;

    public Review review(JsonNode source) {
        PlanDocument document = documentReader.read(source);
        QualityVerdict verdict = qualityAssessmentService.assess(document.plan());
        ValidationResult validation = validationCoupler.validate(document, verdict);
        log.info("Reviewed {} plan {}: score={}, valid={}.", document.version(), document.plan().planId(),
                String.format("%.3f", verdict.overallScore()), validation.valid());
        return new Review(document.version(), document.plan().planId(), verdict, validation);
    }

    public record Review(PlanVersion version, String planId, QualityVerdict verdict, ValidationResult validation) {
    }
}
