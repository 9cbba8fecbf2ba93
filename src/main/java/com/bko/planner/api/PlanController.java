package com.bko.planner.api;

import com.bko.planner.execution.MissingTaskInputException;
import com.bko.planner.execution.TaskValidationException;
import com.bko.planner.plan.PlanFormatException;
import com.bko.planner.plan.PlanGenerationException;
import com.bko.planner.plan.PlanGenerationService;
import com.bko.planner.plan.PlanRequest;
import com.bko.planner.plan.PlanReviewService;
import com.bko.planner.resolver.Archetype;
import com.bko.planner.resolver.ArchetypeResolver;
import com.bko.planner.resolver.Domain;
import com.bko.planner.resolver.ResolvedContext;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/plans")
public class PlanController {

    private final PlanGenerationService planGenerationService;
    private final PlanReviewService planReviewService;
    private final ArchetypeResolver archetypeResolver;

    public PlanController(PlanGenerationService planGenerationService,
                          PlanReviewService planReviewService,
                          ArchetypeResolver archetypeResolver) {
        this.planGenerationService = planGenerationService;
        this.planReviewService = planReviewService;
        this.archetypeResolver = archetypeResolver;
    }

    @PostMapping
    public PlanResponse generate(@Valid @RequestBody GeneratePlanRequest request) {
        PlanRequest planRequest = new PlanRequest(
                request.concernId(),
                domain(request.domain()),
                request.narrative(),
                request.riskFactors(),
                Boolean.TRUE.equals(request.researchMode()),
                request.strict(),
                request.planningInputId());
        try {
            return PlanResponse.from(planGenerationService.generate(planRequest));
        } catch (MissingTaskInputException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (TaskValidationException ex) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex);
        } catch (PlanGenerationException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex);
        }
    }

    @PostMapping("/assess")
    public AssessmentResponse assess(@RequestBody JsonNode document) {
        try {
            return AssessmentResponse.from(planReviewService.review(document));
        } catch (PlanFormatException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/archetype")
    public ArchetypeResponse archetype(@RequestParam("concern") String concern,
                                       @RequestParam(value = "domain", required = false) String domain,
                                       @RequestParam(value = "riskFactor", required = false) List<String> riskFactors) {
        if (!StringUtils.hasText(concern)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Concern is required.");
        }
        ResolvedContext resolved = archetypeResolver.resolve(concern, domain(domain));
        List<String> lanes = archetypeResolver.deriveLanes(resolved.archetype(), riskFactors).stream()
                .map(Archetype::key)
                .toList();
        return ArchetypeResponse.from(concern, resolved, lanes);
    }

    private static Domain domain(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Domain.fromLabel(value);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
