package com.bko.planner.api;

import com.bko.planner.execution.MissingTaskInputException;
import com.bko.planner.execution.TaskValidationException;
import com.bko.planner.graph.TaskType;
import com.bko.planner.plan.PlanFormatException;
import com.bko.planner.plan.PlanGenerationException;
import com.bko.planner.plan.PlanGenerationService;
import com.bko.planner.plan.PlanReviewService;
import com.bko.planner.resolver.Archetype;
import com.bko.planner.resolver.ArchetypeResolver;
import com.bko.planner.resolver.Domain;
import com.bko.planner.resolver.ResolvedContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanController.class)
class PlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PlanGenerationService planGenerationService;

    @MockitoBean
    private PlanReviewService planReviewService;

    @MockitoBean
    private ArchetypeResolver archetypeResolver;

    @Test
    void testBlankConcernIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"concern_id\":\" \",\"narrative\":\"Fever on line day 5.\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(planGenerationService);
    }

    @Test
    void testUnknownDomainIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"concern_id\":\"CLABSI\",\"domain\":\"Dermatology\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(planGenerationService);
    }

    @Test
    void testMissingNarrativeIsBadRequest() throws Exception {
        when(planGenerationService.generate(any()))
                .thenThrow(new MissingTaskInputException("signal_enrichment", TaskType.SIGNAL_ENRICHMENT));

        mockMvc.perform(post("/api/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"concern_id\":\"CLABSI\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testTaskValidationFailureIsUnprocessable() throws Exception {
        when(planGenerationService.generate(any()))
                .thenThrow(new TaskValidationException("event_summary", TaskType.EVENT_SUMMARY, "missing event_summary"));

        mockMvc.perform(post("/api/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"concern_id\":\"CLABSI\",\"narrative\":\"Fever on line day 5.\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void testGenerationFailureIsBadGateway() throws Exception {
        when(planGenerationService.generate(any()))
                .thenThrow(new PlanGenerationException("Plan generation failed", new IllegalStateException("503")));

        mockMvc.perform(post("/api/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"concern_id\":\"CLABSI\",\"narrative\":\"Fever on line day 5.\",\"strict\":true}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void testUnreadablePlanIsBadRequest() throws Exception {
        when(planReviewService.review(any())).thenThrow(new PlanFormatException("Unrecognized plan document"));

        mockMvc.perform(post("/api/plans/assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hello\":\"world\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testArchetypeLookup() throws Exception {
        when(archetypeResolver.resolve(eq("CLABSI"), isNull()))
                .thenReturn(new ResolvedContext(Domain.HAC, Archetype.PREVENTABILITY_DETECTIVE, false));
        when(archetypeResolver.deriveLanes(eq(Archetype.PREVENTABILITY_DETECTIVE), any()))
                .thenReturn(List.of(Archetype.PREVENTABILITY_DETECTIVE, Archetype.EXCLUSION_HUNTER));

        mockMvc.perform(get("/api/plans/archetype")
                        .param("concern", "CLABSI")
                        .param("riskFactor", "contraindication"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.concern").value("CLABSI"))
                .andExpect(jsonPath("$.domain").value("HAC"))
                .andExpect(jsonPath("$.archetype").value(Archetype.PREVENTABILITY_DETECTIVE.key()))
                .andExpect(jsonPath("$.fallback").value(false))
                .andExpect(jsonPath("$.lanes.length()").value(2));

        verify(archetypeResolver).deriveLanes(Archetype.PREVENTABILITY_DETECTIVE, List.of("contraindication"));
    }

    @Test
    void testArchetypeLookupRejectsBlankConcern() throws Exception {
        mockMvc.perform(get("/api/plans/archetype").param("concern", " "))
                .andExpect(status().isBadRequest());
    }
}
