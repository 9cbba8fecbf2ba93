package com.bko.planner.refinement;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

final class RefinementFixtures {

    private RefinementFixtures() {
    }

    static EvaluationBatch clabsiBatch() {
        try (InputStream in = new ClassPathResource("eval/clabsi-batch.json").getInputStream()) {
            return new ObjectMapper().readValue(in, EvaluationBatch.class);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    static BatchScore score(double value) {
        return new BatchScore("clabsi_golden", value, List.of());
    }
}
