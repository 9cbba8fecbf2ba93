package com.bko.planner.refinement;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.PlannerMetricsService;
import com.bko.planner.graph.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.bko.planner.refinement.RefinementFixtures.score;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RefinementLoopTest {

    private final RefinementKey key = new RefinementKey("CLABSI", TaskType.EVENT_SUMMARY);
    private final EvaluationBatch batch = RefinementFixtures.clabsiBatch();

    private BatchEvaluator evaluator;
    private PromptRewriter rewriter;
    private InMemoryPromptStore store;
    private PlannerProperties.RefinementConfig config;

    @BeforeEach
    void setUp() {
        evaluator = mock(BatchEvaluator.class);
        rewriter = mock(PromptRewriter.class);
        store = new InMemoryPromptStore();
        store.write(key, "prompt v1");
        config = new PlannerProperties.RefinementConfig();
        AtomicInteger version = new AtomicInteger(1);
        when(rewriter.rewrite(any(), anyString(), any(), anyDouble())).thenAnswer(invocation -> {
            int next = version.incrementAndGet();
            return Optional.of(new PromptRevision("prompt v" + next, "change " + next));
        });
    }

    @Test
    void testRollsBackRegressionsUntilNoImprovementLimit() {
        when(evaluator.evaluate(any(), any(), anyString()))
                .thenReturn(score(0.5), score(0.7), score(0.6), score(0.6), score(0.6));

        RefinementResult result = loop().run(key, batch);

        assertEquals(StopReason.NO_IMPROVEMENT_LIMIT, result.stopReason());
        assertEquals(5, result.iterations());
        assertEquals(0.7, result.bestScore());
        assertEquals("prompt v2", result.bestArtifact());
        assertEquals("prompt v2", store.read(key));
        assertEquals(List.of(RefinementOutcome.ACCEPTED, RefinementOutcome.ACCEPTED, RefinementOutcome.ROLLED_BACK,
                        RefinementOutcome.ROLLED_BACK, RefinementOutcome.ROLLED_BACK),
                result.history().stream().map(RefinementHistoryEntry::outcome).toList());
        assertEquals("baseline", result.history().get(0).changeDescription());
        assertEquals(-0.1, result.history().get(2).delta(), 1e-9);
        verify(rewriter, times(4)).rewrite(any(), anyString(), any(), anyDouble());

        ArgumentCaptor<String> candidates = ArgumentCaptor.forClass(String.class);
        verify(evaluator, times(5)).evaluate(any(), any(), candidates.capture());
        assertEquals(List.of("prompt v1", "prompt v2", "prompt v3", "prompt v4", "prompt v5"), candidates.getAllValues());
    }

    @Test
    void testRewriteStartsFromBestAfterRollback() {
        when(evaluator.evaluate(any(), any(), anyString())).thenReturn(score(0.7), score(0.5), score(0.4), score(0.3));

        loop().run(key, batch);

        ArgumentCaptor<String> rewritten = ArgumentCaptor.forClass(String.class);
        verify(rewriter, times(3)).rewrite(any(), rewritten.capture(), any(), anyDouble());
        assertEquals(List.of("prompt v1", "prompt v1", "prompt v1"), rewritten.getAllValues());
    }

    @Test
    void testStopsOnPerfectScore() {
        when(evaluator.evaluate(any(), any(), anyString())).thenReturn(score(0.4), score(1.0));

        RefinementResult result = loop().run(key, batch);

        assertEquals(StopReason.PERFECT_SCORE, result.stopReason());
        assertEquals(2, result.iterations());
        assertEquals("prompt v2", result.bestArtifact());
        verify(rewriter, times(1)).rewrite(any(), anyString(), any(), anyDouble());
    }

    @Test
    void testStopsAtMaxIterations() {
        config.setMaxIterations(3);
        when(evaluator.evaluate(any(), any(), anyString())).thenReturn(score(0.1), score(0.2), score(0.3));

        RefinementResult result = loop().run(key, batch);

        assertEquals(StopReason.MAX_ITERATIONS, result.stopReason());
        assertEquals(3, result.iterations());
        assertEquals(0.3, result.bestScore());
    }

    @Test
    void testTieIsUnchanged() {
        config.setNoImproveLimit(1);
        when(evaluator.evaluate(any(), any(), anyString())).thenReturn(score(0.5), score(0.5));

        RefinementResult result = loop().run(key, batch);

        assertEquals(RefinementOutcome.UNCHANGED, result.history().get(1).outcome());
        assertEquals("prompt v1", result.bestArtifact());
        assertEquals("prompt v1", store.read(key));
    }

    @Test
    void testStopsWhenRewriteFails() {
        reset(rewriter);
        when(rewriter.rewrite(any(), anyString(), any(), anyDouble())).thenReturn(Optional.empty());
        when(evaluator.evaluate(any(), any(), anyString())).thenReturn(score(0.5));

        RefinementResult result = loop().run(key, batch);

        assertEquals(StopReason.REWRITE_FAILED, result.stopReason());
        assertEquals(1, result.iterations());
        assertEquals("prompt v1", result.bestArtifact());
    }

    private RefinementLoop loop() {
        return new RefinementLoop(evaluator, rewriter, store, config, new PlannerMetricsService());
    }

    static class InMemoryPromptStore implements PromptArtifactStore {
        private final Map<RefinementKey, String> prompts = new HashMap<>();

        @Override
        public String read(RefinementKey key) {
            return prompts.get(key);
        }

        @Override
        public void write(RefinementKey key, String prompt) {
            prompts.put(key, prompt);
        }
    }
}
