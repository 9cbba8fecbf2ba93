package com.bko.planner.refinement;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.PlannerMetricsService;
import com.bko.planner.storage.ArtifactStorageException;
import com.bko.planner.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for prompt refinement. Runs for the same concern and task type are refused while
 * one is in progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefinementService {

    private final BatchEvaluator batchEvaluator;
    private final PromptRewriter promptRewriter;
    private final PromptArtifactStore promptArtifactStore;
    private final ArtifactStore artifactStore;
    private final PlannerProperties properties;
    private final PlannerMetricsService metricsService;

    private final Map<RefinementKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RefinementResult refine(RefinementKey key, EvaluationBatch batch) {
        if (batch.cases().isEmpty()) {
            throw new IllegalArgumentException("Evaluation batch " + batch.batchId() + " has no cases.");
        }
        batchEvaluator.checkTarget(batch, key);
        ReentrantLock lock = locks.computeIfAbsent(key, ignored -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new IllegalStateException("Refinement for " + key.slug() + " is already running.");
        }
        try {
            log.info("Starting refinement of {} against batch {} v{} ({} cases).", key.slug(), batch.batchId(),
                    batch.version(), batch.cases().size());
            RefinementLoop loop = new RefinementLoop(batchEvaluator, promptRewriter, promptArtifactStore,
                    properties.getRefinement(), metricsService);
            RefinementResult result = loop.run(key, batch);
            persistHistory(key, result);
            return result;
        } finally {
            lock.unlock();
            metricsService.logSummary();
        }
    }

    /**
     * The result of the last completed run for the key, read back from its persisted history.
     */
    public Optional<RefinementResult> lastResult(RefinementKey key) {
        return artifactStore.readJson(historyPath(key), RefinementResult.class);
    }

    static String historyPath(RefinementKey key) {
        return "refinement/" + key.slug() + "/history.json";
    }

    private void persistHistory(RefinementKey key, RefinementResult result) {
        try {
            artifactStore.writeJson(historyPath(key), result);
        } catch (ArtifactStorageException ex) {
            log.warn("Unable to persist refinement history for {}: {}", key.slug(), ex.getMessage());
        }
    }
}
