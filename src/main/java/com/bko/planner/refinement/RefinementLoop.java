package com.bko.planner.refinement;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.PlannerMetricsService;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Iterate, score, accept or roll back. A variant scoring above the best so far becomes the stored
 * artifact; a variant scoring below it is replaced by the best one before the next rewrite. Runs
 * until a perfect score, the no-improvement limit or the iteration cap, checked in that order.
 * <p>
 * Not thread-safe; callers serialize runs per {@link RefinementKey}.
 */
@Slf4j
public class RefinementLoop {

    static final double PERFECT_SCORE = 1.0;
    static final String BASELINE_CHANGE = "baseline";

    private final BatchEvaluator evaluator;
    private final PromptRewriter rewriter;
    private final PromptArtifactStore artifactStore;
    private final PlannerProperties.RefinementConfig config;
    private final PlannerMetricsService metricsService;

    public RefinementLoop(BatchEvaluator evaluator,
                          PromptRewriter rewriter,
                          PromptArtifactStore artifactStore,
                          PlannerProperties.RefinementConfig config,
                          PlannerMetricsService metricsService) {
        this.evaluator = evaluator;
        this.rewriter = rewriter;
        this.artifactStore = artifactStore;
        this.config = config;
        this.metricsService = metricsService;
    }

    public RefinementResult run(RefinementKey key, EvaluationBatch batch) {
        RefinementState state = new RefinementState();
        String current = artifactStore.read(key);
        String change = BASELINE_CHANGE;
        StopReason stopReason;

        while (true) {
            int iteration = state.nextIteration();
            BatchScore batchScore = evaluator.evaluate(batch, key, current);
            double score = batchScore.score();
            double delta = state.hasBest() ? score - state.getBestScore() : 0.0;
            metricsService.recordRefinementIteration(key.slug(), iteration, score);

            RefinementOutcome outcome;
            if (!state.hasBest() || score > state.getBestScore()) {
                state.accept(current, score);
                artifactStore.write(key, current);
                outcome = RefinementOutcome.ACCEPTED;
            } else {
                state.recordNoImprovement();
                if (score < state.getBestScore()) {
                    log.warn("Refinement {} iteration {} regressed by {}; rolling back to best ({}).", key.slug(),
                            iteration, String.format("%.3f", delta), String.format("%.3f", state.getBestScore()));
                    current = state.getBestArtifact();
                    artifactStore.write(key, current);
                    outcome = RefinementOutcome.ROLLED_BACK;
                } else {
                    outcome = RefinementOutcome.UNCHANGED;
                }
            }
            state.append(new RefinementHistoryEntry(iteration, score, delta, outcome, change));
            log.info("Refinement {} iteration {}: score={}, delta={}, outcome={}, best={}.", key.slug(), iteration,
                    String.format("%.3f", score), String.format("%.3f", delta), outcome,
                    String.format("%.3f", state.getBestScore()));

            if (score >= PERFECT_SCORE) {
                stopReason = StopReason.PERFECT_SCORE;
                break;
            }
            if (state.getNoImproveCount() >= config.getNoImproveLimit()) {
                stopReason = StopReason.NO_IMPROVEMENT_LIMIT;
                break;
            }
            if (iteration >= config.getMaxIterations()) {
                stopReason = StopReason.MAX_ITERATIONS;
                break;
            }

            Optional<PromptRevision> revision = rewriter.rewrite(key, current, batchScore, delta);
            if (revision.isEmpty()) {
                log.warn("Refinement {} stopped at iteration {}: no usable prompt rewrite.", key.slug(), iteration);
                stopReason = StopReason.REWRITE_FAILED;
                break;
            }
            current = revision.get().prompt();
            change = revision.get().changeDescription();
        }

        log.info("Refinement {} finished after {} iterations ({}); best score {}.", key.slug(), state.getIteration(),
                stopReason, String.format("%.3f", state.getBestScore()));
        return new RefinementResult(key.concernId(), key.taskType().key(), batch.batchId(), batch.version(),
                stopReason, state.getIteration(), state.getBestScore(), state.getBestArtifact(), state.getHistory());
    }
}
