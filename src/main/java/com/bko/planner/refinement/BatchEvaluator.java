package com.bko.planner.refinement;

/**
 * Runs a frozen evaluation batch with one task prompt replaced by a candidate variant.
 */
public interface BatchEvaluator {

    /**
     * Rejects a key whose task prompt cannot influence the batch score, either because the task
     * never runs for the batch's cases or because its output is not scored.
     *
     * @throws IllegalArgumentException if the key cannot be refined against this batch
     */
    void checkTarget(EvaluationBatch batch, RefinementKey key);

    BatchScore evaluate(EvaluationBatch batch, RefinementKey key, String candidatePrompt);
}
