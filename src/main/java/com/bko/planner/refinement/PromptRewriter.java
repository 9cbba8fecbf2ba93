package com.bko.planner.refinement;

import java.util.Optional;

public interface PromptRewriter {

    /**
     * Proposes the next prompt variant from the current one and the failures it produced.
     *
     * @param delta score change of the last iteration relative to the best so far
     * @return the revision, or empty when no usable rewrite could be produced
     */
    Optional<PromptRevision> rewrite(RefinementKey key, String currentPrompt, BatchScore score, double delta);
}
