package com.bko.planner.refinement;

/**
 * Storage of the live prompt artifact for a refinement key.
 */
public interface PromptArtifactStore {

    String read(RefinementKey key);

    void write(RefinementKey key, String prompt);
}
