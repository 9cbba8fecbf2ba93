package com.bko.planner.refinement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one refinement run. Only the loop that owns it changes it; history is
 * append-only.
 */
public class RefinementState {

    private int iteration;
    private double bestScore;
    private String bestArtifact;
    private boolean hasBest;
    private int noImproveCount;
    private final List<RefinementHistoryEntry> history = new ArrayList<>();

    public int nextIteration() {
        return ++iteration;
    }

    public void accept(String artifact, double score) {
        this.bestArtifact = artifact;
        this.bestScore = score;
        this.hasBest = true;
        this.noImproveCount = 0;
    }

    public void recordNoImprovement() {
        noImproveCount++;
    }

    public void append(RefinementHistoryEntry entry) {
        history.add(entry);
    }

    public int getIteration() {
        return iteration;
    }

    public double getBestScore() {
        return bestScore;
    }

    public String getBestArtifact() {
        return bestArtifact;
    }

    public boolean hasBest() {
        return hasBest;
    }

    public int getNoImproveCount() {
        return noImproveCount;
    }

    public List<RefinementHistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
