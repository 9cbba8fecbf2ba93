package com.bko.planner.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class PlannerMetricsService {

    private final AtomicLong generationCallCount = new AtomicLong();
    private final AtomicLong generationFailureCount = new AtomicLong();
    private final AtomicLong taskExecutedCount = new AtomicLong();
    private final AtomicLong planAssessedCount = new AtomicLong();
    private final AtomicLong deploymentReadyCount = new AtomicLong();
    private final AtomicLong refinementIterationCount = new AtomicLong();

    public void recordGenerationCall(String purpose) {
        long count = generationCallCount.incrementAndGet();
        log.info("Generation call #{} sent (purpose={}).", count, purpose);
    }

    public void recordGenerationFailure(String purpose, String reason) {
        long count = generationFailureCount.incrementAndGet();
        log.warn("Generation call for {} failed ({}). Total failures={}.", purpose, reason, count);
    }

    public void recordTasksExecuted(String executionId, int executedCount) {
        if (executedCount <= 0) {
            return;
        }
        long total = taskExecutedCount.addAndGet(executedCount);
        log.info("Execution {} completed {} tasks. Total tasks executed so far={}.", executionId, executedCount, total);
    }

    public void recordPlanAssessed(String planId, double overallScore, boolean deploymentReady) {
        long assessed = planAssessedCount.incrementAndGet();
        long ready = deploymentReady ? deploymentReadyCount.incrementAndGet() : deploymentReadyCount.get();
        log.info("Plan {} assessed at {} (deploymentReady={}). Plans assessed={}, deployment ready={}.",
                planId, String.format("%.3f", overallScore), deploymentReady, assessed, ready);
    }

    public void recordRefinementIteration(String artifactKey, int iteration, double score) {
        long total = refinementIterationCount.incrementAndGet();
        log.info("Refinement {} iteration {} scored {}. Total refinement iterations={}.",
                artifactKey, iteration, String.format("%.3f", score), total);
    }

    public void logSummary() {
        log.info("Planner stats: generationCalls={}, generationFailures={}, tasksExecuted={}, plansAssessed={}, "
                        + "deploymentReady={}, refinementIterations={}.",
                generationCallCount.get(), generationFailureCount.get(), taskExecutedCount.get(),
                planAssessedCount.get(), deploymentReadyCount.get(), refinementIterationCount.get());
    }
}
