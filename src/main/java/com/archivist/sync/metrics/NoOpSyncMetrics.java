package com.archivist.sync.metrics;

import com.archivist.sync.importer.ImportDecision;
import com.archivist.sync.plan.JobOutcome;
import com.archivist.sync.plan.JobType;
import com.archivist.sync.reconcile.Category;

import java.time.Duration;

/**
 * No-op implementation of {@link SyncMetrics}, used when no registry is configured.
 */
public class NoOpSyncMetrics implements SyncMetrics {

    @Override
    public void recordJob(JobType type, JobOutcome outcome) {
    }

    @Override
    public void recordPlanDuration(Duration duration, int failedJobs) {
    }

    @Override
    public void recordReconcileMatched(Category category, int matched) {
    }

    @Override
    public void recordImportDecision(ImportDecision decision) {
    }

    @Override
    public void recordMappingScore(double score) {
    }
}
