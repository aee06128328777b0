package com.archivist.sync.metrics;

import com.archivist.sync.importer.ImportDecision;
import com.archivist.sync.plan.JobOutcome;
import com.archivist.sync.plan.JobType;
import com.archivist.sync.reconcile.Category;

import java.time.Duration;

/**
 * Interface for recording sync metrics.
 * The default {@link NoOpSyncMetrics} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface SyncMetrics {

    void recordJob(JobType type, JobOutcome outcome);

    void recordPlanDuration(Duration duration, int failedJobs);

    void recordReconcileMatched(Category category, int matched);

    void recordImportDecision(ImportDecision decision);

    void recordMappingScore(double score);
}
