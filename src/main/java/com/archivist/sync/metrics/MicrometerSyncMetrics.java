package com.archivist.sync.metrics;

import com.archivist.sync.importer.ImportDecision;
import com.archivist.sync.plan.JobOutcome;
import com.archivist.sync.plan.JobType;
import com.archivist.sync.reconcile.Category;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link SyncMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code campaign.sync.job}: Counter (tags: type, outcome)</li>
 *   <li>{@code campaign.sync.plan.duration}: Timer (tag: result)</li>
 *   <li>{@code campaign.reconcile.matched}: Counter (tag: category)</li>
 *   <li>{@code campaign.import.decision}: Counter (tag: decision)</li>
 *   <li>{@code campaign.mapping.score}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerSyncMetrics implements SyncMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary mappingScoreSummary;

    public MicrometerSyncMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.mappingScoreSummary = DistributionSummary.builder("campaign.mapping.score")
                .description("Distribution of mapping confidence scores")
                .register(registry);
    }

    @Override
    public void recordJob(JobType type, JobOutcome outcome) {
        String key = "job:" + type.name() + ":" + outcome.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("campaign.sync.job")
                        .description("Number of sync plan jobs processed")
                        .tag("type", type.name())
                        .tag("outcome", outcome.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordPlanDuration(Duration duration, int failedJobs) {
        String result = failedJobs == 0 ? "complete" : "partial";
        Timer timer = timerCache.computeIfAbsent(result, k ->
                Timer.builder("campaign.sync.plan.duration")
                        .description("Duration of sync plan executions")
                        .tag("result", result)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordReconcileMatched(Category category, int matched) {
        String key = "matched:" + category.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("campaign.reconcile.matched")
                        .description("Number of remote/local pairs matched by reconciliation")
                        .tag("category", category.name())
                        .register(registry));
        counter.increment(matched);
    }

    @Override
    public void recordImportDecision(ImportDecision decision) {
        String key = "decision:" + decision.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("campaign.import.decision")
                        .description("Number of importer decisions")
                        .tag("decision", decision.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordMappingScore(double score) {
        mappingScoreSummary.record(score);
    }
}
