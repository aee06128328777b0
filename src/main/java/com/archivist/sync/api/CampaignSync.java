package com.archivist.sync.api;

import com.archivist.sync.extract.EntityExtractor;
import com.archivist.sync.fingerprint.FingerprintEngine;
import com.archivist.sync.importer.ImportPreview;
import com.archivist.sync.importer.ImportSummary;
import com.archivist.sync.importer.ImporterService;
import com.archivist.sync.importer.PushFilter;
import com.archivist.sync.importer.RemoteUpserter;
import com.archivist.sync.link.LinkGraph;
import com.archivist.sync.link.LinkGraphIndexer;
import com.archivist.sync.link.LinkService;
import com.archivist.sync.logging.LogContext;
import com.archivist.sync.mapping.ConfidenceMapper;
import com.archivist.sync.mapping.MappingPresets;
import com.archivist.sync.metrics.NoOpSyncMetrics;
import com.archivist.sync.metrics.SyncMetrics;
import com.archivist.sync.plan.CreateLocalChoices;
import com.archivist.sync.plan.SyncPlan;
import com.archivist.sync.plan.SyncPlanBuilder;
import com.archivist.sync.plan.SyncPlanExecutor;
import com.archivist.sync.plan.SyncProgressListener;
import com.archivist.sync.plan.SyncReport;
import com.archivist.sync.reconcile.LocalSnapshot;
import com.archivist.sync.reconcile.ReconciliationEngine;
import com.archivist.sync.reconcile.ReconciliationResult;
import com.archivist.sync.refresh.RefreshResult;
import com.archivist.sync.refresh.RemoteRefreshService;
import com.archivist.sync.remote.HttpRemoteCampaignService;
import com.archivist.sync.remote.RemoteCampaignService;
import com.archivist.sync.remote.RemoteSnapshot;
import com.archivist.sync.reset.ResetMode;
import com.archivist.sync.reset.ResetResult;
import com.archivist.sync.reset.SyncResetService;
import com.archivist.sync.review.InMemoryReviewQueue;
import com.archivist.sync.review.ReviewQueue;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Main entry point for synchronizing a local campaign store with a remote campaign service.
 *
 * <p>A full sync goes through three steps:</p>
 * <pre>
 * try (CampaignSync sync = CampaignSync.builder()
 *         .options(SyncOptions.defaults("c-42"))
 *         .store(store)
 *         .remote(remote)
 *         .build()) {
 *     ReconciliationResult result = sync.reconcile();
 *     result.changeMatch(Category.CHARACTERS, Side.REMOTE, "r-1", "actor-7");
 *     SyncPlan plan = sync.plan(result, CreateLocalChoices.none());
 *     SyncReport report = sync.execute(plan, progress -> ...);
 * }
 * </pre>
 *
 * <p>The opportunistic importer, refresh, reset and link editing are exposed alongside.</p>
 */
public class CampaignSync implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CampaignSync.class);

    private final SyncOptions options;
    private final LocalStore store;
    private final RemoteCampaignService remote;
    private final ReconciliationEngine reconciliationEngine;
    private final SyncPlanBuilder planBuilder;
    private final SyncPlanExecutor executor;
    private final ImporterService importer;
    private final RemoteRefreshService refreshService;
    private final SyncResetService resetService;
    private final LinkGraphIndexer indexer;
    private final LinkService linkService;

    private CampaignSync(Builder builder) {
        this.options = builder.options;
        this.store = builder.store;
        SyncMetrics metrics = builder.metrics != null ? builder.metrics : new NoOpSyncMetrics();
        this.remote = builder.remote != null ? builder.remote : HttpRemoteCampaignService.builder()
                .baseUrl(options.getApiBaseUrl())
                .apiKey(options.getApiKey())
                .timeout(options.getRequestTimeout())
                .pageSize(options.getPageSize())
                .descriptionLimit(options.getDescriptionMaxLength())
                .build();

        this.indexer = new LinkGraphIndexer(store);
        this.linkService = new LinkService(store, indexer, remote, options.getCampaignId());
        this.reconciliationEngine = new ReconciliationEngine(metrics);
        this.planBuilder = new SyncPlanBuilder();
        this.executor = new SyncPlanExecutor(store, remote, metrics);
        this.refreshService = new RemoteRefreshService(store, remote, indexer);
        this.resetService = new SyncResetService(store, indexer);

        MappingPresets presets = builder.presets != null ? builder.presets : new MappingPresets();
        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.importer = ImporterService.builder()
                .store(store)
                .extractor(new EntityExtractor())
                .mapper(new ConfidenceMapper(presets, options.getSystemId(), metrics))
                .fingerprints(new FingerprintEngine())
                .upserter(new RemoteUpserter(remote, store))
                .reviewQueue(reviewQueue)
                .metrics(metrics)
                .campaignId(options.getCampaignId())
                .thresholds(options.getAutoImportThreshold(), options.getReviewThreshold())
                .build();

        log.info("campaign-sync.initialized options={}", options);
    }

    // ========== Reconciliation and plans ==========

    /**
     * Loads the remote campaign and pairs its entities with the local records.
     *
     * @throws com.archivist.sync.remote.RemoteServiceException if the remote campaign cannot be read
     */
    public ReconciliationResult reconcile() {
        try (LogContext ctx = LogContext.forReconcile(options.getCampaignId())) {
            RemoteSnapshot snapshot = RemoteSnapshot.load(remote, options.getCampaignId());
            return reconciliationEngine.reconcile(snapshot, LocalSnapshot.of(store));
        }
    }

    public SyncPlan plan(ReconciliationResult result, CreateLocalChoices choices) {
        return planBuilder.build(result, choices);
    }

    public SyncReport execute(SyncPlan plan) {
        return execute(plan, SyncProgressListener.NOOP);
    }

    public SyncReport execute(SyncPlan plan, SyncProgressListener listener) {
        return executor.execute(plan, listener);
    }

    public CompletableFuture<SyncReport> executeAsync(SyncPlan plan, SyncProgressListener listener) {
        return executor.executeAsync(plan, listener);
    }

    /**
     * Re-runs only the failed jobs of a finished execution.
     */
    public SyncReport retryFailed(SyncReport report, SyncProgressListener listener) {
        return executor.execute(SyncPlan.retryOf(report), listener);
    }

    public boolean isExecuting() {
        return executor.isRunning();
    }

    // ========== Import ==========

    public List<ImportPreview> sample(int sampleSize) {
        return importer.sample(sampleSize);
    }

    public ImportSummary runImport() {
        return importer.runImport();
    }

    public ImportSummary runImport(Consumer<ImportSummary> onProgress) {
        return importer.runImport(onProgress);
    }

    public int pushFiltered(PushFilter filter) {
        return importer.pushFiltered(filter);
    }

    public RemoteUpserter.UpsertResult approveReview(String reviewId, String reviewerId, String notes) {
        return importer.approve(reviewId, reviewerId, notes);
    }

    public void rejectReview(String reviewId, String reviewerId, String notes) {
        importer.reject(reviewId, reviewerId, notes);
    }

    public ImporterService getImporter() {
        return importer;
    }

    public ReviewQueue getReviewQueue() {
        return importer.getReviewQueue();
    }

    // ========== Maintenance ==========

    public RefreshResult refresh() {
        return refreshService.runFull(options.getCampaignId());
    }

    public ResetResult reset(ResetMode mode) {
        return resetService.reset(mode);
    }

    public LinkService links() {
        return linkService;
    }

    public LinkGraph graph() {
        return indexer.current();
    }

    public SyncOptions getOptions() {
        return options;
    }

    public RemoteCampaignService getRemote() {
        return remote;
    }

    @Override
    public void close() {
        executor.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SyncOptions options;
        private LocalStore store;
        private RemoteCampaignService remote;
        private SyncMetrics metrics;
        private MappingPresets presets;
        private ReviewQueue reviewQueue;

        public Builder options(SyncOptions options) {
            this.options = options;
            return this;
        }

        public Builder store(LocalStore store) {
            this.store = store;
            return this;
        }

        /**
         * Remote service to use. Without one, an HTTP client is built from the options.
         */
        public Builder remote(RemoteCampaignService remote) {
            this.remote = remote;
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder presets(MappingPresets presets) {
            this.presets = presets;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public CampaignSync build() {
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(store, "store is required");
            if (remote == null && options.getApiBaseUrl() == null) {
                throw new IllegalStateException("Either a remote service or an API base URL is required");
            }
            return new CampaignSync(this);
        }
    }
}
