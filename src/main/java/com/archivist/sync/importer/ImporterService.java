package com.archivist.sync.importer;

import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.extract.EntityExtractor;
import com.archivist.sync.fingerprint.FingerprintEngine;
import com.archivist.sync.logging.LogContext;
import com.archivist.sync.mapping.ConfidenceMapper;
import com.archivist.sync.mapping.MappingCorrections;
import com.archivist.sync.metrics.NoOpSyncMetrics;
import com.archivist.sync.metrics.SyncMetrics;
import com.archivist.sync.review.InMemoryReviewQueue;
import com.archivist.sync.review.ReviewItem;
import com.archivist.sync.review.ReviewQueue;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordNotFoundException;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Opportunistic import of local records into the remote campaign.
 *
 * <p>Every entity is mapped, corrected and scored. At or above the auto-import threshold it is
 * upserted and its fingerprint stored; between the review and auto-import thresholds it is queued
 * for review; below, or when excluded by a correction, it is dropped. An entity whose fingerprint
 * matches the stored one and which is still bound to the campaign is skipped. Failures are
 * counted, never thrown.</p>
 */
public class ImporterService {
    private static final Logger log = LoggerFactory.getLogger(ImporterService.class);

    public static final double DEFAULT_AUTO_IMPORT_THRESHOLD = 0.75;
    public static final double DEFAULT_REVIEW_THRESHOLD = 0.40;

    private final LocalStore store;
    private final EntityExtractor extractor;
    private final ConfidenceMapper mapper;
    private final FingerprintEngine fingerprints;
    private final RemoteUpserter upserter;
    private final ReviewQueue reviewQueue;
    private final SyncMetrics metrics;
    private final String campaignId;
    private final double autoImportThreshold;
    private final double reviewThreshold;
    private volatile MappingCorrections corrections;

    private ImporterService(Builder builder) {
        this.store = builder.store;
        this.extractor = builder.extractor;
        this.mapper = builder.mapper;
        this.fingerprints = builder.fingerprints;
        this.upserter = builder.upserter;
        this.reviewQueue = builder.reviewQueue;
        this.metrics = builder.metrics;
        this.campaignId = builder.campaignId;
        this.autoImportThreshold = builder.autoImportThreshold;
        this.reviewThreshold = builder.reviewThreshold;
        this.corrections = builder.corrections;
    }

    public MappingCorrections getCorrections() {
        return corrections;
    }

    public void setCorrections(MappingCorrections corrections) {
        this.corrections = Objects.requireNonNull(corrections, "corrections");
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    /**
     * Corrected proposals for the first {@code sampleSize} entities, without writing anything.
     */
    public List<ImportPreview> sample(int sampleSize) {
        MappingCorrections current = corrections;
        List<ImportPreview> previews = new ArrayList<>();
        for (GenericEntity entity : extractor.extract(store, sampleSize)) {
            MappingProposal proposal = current.apply(entity, mapper.map(entity));
            previews.add(new ImportPreview(entity, proposal, current.isIncluded(entity)));
        }
        return previews;
    }

    public ImportSummary runImport() {
        return runImport(summary -> {
        });
    }

    /**
     * @param onProgress receives the running counters after every entity
     */
    public ImportSummary runImport(Consumer<ImportSummary> onProgress) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forImport(runId).with("campaignId", campaignId)) {
            List<GenericEntity> entities = extractor.extract(store);
            MappingCorrections current = corrections;
            ImportSummary summary = ImportSummary.start(entities.size());
            onProgress.accept(summary);
            log.info("import.start entities={} autoThreshold={} reviewThreshold={}",
                    entities.size(), autoImportThreshold, reviewThreshold);

            for (GenericEntity entity : entities) {
                ImportDecision decision;
                try {
                    decision = decide(entity, current);
                } catch (RuntimeException e) {
                    log.warn("import.entity.failed source={} name='{}' error={}",
                            entity.getSourceId(), entity.getName(), e.getMessage());
                    decision = ImportDecision.FAILED;
                }
                metrics.recordImportDecision(decision);
                summary = summary.record(decision);
                onProgress.accept(summary);
            }
            log.info("import.done total={} autoImported={} queued={} dropped={} unchanged={} errors={}",
                    summary.total(), summary.autoImported(), summary.queued(), summary.dropped(),
                    summary.unchanged(), summary.errors());
            return summary;
        }
    }

    private ImportDecision decide(GenericEntity entity, MappingCorrections current) {
        if (!current.isIncluded(entity)) {
            return ImportDecision.DROPPED;
        }
        MappingProposal proposal = current.apply(entity, mapper.map(entity));
        double score = proposal.score();
        if (score >= autoImportThreshold) {
            LocalRecord record = requireRecord(entity.getSourceId());
            String fingerprint = fingerprints.fingerprint(entity);
            if (record.getMetadata().getFingerprint().filter(fingerprint::equals).isPresent()
                    && record.getMetadata().isBoundTo(campaignId)) {
                return ImportDecision.UNCHANGED;
            }
            importRecord(record, proposal, fingerprint);
            return ImportDecision.AUTO_IMPORTED;
        }
        if (score >= reviewThreshold) {
            reviewQueue.submit(ReviewItem.builder()
                    .sourceId(entity.getSourceId())
                    .sourceName(entity.getName())
                    .entityKind(entity.getKind())
                    .proposal(proposal)
                    .fingerprint(fingerprints.fingerprint(entity))
                    .build());
            return ImportDecision.QUEUED;
        }
        return ImportDecision.DROPPED;
    }

    /**
     * Approves a queued proposal and upserts it.
     *
     * @throws IllegalArgumentException if the review item does not exist
     * @throws IllegalStateException    if the review item is not pending
     */
    public RemoteUpserter.UpsertResult approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = reviewQueue.get(reviewId)
                .orElseThrow(() -> new IllegalArgumentException("Review item not found: " + reviewId));
        reviewQueue.approve(reviewId, reviewerId, notes);
        RemoteUpserter.UpsertResult result = importRecord(requireRecord(item.getSourceId()),
                item.getProposal(), item.getFingerprint());
        metrics.recordImportDecision(ImportDecision.AUTO_IMPORTED);
        log.info("import.review.imported reviewId={} source={} outcome={}", reviewId, item.getSourceId(), result.outcome());
        return result;
    }

    public void reject(String reviewId, String reviewerId, String notes) {
        reviewQueue.reject(reviewId, reviewerId, notes);
    }

    /**
     * Pushes every entity accepted by the filter regardless of score.
     *
     * @return the number of records created or updated
     */
    public int pushFiltered(PushFilter filter) {
        MappingCorrections current = corrections;
        int pushed = 0;
        for (GenericEntity entity : extractor.extract(store)) {
            if (!filter.acceptsEntity(entity)) {
                continue;
            }
            MappingProposal proposal = current.apply(entity, mapper.map(entity));
            if (!filter.acceptsProposal(proposal)) {
                continue;
            }
            try {
                RemoteUpserter.UpsertResult result = importRecord(requireRecord(entity.getSourceId()), proposal,
                        fingerprints.fingerprint(entity));
                if (result.outcome() != RemoteUpserter.Outcome.NOT_SUPPORTED) {
                    pushed++;
                }
            } catch (RuntimeException e) {
                log.warn("import.push.failed source={} name='{}' error={}",
                        entity.getSourceId(), entity.getName(), e.getMessage());
            }
        }
        log.info("import.push.done pushed={} target={}", pushed, filter.targetType());
        return pushed;
    }

    private RemoteUpserter.UpsertResult importRecord(LocalRecord record, MappingProposal proposal, String fingerprint) {
        RemoteUpserter.UpsertResult result = upserter.upsert(record, proposal, campaignId);
        if (fingerprint != null) {
            LocalRecord current = requireRecord(record.getId());
            store.updateMetadata(record.getId(), current.getMetadata().toBuilder().fingerprint(fingerprint).build());
        }
        log.debug("import.upserted source={} target={} outcome={} remoteId={}",
                record.getId(), proposal.targetType(), result.outcome(), result.remoteId());
        return result;
    }

    private LocalRecord requireRecord(String id) {
        return store.find(id).orElseThrow(() -> new LocalRecordNotFoundException(id));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalStore store;
        private EntityExtractor extractor = new EntityExtractor();
        private ConfidenceMapper mapper;
        private FingerprintEngine fingerprints = new FingerprintEngine();
        private RemoteUpserter upserter;
        private ReviewQueue reviewQueue = new InMemoryReviewQueue();
        private SyncMetrics metrics = new NoOpSyncMetrics();
        private String campaignId;
        private double autoImportThreshold = DEFAULT_AUTO_IMPORT_THRESHOLD;
        private double reviewThreshold = DEFAULT_REVIEW_THRESHOLD;
        private MappingCorrections corrections = new MappingCorrections();

        public Builder store(LocalStore store) {
            this.store = store;
            return this;
        }

        public Builder extractor(EntityExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder mapper(ConfidenceMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder fingerprints(FingerprintEngine fingerprints) {
            this.fingerprints = fingerprints;
            return this;
        }

        public Builder upserter(RemoteUpserter upserter) {
            this.upserter = upserter;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder thresholds(double autoImport, double review) {
            this.autoImportThreshold = autoImport;
            this.reviewThreshold = review;
            return this;
        }

        public Builder corrections(MappingCorrections corrections) {
            this.corrections = corrections;
            return this;
        }

        public ImporterService build() {
            Objects.requireNonNull(store, "store is required");
            Objects.requireNonNull(upserter, "upserter is required");
            Objects.requireNonNull(campaignId, "campaignId is required");
            Objects.requireNonNull(corrections, "corrections is required");
            if (mapper == null) {
                mapper = new ConfidenceMapper();
            }
            if (reviewThreshold < 0.0 || autoImportThreshold > 1.0 || reviewThreshold > autoImportThreshold) {
                throw new IllegalArgumentException("Thresholds must satisfy 0 <= review <= autoImport <= 1");
            }
            return new ImporterService(this);
        }
    }
}
