package com.archivist.sync.review;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.MappingProposal;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A mapping proposal waiting for a manual decision.
 * Created by the importer for proposals scored between the review and auto-import thresholds.
 */
public class ReviewItem {

    private final String id;
    private final String sourceId;
    private final String sourceName;
    private final EntityKind entityKind;
    private final MappingProposal proposal;
    private final String fingerprint;
    private final Instant submittedAt;
    private ReviewStatus status;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId is required");
        this.sourceName = builder.sourceName;
        this.entityKind = Objects.requireNonNull(builder.entityKind, "entityKind is required");
        this.proposal = Objects.requireNonNull(builder.proposal, "proposal is required");
        this.fingerprint = builder.fingerprint;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    /**
     * Local record id of the proposed entity.
     */
    public String getSourceId() {
        return sourceId;
    }

    public String getSourceName() {
        return sourceName;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public MappingProposal getProposal() {
        return proposal;
    }

    public double getScore() {
        return proposal.score();
    }

    /**
     * Fingerprint of the entity when it was queued, written back if the item is imported.
     */
    public String getFingerprint() {
        return fingerprint;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    void markApproved(String reviewerId, String notes) {
        mark(ReviewStatus.APPROVED, reviewerId, notes);
    }

    void markRejected(String reviewerId, String notes) {
        mark(ReviewStatus.REJECTED, reviewerId, notes);
    }

    private void mark(ReviewStatus newStatus, String reviewerId, String notes) {
        this.status = newStatus;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ReviewItem) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", target=" + proposal.targetType() +
                ", score=" + proposal.score() +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceId;
        private String sourceName;
        private EntityKind entityKind;
        private MappingProposal proposal;
        private String fingerprint;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder proposal(MappingProposal proposal) {
            this.proposal = proposal;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
