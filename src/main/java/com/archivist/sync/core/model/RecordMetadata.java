package com.archivist.sync.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Sync metadata attached to a local record.
 *
 * <p>This block is the source of truth for cross references, relationships and the location
 * hierarchy; the link graph is derived from it. {@code relationshipOutbound} is directional
 * (edges leaving this record), {@code relationshipRefs} is the legacy symmetric form. Either may
 * be absent, which is different from present-but-empty: an absent outbound block makes readers
 * fall back to the refs block.</p>
 */
public final class RecordMetadata {

    private static final RecordMetadata EMPTY = builder().build();

    private final SheetType sheetType;
    private final String remoteId;
    private final String remoteCampaignId;
    private final OutboundBuckets relationshipOutbound;
    private final OutboundBuckets relationshipRefs;
    private final String parentLocationId;
    private final LocalCrossReferences localCrossReferences;
    private final String fingerprint;
    private final String sessionDate;

    private RecordMetadata(Builder builder) {
        this.sheetType = builder.sheetType;
        this.remoteId = builder.remoteId;
        this.remoteCampaignId = builder.remoteCampaignId;
        this.relationshipOutbound = builder.relationshipOutbound;
        this.relationshipRefs = builder.relationshipRefs;
        this.parentLocationId = builder.parentLocationId;
        this.localCrossReferences = builder.localCrossReferences != null
                ? builder.localCrossReferences : LocalCrossReferences.empty();
        this.fingerprint = builder.fingerprint;
        this.sessionDate = builder.sessionDate;
    }

    public static RecordMetadata empty() {
        return EMPTY;
    }

    public Optional<SheetType> getSheetType() {
        return Optional.ofNullable(sheetType);
    }

    public Optional<String> getRemoteId() {
        return Optional.ofNullable(remoteId);
    }

    public Optional<String> getRemoteCampaignId() {
        return Optional.ofNullable(remoteCampaignId);
    }

    public Optional<OutboundBuckets> getRelationshipOutbound() {
        return Optional.ofNullable(relationshipOutbound);
    }

    public Optional<OutboundBuckets> getRelationshipRefs() {
        return Optional.ofNullable(relationshipRefs);
    }

    public Optional<String> getParentLocationId() {
        return Optional.ofNullable(parentLocationId);
    }

    public LocalCrossReferences getLocalCrossReferences() {
        return localCrossReferences;
    }

    public Optional<String> getFingerprint() {
        return Optional.ofNullable(fingerprint);
    }

    public Optional<String> getSessionDate() {
        return Optional.ofNullable(sessionDate);
    }

    /**
     * Outbound edges for indexing: the directional block when present, else the legacy refs.
     */
    public OutboundBuckets effectiveOutbound() {
        if (relationshipOutbound != null) {
            return relationshipOutbound;
        }
        return relationshipRefs != null ? relationshipRefs : OutboundBuckets.empty();
    }

    /**
     * Returns true if the remote id is bound to the given campaign.
     */
    public boolean isBoundTo(String campaignId) {
        return remoteId != null && Objects.equals(remoteCampaignId, campaignId);
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }

    public Builder toBuilder() {
        return new Builder()
                .sheetType(sheetType)
                .remoteId(remoteId)
                .remoteCampaignId(remoteCampaignId)
                .relationshipOutbound(relationshipOutbound)
                .relationshipRefs(relationshipRefs)
                .parentLocationId(parentLocationId)
                .localCrossReferences(localCrossReferences)
                .fingerprint(fingerprint)
                .sessionDate(sessionDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordMetadata that = (RecordMetadata) o;
        return sheetType == that.sheetType
                && Objects.equals(remoteId, that.remoteId)
                && Objects.equals(remoteCampaignId, that.remoteCampaignId)
                && Objects.equals(relationshipOutbound, that.relationshipOutbound)
                && Objects.equals(relationshipRefs, that.relationshipRefs)
                && Objects.equals(parentLocationId, that.parentLocationId)
                && Objects.equals(localCrossReferences, that.localCrossReferences)
                && Objects.equals(fingerprint, that.fingerprint)
                && Objects.equals(sessionDate, that.sessionDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetType, remoteId, remoteCampaignId, relationshipOutbound,
                relationshipRefs, parentLocationId, localCrossReferences, fingerprint, sessionDate);
    }

    @Override
    public String toString() {
        return "RecordMetadata{" +
                "sheetType=" + sheetType +
                ", remoteId='" + remoteId + '\'' +
                ", remoteCampaignId='" + remoteCampaignId + '\'' +
                ", parentLocationId='" + parentLocationId + '\'' +
                ", fingerprint='" + fingerprint + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SheetType sheetType;
        private String remoteId;
        private String remoteCampaignId;
        private OutboundBuckets relationshipOutbound;
        private OutboundBuckets relationshipRefs;
        private String parentLocationId;
        private LocalCrossReferences localCrossReferences;
        private String fingerprint;
        private String sessionDate;

        public Builder sheetType(SheetType sheetType) {
            this.sheetType = sheetType;
            return this;
        }

        public Builder remoteId(String remoteId) {
            this.remoteId = remoteId;
            return this;
        }

        public Builder remoteCampaignId(String remoteCampaignId) {
            this.remoteCampaignId = remoteCampaignId;
            return this;
        }

        public Builder relationshipOutbound(OutboundBuckets relationshipOutbound) {
            this.relationshipOutbound = relationshipOutbound;
            return this;
        }

        public Builder relationshipRefs(OutboundBuckets relationshipRefs) {
            this.relationshipRefs = relationshipRefs;
            return this;
        }

        public Builder parentLocationId(String parentLocationId) {
            this.parentLocationId = parentLocationId;
            return this;
        }

        public Builder localCrossReferences(LocalCrossReferences localCrossReferences) {
            this.localCrossReferences = localCrossReferences;
            return this;
        }

        public Builder fingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder sessionDate(String sessionDate) {
            this.sessionDate = sessionDate;
            return this;
        }

        /**
         * @throws MetadataValidationException if an id field is present but blank,
         *                                     or a campaign is set without a remote id
         */
        public RecordMetadata build() {
            requireNotBlank(remoteId, "remoteId");
            requireNotBlank(remoteCampaignId, "remoteCampaignId");
            requireNotBlank(parentLocationId, "parentLocationId");
            if (remoteCampaignId != null && remoteId == null) {
                throw new MetadataValidationException("remoteCampaignId requires a remoteId");
            }
            return new RecordMetadata(this);
        }

        private static void requireNotBlank(String value, String field) {
            if (value != null && value.isBlank()) {
                throw new MetadataValidationException(field + " must not be blank");
            }
        }
    }
}
