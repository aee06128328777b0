package com.archivist.sync.remote;

import java.util.Objects;
import java.util.Optional;

/**
 * Body of a create or update request for a character, item, location or faction.
 * Serialization to the wire shape is the service implementation's concern.
 */
public final class RemotePayload {
    private final String campaignId;
    private final String name;
    private final String type;
    private final String description;
    private final String image;
    private final String parentId;

    private RemotePayload(Builder builder) {
        this.campaignId = builder.campaignId;
        this.name = builder.name;
        this.type = builder.type;
        this.description = builder.description;
        this.image = builder.image;
        this.parentId = builder.parentId;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getName() {
        return name;
    }

    /**
     * Character type, {@code PC} or {@code NPC}; empty for other kinds.
     */
    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<String> getImage() {
        return Optional.ofNullable(image);
    }

    public Optional<String> getParentId() {
        return Optional.ofNullable(parentId);
    }

    public int descriptionLength() {
        return description != null ? description.length() : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RemotePayload that = (RemotePayload) o;
        return Objects.equals(campaignId, that.campaignId)
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(description, that.description)
                && Objects.equals(image, that.image)
                && Objects.equals(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(campaignId, name, type, description, image, parentId);
    }

    @Override
    public String toString() {
        return "RemotePayload{" +
                "campaignId='" + campaignId + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", image='" + image + '\'' +
                ", descriptionLength=" + descriptionLength() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String campaignId;
        private String name;
        private String type;
        private String description;
        private String image;
        private String parentId;

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null && !description.isBlank() ? description : null;
            return this;
        }

        /**
         * Only absolute {@code https} URLs are sent; anything else is dropped.
         */
        public Builder image(String image) {
            String value = image != null ? image.trim() : "";
            this.image = value.startsWith("https://") ? value : null;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public RemotePayload build() {
            Objects.requireNonNull(campaignId, "campaignId is required");
            Objects.requireNonNull(name, "name is required");
            return new RemotePayload(this);
        }
    }
}
