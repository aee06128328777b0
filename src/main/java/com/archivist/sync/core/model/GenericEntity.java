package com.archivist.sync.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Uniform, kind-tagged view of a local record.
 * Produced fresh by every extraction pass and consumed by mapping and fingerprinting;
 * never persisted.
 */
public final class GenericEntity {
    private final EntityKind kind;
    private final String subtype;
    private final String name;
    private final String body;
    private final Set<String> tags;
    private final List<EntityLink> links;
    private final List<String> images;
    private final String sourceId;
    private final String folderName;
    private final Map<String, Object> stats;
    private final Map<String, Object> metadata;

    private GenericEntity(Builder builder) {
        this.kind = builder.kind;
        this.subtype = builder.subtype != null ? builder.subtype : "";
        this.name = builder.name;
        this.body = builder.body != null ? builder.body : "";
        this.tags = Set.copyOf(builder.tags);
        this.links = List.copyOf(builder.links);
        this.images = List.copyOf(builder.images);
        this.sourceId = builder.sourceId;
        this.folderName = builder.folderName != null ? builder.folderName : "";
        this.stats = Map.copyOf(builder.stats);
        this.metadata = Map.copyOf(builder.metadata);
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getSubtype() {
        return subtype;
    }

    public String getName() {
        return name;
    }

    public String getBody() {
        return body;
    }

    public Set<String> getTags() {
        return tags;
    }

    public List<EntityLink> getLinks() {
        return links;
    }

    public List<String> getImages() {
        return images;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getFolderName() {
        return folderName;
    }

    public Map<String, Object> getStats() {
        return stats;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean hasImages() {
        return !images.isEmpty();
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericEntity that = (GenericEntity) o;
        return kind == that.kind
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(name, that.name)
                && Objects.equals(subtype, that.subtype)
                && Objects.equals(body, that.body)
                && Objects.equals(tags, that.tags)
                && Objects.equals(images, that.images);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sourceId, name);
    }

    @Override
    public String toString() {
        return "GenericEntity{" +
                "kind=" + kind +
                ", subtype='" + subtype + '\'' +
                ", name='" + name + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", folderName='" + folderName + '\'' +
                ", tags=" + tags +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(GenericEntity entity) {
        return new Builder()
                .kind(entity.kind)
                .subtype(entity.subtype)
                .name(entity.name)
                .body(entity.body)
                .tags(entity.tags)
                .links(entity.links)
                .images(entity.images)
                .sourceId(entity.sourceId)
                .folderName(entity.folderName)
                .stats(entity.stats)
                .metadata(entity.metadata);
    }

    public static class Builder {
        private EntityKind kind;
        private String subtype;
        private String name;
        private String body;
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<EntityLink> links = new ArrayList<>();
        private final List<String> images = new ArrayList<>();
        private String sourceId;
        private String folderName;
        private final Map<String, Object> stats = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder subtype(String subtype) {
            this.subtype = subtype;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder tag(String tag) {
            if (tag != null && !tag.isBlank()) {
                this.tags.add(tag);
            }
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            if (tags != null) {
                tags.forEach(this::tag);
            }
            return this;
        }

        public Builder link(EntityLink link) {
            this.links.add(link);
            return this;
        }

        public Builder links(Collection<EntityLink> links) {
            this.links.clear();
            if (links != null) {
                this.links.addAll(links);
            }
            return this;
        }

        public Builder image(String image) {
            if (image != null && !image.isBlank()) {
                this.images.add(image);
            }
            return this;
        }

        public Builder images(Collection<String> images) {
            this.images.clear();
            if (images != null) {
                images.forEach(this::image);
            }
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder folderName(String folderName) {
            this.folderName = folderName;
            return this;
        }

        /**
         * Null values are dropped; {@link Map#copyOf} does not accept them.
         */
        public Builder stat(String key, Object value) {
            if (key != null && value != null) {
                this.stats.put(key, value);
            }
            return this;
        }

        public Builder stats(Map<String, ?> stats) {
            this.stats.clear();
            if (stats != null) {
                stats.forEach(this::stat);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null && value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                metadata.forEach(this::metadata);
            }
            return this;
        }

        public GenericEntity build() {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(sourceId, "sourceId is required");
            return new GenericEntity(this);
        }
    }
}
