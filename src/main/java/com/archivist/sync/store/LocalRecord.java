package com.archivist.sync.store;

import com.archivist.sync.core.model.RecordMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record of the local world store as seen by the sync engine.
 *
 * <p>{@code attributes} holds the host's kind-specific raw data (for example
 * {@code biography.value} on characters or {@code notes} on locations); only the
 * entity extractor reads it. Everything the engine itself writes goes through
 * {@link RecordMetadata}.</p>
 */
public final class LocalRecord {
    private final String id;
    private final LocalRecordKind kind;
    private final String name;
    private final String type;
    private final String folderName;
    private final String description;
    private final String image;
    private final Map<String, Object> attributes;
    private final List<TextPage> pages;
    private final RecordMetadata metadata;

    private LocalRecord(Builder builder) {
        this.id = builder.id;
        this.kind = builder.kind;
        this.name = builder.name;
        this.type = builder.type != null ? builder.type : "";
        this.folderName = builder.folderName != null ? builder.folderName : "";
        this.description = builder.description != null ? builder.description : "";
        this.image = builder.image;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.pages = List.copyOf(builder.pages);
        this.metadata = builder.metadata != null ? builder.metadata : RecordMetadata.empty();
    }

    public String getId() {
        return id;
    }

    public LocalRecordKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * Host-specific subtype, e.g. {@code character}, {@code npc}, {@code loot}. Empty when untyped.
     */
    public String getType() {
        return type;
    }

    public String getFolderName() {
        return folderName;
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getImage() {
        return Optional.ofNullable(image);
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public List<TextPage> getPages() {
        return pages;
    }

    public RecordMetadata getMetadata() {
        return metadata;
    }

    public Optional<String> getRemoteId() {
        return metadata.getRemoteId();
    }

    /**
     * Graph identity: the remote id when bound, otherwise the local id.
     */
    public String getEntityId() {
        return metadata.getRemoteId().orElse(id);
    }

    public LocalRecord withMetadata(RecordMetadata newMetadata) {
        return builder(this).metadata(newMetadata).build();
    }

    public LocalRecord withName(String newName) {
        return builder(this).name(newName).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocalRecord that = (LocalRecord) o;
        return Objects.equals(id, that.id)
                && kind == that.kind
                && Objects.equals(name, that.name)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return "LocalRecord{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", metadata=" + metadata +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(LocalRecord record) {
        return new Builder()
                .id(record.id)
                .kind(record.kind)
                .name(record.name)
                .type(record.type)
                .folderName(record.folderName)
                .description(record.description)
                .image(record.image)
                .attributes(record.attributes)
                .pages(record.pages)
                .metadata(record.metadata);
    }

    public static class Builder {
        private String id;
        private LocalRecordKind kind;
        private String name;
        private String type;
        private String folderName;
        private String description;
        private String image;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<TextPage> pages = new ArrayList<>();
        private RecordMetadata metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(LocalRecordKind kind) {
            this.kind = kind;
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

        public Builder folderName(String folderName) {
            this.folderName = folderName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder image(String image) {
            this.image = image != null && !image.isBlank() ? image : null;
            return this;
        }

        public Builder attribute(String key, Object value) {
            if (key != null && value != null) {
                this.attributes.put(key, value);
            }
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            this.attributes.clear();
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder page(TextPage page) {
            this.pages.add(Objects.requireNonNull(page, "page"));
            return this;
        }

        public Builder pages(List<TextPage> pages) {
            this.pages.clear();
            if (pages != null) {
                pages.forEach(this::page);
            }
            return this;
        }

        public Builder metadata(RecordMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public LocalRecord build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(name, "name is required");
            return new LocalRecord(this);
        }
    }
}
