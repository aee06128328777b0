package com.archivist.sync.store;

import com.archivist.sync.core.model.RecordMetadata;

import java.util.Objects;

/**
 * Data for a record the engine asks the local store to create.
 *
 * @param name       display name
 * @param type       host subtype, e.g. {@code character} or {@code npc}; may be empty
 * @param folderName destination folder, may be empty
 * @param image      image URL or null
 * @param body       initial text content, may be empty
 * @param metadata   engine metadata written together with the record
 */
public record NewRecord(
        String name,
        String type,
        String folderName,
        String image,
        String body,
        RecordMetadata metadata
) {
    public NewRecord {
        Objects.requireNonNull(name, "name is required");
        type = type != null ? type : "";
        folderName = folderName != null ? folderName : "";
        body = body != null ? body : "";
        metadata = metadata != null ? metadata : RecordMetadata.empty();
    }

    public static NewRecord named(String name, RecordMetadata metadata) {
        return new NewRecord(name, "", "", null, "", metadata);
    }
}
