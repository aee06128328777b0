package com.archivist.sync.remote;

import java.util.Locale;
import java.util.Objects;

/**
 * A character, item, location or faction as listed by the remote service.
 *
 * @param id          remote id
 * @param name        display name, trimmed
 * @param type        character type ({@code PC}/{@code NPC}); empty for other kinds
 * @param description description text, may be empty
 * @param image       image URL, may be null
 * @param parentId    parent location id (locations only), may be null
 */
public record RemoteEntity(
        String id,
        String name,
        String type,
        String description,
        String image,
        String parentId
) {
    public static final String PC = "PC";
    public static final String NPC = "NPC";

    public RemoteEntity {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name.trim() : "";
        type = type != null ? type.trim() : "";
        description = description != null ? description : "";
        image = image != null && !image.isBlank() ? image.trim() : null;
        parentId = parentId != null && !parentId.isBlank() ? parentId : null;
    }

    public static RemoteEntity named(String id, String name) {
        return new RemoteEntity(id, name, null, null, null, null);
    }

    public static RemoteEntity character(String id, String name, String type) {
        return new RemoteEntity(id, name, type, null, null, null);
    }

    /**
     * Character type upper-cased, defaulting to {@code PC} when unset.
     */
    public String characterType() {
        return type.isEmpty() ? PC : type.toUpperCase(Locale.ROOT);
    }
}
