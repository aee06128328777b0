package com.archivist.sync.core.model;

import java.util.Objects;

/**
 * A cross-reference token found in free text.
 *
 * @param type  token grammar, {@code uuid} or {@code journal}
 * @param value the referenced identifier or name
 */
public record EntityLink(String type, String value) {

    public static final String UUID_TYPE = "uuid";
    public static final String JOURNAL_TYPE = "journal";

    public EntityLink {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(value, "value is required");
    }
}
