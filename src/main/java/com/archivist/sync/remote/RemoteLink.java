package com.archivist.sync.remote;

import java.util.Objects;

/**
 * A row of the remote link table: a directed edge between two remote entities.
 * Endpoint types are type names such as {@code Character} or {@code Location}.
 */
public record RemoteLink(String id, String fromId, String fromType, String toId, String toType) {

    public RemoteLink {
        Objects.requireNonNull(fromId, "fromId is required");
        Objects.requireNonNull(toId, "toId is required");
    }
}
