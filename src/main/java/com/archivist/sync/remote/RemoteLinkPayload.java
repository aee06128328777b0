package com.archivist.sync.remote;

import java.util.Objects;

/**
 * Body of a link creation request.
 */
public record RemoteLinkPayload(String campaignId, String fromId, String fromType, String toId, String toType) {

    public RemoteLinkPayload {
        Objects.requireNonNull(campaignId, "campaignId is required");
        Objects.requireNonNull(fromId, "fromId is required");
        Objects.requireNonNull(toId, "toId is required");
    }
}
