package com.archivist.sync.reconcile;

import com.archivist.sync.remote.RemoteEntityKind;

/**
 * Entity categories of a reconciliation.
 */
public enum Category {
    CHARACTERS(RemoteEntityKind.CHARACTER),
    ITEMS(RemoteEntityKind.ITEM),
    LOCATIONS(RemoteEntityKind.LOCATION),
    FACTIONS(RemoteEntityKind.FACTION);

    private final RemoteEntityKind remoteKind;

    Category(RemoteEntityKind remoteKind) {
        this.remoteKind = remoteKind;
    }

    public RemoteEntityKind getRemoteKind() {
        return remoteKind;
    }
}
