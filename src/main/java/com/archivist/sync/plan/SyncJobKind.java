package com.archivist.sync.plan;

import com.archivist.sync.reconcile.Category;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.store.LocalRecordKind;

/**
 * What a job operates on. Characters are split into PC and NPC because the type travels
 * with the remote payload.
 */
public enum SyncJobKind {
    PC("PC", RemoteEntityKind.CHARACTER, LocalRecordKind.CHARACTER),
    NPC("NPC", RemoteEntityKind.CHARACTER, LocalRecordKind.CHARACTER),
    ITEM("Item", RemoteEntityKind.ITEM, LocalRecordKind.ITEM),
    LOCATION("Location", RemoteEntityKind.LOCATION, LocalRecordKind.LOCATION),
    FACTION("Faction", RemoteEntityKind.FACTION, LocalRecordKind.FACTION),
    RECAP("Recap", null, LocalRecordKind.SHEET);

    private final String label;
    private final RemoteEntityKind remoteKind;
    private final LocalRecordKind localKind;

    SyncJobKind(String label, RemoteEntityKind remoteKind, LocalRecordKind localKind) {
        this.label = label;
        this.remoteKind = remoteKind;
        this.localKind = localKind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Remote collection of this kind; null for recaps, which are read from sessions.
     */
    public RemoteEntityKind getRemoteKind() {
        return remoteKind;
    }

    public LocalRecordKind getLocalKind() {
        return localKind;
    }

    public boolean isCharacter() {
        return this == PC || this == NPC;
    }

    /**
     * Kind of a reconciliation row; {@code type} is only read for characters.
     */
    public static SyncJobKind of(Category category, String type) {
        return switch (category) {
            case CHARACTERS -> RemoteEntity.NPC.equalsIgnoreCase(type) ? NPC : PC;
            case ITEMS -> ITEM;
            case LOCATIONS -> LOCATION;
            case FACTIONS -> FACTION;
        };
    }
}
