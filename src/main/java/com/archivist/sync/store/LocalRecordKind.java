package com.archivist.sync.store;

/**
 * Collections of the local world store.
 * LOCATION records are the rendered maps (scenes); SHEET records are journals owned by the sync engine.
 */
public enum LocalRecordKind {
    CHARACTER("actor"),
    ITEM("item"),
    LOCATION("scene"),
    FACTION("faction"),
    NOTE("journal"),
    SHEET("sheet");

    private final String idPrefix;

    LocalRecordKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
