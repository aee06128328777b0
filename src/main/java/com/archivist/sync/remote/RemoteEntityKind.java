package com.archivist.sync.remote;

/**
 * Entity collections of the remote campaign service, with their REST path and link type name.
 */
public enum RemoteEntityKind {
    CHARACTER("Character", "/characters"),
    ITEM("Item", "/items"),
    LOCATION("Location", "/locations"),
    FACTION("Faction", "/factions");

    private final String typeName;
    private final String path;

    RemoteEntityKind(String typeName, String path) {
        this.typeName = typeName;
        this.path = path;
    }

    /**
     * Name used for link endpoints, e.g. {@code Character}.
     */
    public String getTypeName() {
        return typeName;
    }

    public String getPath() {
        return path;
    }
}
