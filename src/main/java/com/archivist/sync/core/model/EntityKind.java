package com.archivist.sync.core.model;

/**
 * Kinds of local records the extractor understands.
 * JOURNAL covers free-text notes of any shape.
 */
public enum EntityKind {
    CHARACTER("Character"),
    ITEM("Item"),
    LOCATION("Location"),
    FACTION("Faction"),
    JOURNAL("Journal");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
