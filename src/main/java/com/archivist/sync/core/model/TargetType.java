package com.archivist.sync.core.model;

import java.util.Locale;

/**
 * Shapes a local entity can be mapped to on the remote campaign service.
 */
public enum TargetType {
    CHARACTER("Character"),
    ITEM("Item"),
    LOCATION("Location"),
    FACTION("Faction"),
    NOTE("Note");

    private final String label;

    TargetType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a label or constant name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no target type
     */
    public static TargetType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Target type is required");
        }
        String wanted = value.trim().toUpperCase(Locale.ROOT);
        for (TargetType type : values()) {
            if (type.name().equals(wanted)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown target type: " + value);
    }
}
