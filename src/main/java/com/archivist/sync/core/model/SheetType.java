package com.archivist.sync.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Classification stored on records owned or annotated by the sync engine.
 */
public enum SheetType {
    PC("pc"),
    NPC("npc"),
    CHARACTER("character"),
    ITEM("item"),
    LOCATION("location"),
    FACTION("faction"),
    RECAP("recap");

    private final String value;

    SheetType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isCharacter() {
        return this == PC || this == NPC || this == CHARACTER;
    }

    public static Optional<SheetType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        for (SheetType type : values()) {
            if (type.value.equals(wanted)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
