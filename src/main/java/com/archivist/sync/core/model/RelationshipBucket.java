package com.archivist.sync.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind-bucket of a relationship edge, named after the kind of the target entity.
 */
public enum RelationshipBucket {
    CHARACTERS("characters"),
    ITEMS("items"),
    FACTIONS("factions"),
    LOCATIONS_ASSOCIATIVE("locationsAssociative"),
    ENTRIES("entries");

    private final String key;

    RelationshipBucket(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Maps a remote link endpoint type (Character, Item, Location, Faction, entry/journal)
     * to the bucket that stores edges towards it.
     */
    public static Optional<RelationshipBucket> forEntityType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "character" -> Optional.of(CHARACTERS);
            case "item" -> Optional.of(ITEMS);
            case "location" -> Optional.of(LOCATIONS_ASSOCIATIVE);
            case "faction" -> Optional.of(FACTIONS);
            case "entry", "journal", "journalentry" -> Optional.of(ENTRIES);
            default -> Optional.empty();
        };
    }
}
