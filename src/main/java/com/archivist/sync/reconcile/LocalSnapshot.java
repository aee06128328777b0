package com.archivist.sync.reconcile;

import com.archivist.sync.store.LocalStore;

import java.util.List;

/**
 * Local candidates per category. Factions have no local side.
 */
public record LocalSnapshot(
        List<ReconciliationCandidate> characters,
        List<ReconciliationCandidate> items,
        List<ReconciliationCandidate> locations
) {
    public LocalSnapshot {
        characters = characters != null ? List.copyOf(characters) : List.of();
        items = items != null ? List.copyOf(items) : List.of();
        locations = locations != null ? List.copyOf(locations) : List.of();
    }

    public static LocalSnapshot of(LocalStore store) {
        return new LocalSnapshot(
                store.listCharacters().stream().map(ReconciliationCandidate::of).toList(),
                store.listItems().stream().map(ReconciliationCandidate::of).toList(),
                store.listLocations().stream().map(ReconciliationCandidate::of).toList());
    }

    public List<ReconciliationCandidate> candidates(Category category) {
        return switch (category) {
            case CHARACTERS -> characters;
            case ITEMS -> items;
            case LOCATIONS -> locations;
            case FACTIONS -> List.of();
        };
    }
}
