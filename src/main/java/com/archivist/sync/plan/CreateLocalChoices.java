package com.archivist.sync.plan;

import com.archivist.sync.reconcile.Category;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Remote-only entities the user asked to create as full local records rather than
 * reference sheets. Factions cannot be opted in.
 */
public final class CreateLocalChoices {

    private final Map<Category, Set<String>> remoteIds = new EnumMap<>(Category.class);

    private CreateLocalChoices() {
    }

    public static CreateLocalChoices none() {
        return new CreateLocalChoices();
    }

    public static CreateLocalChoices of(Category category, Collection<String> ids) {
        CreateLocalChoices choices = new CreateLocalChoices();
        ids.forEach(id -> choices.add(category, id));
        return choices;
    }

    /**
     * @throws IllegalArgumentException for {@link Category#FACTIONS}
     */
    public CreateLocalChoices add(Category category, String remoteId) {
        if (category == Category.FACTIONS) {
            throw new IllegalArgumentException("Factions are always imported as sheets");
        }
        remoteIds.computeIfAbsent(category, k -> new LinkedHashSet<>()).add(remoteId);
        return this;
    }

    public boolean contains(Category category, String remoteId) {
        return remoteIds.getOrDefault(category, Set.of()).contains(remoteId);
    }

    public int size() {
        return remoteIds.values().stream().mapToInt(Set::size).sum();
    }
}
