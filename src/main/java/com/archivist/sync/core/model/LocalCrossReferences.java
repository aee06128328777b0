package com.archivist.sync.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ids of related local records of other kinds (for example the scene that renders a location sheet).
 */
public record LocalCrossReferences(
        List<String> actors,
        List<String> items,
        List<String> scenes,
        List<String> journals
) {
    public LocalCrossReferences {
        actors = actors != null ? List.copyOf(actors) : List.of();
        items = items != null ? List.copyOf(items) : List.of();
        scenes = scenes != null ? List.copyOf(scenes) : List.of();
        journals = journals != null ? List.copyOf(journals) : List.of();
    }

    public static LocalCrossReferences empty() {
        return new LocalCrossReferences(null, null, null, null);
    }

    public boolean isEmpty() {
        return actors.isEmpty() && items.isEmpty() && scenes.isEmpty() && journals.isEmpty();
    }

    /**
     * A location sheet is rendered by at most one scene, so the list is replaced.
     */
    public LocalCrossReferences withScene(String sceneId) {
        return new LocalCrossReferences(actors, items, List.of(sceneId), journals);
    }

    public LocalCrossReferences withActor(String actorId) {
        if (actors.contains(actorId)) {
            return this;
        }
        List<String> next = new ArrayList<>(actors);
        next.add(actorId);
        return new LocalCrossReferences(next, items, scenes, journals);
    }
}
