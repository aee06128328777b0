package com.archivist.sync.mapping;

import com.archivist.sync.core.model.EntityLink;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.extract.ValuePaths;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Path access into a {@link GenericEntity}.
 *
 * <p>The entity is viewed as a map with keys {@code kind}, {@code subtype}, {@code name},
 * {@code body}, {@code tags}, {@code links}, {@code images}, {@code sourceId},
 * {@code folderName}, {@code stats} and {@code metadata}. Expressions starting with
 * {@code $.} are paths into that view; anything else is a literal.</p>
 */
public final class EntityPaths {

    private EntityPaths() {
    }

    public static Map<String, Object> view(GenericEntity entity) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("kind", entity.getKind().getLabel());
        view.put("subtype", entity.getSubtype());
        view.put("name", entity.getName());
        view.put("body", entity.getBody());
        view.put("tags", new ArrayList<>(entity.getTags()));
        List<Map<String, Object>> links = new ArrayList<>();
        for (EntityLink link : entity.getLinks()) {
            links.add(Map.of("type", link.type(), "value", link.value()));
        }
        view.put("links", links);
        view.put("images", entity.getImages());
        view.put("sourceId", entity.getSourceId());
        view.put("folderName", entity.getFolderName());
        view.put("stats", entity.getStats());
        view.put("metadata", entity.getMetadata());
        return view;
    }

    public static Optional<Object> resolve(Map<String, Object> view, String path) {
        return ValuePaths.resolve(view, path);
    }

    /**
     * Evaluates a field expression: a {@code $.}-path to its text value, a literal to itself.
     */
    public static Optional<String> evaluate(Map<String, Object> view, String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        if (expression.startsWith("$.")) {
            return ValuePaths.resolveText(view, expression);
        }
        return expression.isBlank() ? Optional.empty() : Optional.of(expression);
    }
}
