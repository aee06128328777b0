package com.archivist.sync.mapping;

import com.archivist.sync.core.model.EntityKind;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Guard of a {@link MappingRule}, evaluated against an entity view from {@link EntityPaths#view}.
 */
@FunctionalInterface
public interface MappingCondition {

    MappingCondition ALWAYS = view -> true;

    boolean test(Map<String, Object> view);

    default MappingCondition and(MappingCondition other) {
        return allOf(this, other);
    }

    static MappingCondition kind(EntityKind kind) {
        Objects.requireNonNull(kind, "kind");
        return view -> kind.getLabel().equals(view.get("kind"));
    }

    /**
     * Exact equality of the value at {@code path} with {@code expected}.
     */
    static MappingCondition eq(String path, Object expected) {
        return view -> EntityPaths.resolve(view, path).map(v -> v.equals(expected)).orElse(expected == null);
    }

    static MappingCondition in(String path, Collection<?> values) {
        List<?> allowed = List.copyOf(values);
        return view -> EntityPaths.resolve(view, path).map(allowed::contains).orElse(false);
    }

    /**
     * Case-insensitive regex search in the text value at {@code path}; a missing value tests as empty text.
     */
    static MappingCondition matches(String path, String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return view -> pattern.matcher(EntityPaths.resolve(view, path).map(Object::toString).orElse("")).find();
    }

    /**
     * True when the collection at {@code path} shares at least one element with {@code values},
     * compared case-insensitively.
     */
    static MappingCondition hasAny(String path, Collection<String> values) {
        Set<String> wanted = values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
        return view -> {
            Optional<Object> value = EntityPaths.resolve(view, path);
            if (value.isEmpty() || !(value.get() instanceof Collection<?> collection)) {
                return false;
            }
            return collection.stream()
                    .filter(Objects::nonNull)
                    .anyMatch(e -> wanted.contains(e.toString().toLowerCase(Locale.ROOT)));
        };
    }

    static MappingCondition anyOf(MappingCondition... conditions) {
        List<MappingCondition> all = List.of(conditions);
        return view -> all.stream().anyMatch(c -> c.test(view));
    }

    static MappingCondition allOf(MappingCondition... conditions) {
        List<MappingCondition> all = List.of(conditions);
        return view -> all.stream().allMatch(c -> c.test(view));
    }
}
