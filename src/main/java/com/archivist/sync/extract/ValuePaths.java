package com.archivist.sync.extract;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves dotted paths such as {@code biography.value} or {@code $.images[0]}
 * over nested maps and lists.
 */
public final class ValuePaths {

    private static final Pattern INDEXED = Pattern.compile("^([^\\[]*)\\[(\\d+)]$");

    private ValuePaths() {
    }

    /**
     * @return the value at {@code path}, empty when any step is missing
     */
    public static Optional<Object> resolve(Object root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        String p = path.trim();
        if (p.startsWith("$.")) {
            p = p.substring(2);
        } else if (p.equals("$")) {
            return Optional.of(root);
        }
        Object current = root;
        for (String segment : p.split("\\.")) {
            Matcher m = INDEXED.matcher(segment);
            if (m.matches()) {
                if (!m.group(1).isEmpty()) {
                    current = child(current, m.group(1));
                }
                current = element(current, Integer.parseInt(m.group(2)));
            } else {
                current = child(current, segment);
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Resolves a path to non-blank text; numbers and booleans are rendered with {@code toString}.
     */
    public static Optional<String> resolveText(Object root, String path) {
        return resolve(root, path)
                .filter(v -> v instanceof CharSequence || v instanceof Number || v instanceof Boolean)
                .map(Object::toString)
                .filter(s -> !s.isBlank());
    }

    private static Object child(Object node, String key) {
        if (node instanceof Map<?, ?> map) {
            return map.get(key);
        }
        return null;
    }

    private static Object element(Object node, int index) {
        if (node instanceof List<?> list && index < list.size()) {
            return list.get(index);
        }
        return null;
    }
}
