package io.amp.kernel.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Extracts citation identifiers from a tool output. Recognized shapes: {@code citations} or
 * {@code sources} lists, and result items carrying {@code citation}, {@code source}, {@code url} or {@code uri}.
 */
public final class Citations {
    private static final List<String> LIST_KEYS = List.of("citations", "sources");
    private static final List<String> ITEM_KEYS = List.of("citation", "source", "url", "uri");
    private static final List<String> CONTAINER_KEYS = List.of("results", "items", "documents", "hits");

    private Citations() {}

    public static List<String> extract(Object output) {
        var found = new LinkedHashSet<String>();
        collect(output, found, 0);
        return new ArrayList<>(found);
    }

    private static void collect(Object value, LinkedHashSet<String> found, int depth) {
        if (depth > 3 || value == null) {
            return;
        }
        if (value instanceof Collection<?> list) {
            for (var item : list) {
                collect(item, found, depth + 1);
            }
            return;
        }
        if (!(value instanceof Map<?, ?> map)) {
            return;
        }
        for (var key : LIST_KEYS) {
            if (map.get(key) instanceof Collection<?> list) {
                for (var item : list) {
                    if (item instanceof Map<?, ?> nested) {
                        addItem(nested, found);
                    } else if (item != null && !String.valueOf(item).isBlank()) {
                        found.add(String.valueOf(item));
                    }
                }
            }
        }
        addItem(map, found);
        for (var key : CONTAINER_KEYS) {
            if (map.get(key) instanceof Collection<?> list) {
                collect(list, found, depth + 1);
            }
        }
    }

    private static void addItem(Map<?, ?> map, LinkedHashSet<String> found) {
        for (var key : ITEM_KEYS) {
            var candidate = map.get(key);
            if (candidate instanceof String str && !str.isBlank()) {
                found.add(str);
                return;
            }
        }
    }
}
