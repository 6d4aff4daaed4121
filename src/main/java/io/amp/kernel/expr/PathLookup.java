package io.amp.kernel.expr;

import io.amp.kernel.error.ArgumentResolutionException;
import io.amp.kernel.plan.Reference;
import java.util.List;
import java.util.Map;

public final class PathLookup {
    private PathLookup() {}

    public static Object strict(Map<String, Object> scope, Reference reference) {
        if (!scope.containsKey(reference.root())) {
            throw new ArgumentResolutionException("Unknown variable '" + reference.root() + "' in " + reference.expression(), reference.expression());
        }
        Object current = scope.get(reference.root());
        var walked = new StringBuilder(reference.root());
        for (var segment : reference.segments()) {
            current = step(current, segment, reference, walked);
            walked.append(segment instanceof Integer ? "[" + segment + "]" : "." + segment);
        }
        return current;
    }

    public static Object lenient(Map<String, Object> scope, Reference reference) {
        try {
            return strict(scope, reference);
        } catch (ArgumentResolutionException ex) {
            return null;
        }
    }

    private static Object step(Object current, Object segment, Reference reference, StringBuilder walked) {
        if (current instanceof Map<?, ?> map) {
            var key = String.valueOf(segment);
            if (!map.containsKey(key)) {
                throw new ArgumentResolutionException("Missing path '" + key + "' under " + walked + " in " + reference.expression(), reference.expression());
            }
            return map.get(key);
        }
        if (current instanceof List<?> list) {
            if (!(segment instanceof Integer index)) {
                throw new ArgumentResolutionException("Cannot read field '" + segment + "' of a list at " + walked + " in " + reference.expression(), reference.expression());
            }
            if (index < 0 || index >= list.size()) {
                throw new ArgumentResolutionException("Index " + index + " out of bounds (size " + list.size() + ") at " + walked + " in " + reference.expression(), reference.expression());
            }
            return list.get(index);
        }
        var kind = current == null ? "null" : current.getClass().getSimpleName();
        throw new ArgumentResolutionException("Cannot traverse " + kind + " at " + walked + " in " + reference.expression(), reference.expression());
    }
}
