package io.amp.kernel.expr;

import io.amp.kernel.plan.Reference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves argument values against a variable scope. Pure: no I/O, never mutates the scope.
 * Strings that are a whole reference expression are replaced by the referenced value; {@code $$}
 * escapes a literal dollar; every other value is copied as a literal.
 */
public final class VariableResolver {
    private VariableResolver() {}

    public static Map<String, Object> resolveArgs(Map<String, Object> args, Map<String, Object> scope) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : args.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), scope));
        }
        return resolved;
    }

    public static Object resolve(Object value, Map<String, Object> scope) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), resolve(entry.getValue(), scope));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(resolve(item, scope));
            }
            return copy;
        }
        if (Reference.isEscapedLiteral(value)) {
            return ((String) value).substring(1);
        }
        if (Reference.isReference(value)) {
            return PathLookup.strict(scope, Reference.parse((String) value));
        }
        return value;
    }

    public static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), copy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(copy(item));
            }
            return copy;
        }
        return value;
    }
}
