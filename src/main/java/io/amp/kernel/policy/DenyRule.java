package io.amp.kernel.policy;

import io.amp.kernel.expr.ConditionEvaluator;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One {@code policy.deny_if} entry. A bare keyword matches when any string argument contains it
 * (case-insensitive); anything else is a condition evaluated over {@code args}.
 */
public record DenyRule(String expression) {
    private static final Pattern KEYWORD = Pattern.compile("[A-Za-z0-9_\\-]+");

    public boolean isKeyword() {
        var trimmed = expression.trim();
        return KEYWORD.matcher(trimmed).matches() && !trimmed.startsWith("args");
    }

    public boolean matches(Map<String, Object> args) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        if (isKeyword()) {
            return containsKeyword(args, expression.trim().toLowerCase(Locale.ROOT));
        }
        var scope = new LinkedHashMap<String, Object>(args);
        scope.put("args", args);
        return ConditionEvaluator.evaluate(expression, scope);
    }

    private static boolean containsKeyword(Object value, String keyword) {
        if (value instanceof String str) {
            return str.toLowerCase(Locale.ROOT).contains(keyword);
        }
        if (value instanceof Map<?, ?> map) {
            for (var item : map.values()) {
                if (containsKeyword(item, keyword)) {
                    return true;
                }
            }
        } else if (value instanceof Collection<?> collection) {
            for (var item : collection) {
                if (containsKeyword(item, keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
