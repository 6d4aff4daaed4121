package io.amp.kernel.expr;

import io.amp.kernel.error.ArgumentResolutionException;
import io.amp.kernel.plan.Reference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates boolean conditions used by {@code branch}, {@code assert} and {@code deny_if} rules.
 *
 * <p>Supported grammar: {@code || && !} (also {@code or and not}), parentheses, comparisons
 * {@code == != > >= < <= contains matches}, string/number/boolean/null literals, {@code $}
 * references and bare dotted paths. Unresolvable paths evaluate to {@code null}.
 */
public final class ConditionEvaluator {
    private final List<String> tokens;
    private final String source;
    private final Map<String, Object> scope;
    private int position;

    private ConditionEvaluator(String source, Map<String, Object> scope) {
        this.source = source;
        this.scope = scope;
        this.tokens = tokenize(source);
    }

    public static boolean evaluate(String expression, Map<String, Object> scope) {
        if (expression == null || expression.isBlank()) {
            throw new ArgumentResolutionException("Condition must not be blank", expression);
        }
        var evaluator = new ConditionEvaluator(expression, scope);
        var value = evaluator.parseOr();
        if (evaluator.position < evaluator.tokens.size()) {
            throw evaluator.error("Unexpected token '" + evaluator.tokens.get(evaluator.position) + "'");
        }
        return truthy(value);
    }

    public static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof String str) {
            return !str.isEmpty() && !"false".equalsIgnoreCase(str);
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    private Object parseOr() {
        var left = parseAnd();
        while (accept("||") || accept("or")) {
            var right = parseAnd();
            left = truthy(left) || truthy(right);
        }
        return left;
    }

    private Object parseAnd() {
        var left = parseNot();
        while (accept("&&") || accept("and")) {
            var right = parseNot();
            left = truthy(left) && truthy(right);
        }
        return left;
    }

    private Object parseNot() {
        if (accept("!") || accept("not")) {
            return !truthy(parseNot());
        }
        return parseComparison();
    }

    private Object parseComparison() {
        var left = parseOperand();
        if (position >= tokens.size()) {
            return left;
        }
        var op = tokens.get(position);
        switch (op) {
            case "==", "!=", ">", ">=", "<", "<=", "contains", "matches" -> position++;
            default -> {
                return left;
            }
        }
        var right = parseOperand();
        return switch (op) {
            case "==" -> valuesEqual(left, right);
            case "!=" -> !valuesEqual(left, right);
            case ">" -> compare(left, right, op) > 0;
            case ">=" -> compare(left, right, op) >= 0;
            case "<" -> compare(left, right, op) < 0;
            case "<=" -> compare(left, right, op) <= 0;
            case "contains" -> contains(left, right);
            default -> matches(left, right);
        };
    }

    private Object parseOperand() {
        if (position >= tokens.size()) {
            throw error("Unexpected end of condition");
        }
        var token = tokens.get(position++);
        if ("(".equals(token)) {
            var inner = parseOr();
            if (!accept(")")) {
                throw error("Missing closing parenthesis");
            }
            return inner;
        }
        if (token.startsWith("'") || token.startsWith("\"")) {
            return token.substring(1, token.length() - 1);
        }
        switch (token) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
                return null;
            default:
                break;
        }
        if (isNumber(token)) {
            return Double.parseDouble(token);
        }
        var expression = token.startsWith(Reference.SIGIL) ? token : Reference.SIGIL + token;
        var reference = Reference.tryParse(expression)
            .orElseThrow(() -> error("Invalid operand '" + token + "'"));
        return PathLookup.lenient(scope, reference);
    }

    private boolean accept(String token) {
        if (position < tokens.size() && tokens.get(position).equals(token)) {
            position++;
            return true;
        }
        return false;
    }

    private ArgumentResolutionException error(String message) {
        return new ArgumentResolutionException(message + " in condition: " + source, source);
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return left != null && right != null && String.valueOf(left).equalsIgnoreCase(String.valueOf(right));
        }
        return Objects.equals(left, right);
    }

    private int compare(Object left, Object right, String op) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left == null || right == null) {
            // a missing value never satisfies an ordering comparison
            return switch (op) {
                case ">", ">=" -> -1;
                default -> 1;
            };
        }
        throw error("Cannot compare " + left.getClass().getSimpleName() + " with " + right.getClass().getSimpleName());
    }

    private static boolean contains(Object container, Object needle) {
        if (container instanceof String str) {
            return needle != null && str.contains(String.valueOf(needle));
        }
        if (container instanceof Collection<?> collection) {
            for (var item : collection) {
                if (valuesEqual(item, needle)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(String.valueOf(needle));
        }
        return false;
    }

    private boolean matches(Object value, Object pattern) {
        if (value == null || pattern == null) {
            return false;
        }
        try {
            return Pattern.compile(String.valueOf(pattern)).matcher(String.valueOf(value)).find();
        } catch (PatternSyntaxException ex) {
            throw error("Invalid pattern '" + pattern + "'");
        }
    }

    private static boolean isNumber(String token) {
        return token.matches("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");
    }

    private static List<String> tokenize(String source) {
        var tokens = new ArrayList<String>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')') {
                tokens.add(String.valueOf(c));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = source.indexOf(c, i + 1);
                if (end < 0) {
                    throw new ArgumentResolutionException("Unterminated string in condition: " + source, source);
                }
                tokens.add(source.substring(i, end + 1));
                i = end + 1;
            } else if (source.startsWith("&&", i) || source.startsWith("||", i) || source.startsWith("==", i)
                || source.startsWith("!=", i) || source.startsWith(">=", i) || source.startsWith("<=", i)) {
                tokens.add(source.substring(i, i + 2));
                i += 2;
            } else if (c == '!' || c == '>' || c == '<') {
                tokens.add(String.valueOf(c));
                i++;
            } else {
                int start = i;
                while (i < source.length() && isWordChar(source.charAt(i))) {
                    i++;
                }
                if (start == i) {
                    throw new ArgumentResolutionException("Unexpected character '" + c + "' in condition: " + source, source);
                }
                tokens.add(source.substring(start, i));
            }
        }
        return tokens;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '$' || c == '[' || c == ']';
    }
}
