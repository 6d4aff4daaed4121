package io.amp.kernel.plan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record Reference(String expression, String root, List<Object> segments) {
    public static final String SIGIL = "$";
    private static final String BODY = "[A-Za-z_][A-Za-z0-9_\\-]*(?:\\.[A-Za-z0-9_\\-]+|\\[\\d+\\])*";
    private static final Pattern FULL = Pattern.compile("\\$(" + BODY + ")");
    private static final Pattern EMBEDDED = Pattern.compile("(?<!\\$)\\$(" + BODY + ")");
    private static final Pattern SEGMENT = Pattern.compile("\\.([A-Za-z0-9_\\-]+)|\\[(\\d+)\\]");

    public Reference {
        segments = List.copyOf(segments);
    }

    public static boolean isReference(Object value) {
        return value instanceof String str && FULL.matcher(str.trim()).matches();
    }

    public static boolean isEscapedLiteral(Object value) {
        return value instanceof String str && str.startsWith(SIGIL + SIGIL);
    }

    public static Optional<Reference> tryParse(Object value) {
        if (!isReference(value)) {
            return Optional.empty();
        }
        return Optional.of(parse((String) value));
    }

    /**
     * Parses {@code expression}; segments are {@link String} keys or {@link Integer} indexes.
     *
     * @throws IllegalArgumentException if the string is not a well-formed reference
     */
    public static Reference parse(String expression) {
        var trimmed = expression == null ? "" : expression.trim();
        var matcher = FULL.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a reference expression: " + expression);
        }
        return fromBody(trimmed, matcher.group(1));
    }

    private static Reference fromBody(String expression, String body) {
        int firstBoundary = firstBoundary(body);
        var root = body.substring(0, firstBoundary);
        var segments = new ArrayList<Object>();
        Matcher segment = SEGMENT.matcher(body);
        int position = firstBoundary;
        while (position < body.length() && segment.find(position) && segment.start() == position) {
            if (segment.group(1) != null) {
                var key = segment.group(1);
                segments.add(isDigits(key) ? (Object) Integer.valueOf(key) : key);
            } else {
                segments.add(Integer.valueOf(segment.group(2)));
            }
            position = segment.end();
        }
        return new Reference(expression, root, segments);
    }

    private static int firstBoundary(String body) {
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '.' || c == '[') {
                return i;
            }
        }
        return body.length();
    }

    private static boolean isDigits(String token) {
        return !token.isEmpty() && token.chars().allMatch(Character::isDigit);
    }

    public static List<Reference> collect(Object value) {
        var found = new ArrayList<Reference>();
        collectInto(value, found);
        return found;
    }

    private static void collectInto(Object value, List<Reference> found) {
        if (value instanceof Map<?, ?> map) {
            for (var item : map.values()) {
                collectInto(item, found);
            }
        } else if (value instanceof Collection<?> list) {
            for (var item : list) {
                collectInto(item, found);
            }
        } else if (value instanceof String str) {
            var matcher = EMBEDDED.matcher(str);
            while (matcher.find()) {
                found.add(fromBody(matcher.group(), matcher.group(1)));
            }
        }
    }
}
