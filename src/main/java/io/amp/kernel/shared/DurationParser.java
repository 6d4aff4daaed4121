package io.amp.kernel.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations ({@code 500ms}, {@code 30s}, {@code 2m}, {@code 5h})
 * and ISO-8601 ones ({@code PT30S}, {@code P90D}).
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        if (trimmed.startsWith("p")) {
            return Optional.of(parseIso(raw.trim()));
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else if (trimmed.endsWith("d")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 86_400_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        return Optional.of(Duration.ofMillis(value * multiplier));
    }

    private static Duration parseIso(String raw) {
        try {
            return Duration.parse(raw.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }

    public static String toIso(Duration duration) {
        if (!duration.isZero() && duration.toSeconds() % 86_400 == 0 && duration.toNanosPart() == 0) {
            return "P" + duration.toDays() + "D";
        }
        return duration.toString();
    }
}
