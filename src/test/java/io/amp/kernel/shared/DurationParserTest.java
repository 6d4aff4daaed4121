package io.amp.kernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMillisecondsSuffix() {
        assertEquals(Duration.ofMillis(500), DurationParser.parse("500ms").orElseThrow());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse("1h").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
    }

    @Test
    void parsesIsoDurations() {
        assertEquals(Duration.ofDays(90), DurationParser.parse("P90D").orElseThrow());
        assertEquals(Duration.ofSeconds(30), DurationParser.parse("PT30S").orElseThrow());
    }

    @Test
    void blankIsEmptyAndGarbageIsRejected() {
        assertTrue(DurationParser.parse(" ").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
    }

    @Test
    void rendersWholeDaysAsDays() {
        assertEquals("P90D", DurationParser.toIso(Duration.ofDays(90)));
        assertEquals("PT1H30M", DurationParser.toIso(Duration.ofMinutes(90)));
    }
}
