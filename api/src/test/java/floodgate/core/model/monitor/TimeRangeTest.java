package floodgate.core.model.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TimeRange")
class TimeRangeTest {

    @Test
    @DisplayName("should parse each unit")
    void shouldParseEachUnit() {
        assertEquals(Duration.ofSeconds(30), TimeRange.parse("30s").duration());
        assertEquals(Duration.ofMinutes(15), TimeRange.parse("15m").duration());
        assertEquals(Duration.ofHours(24), TimeRange.parse(" 24H ").duration());
        assertEquals(Duration.ofDays(7), TimeRange.parse("7d").duration());
        assertEquals("24h", TimeRange.parse(" 24H ").label());
    }

    @Test
    @DisplayName("should default to the last hour")
    void shouldDefaultToLastHour() {
        assertSame(TimeRange.LAST_HOUR, TimeRange.parse(null));
        assertSame(TimeRange.LAST_HOUR, TimeRange.parse(" "));
    }

    @Test
    @DisplayName("should look back from the given instant")
    void shouldLookBack() {
        var now = Instant.parse("2024-05-01T12:00:00Z");

        assertEquals(Instant.parse("2024-05-01T11:45:00Z"), TimeRange.parse("15m").since(now));
    }

    @ParameterizedTest
    @ValueSource(strings = {"soon", "0h", "-1h", "1w", "366d", "99999999999999d", "99999999999999999999s"})
    @DisplayName("should reject malformed, empty and oversized ranges")
    void shouldRejectInvalidRanges(String value) {
        assertThrows(IllegalArgumentException.class, () -> TimeRange.parse(value));
    }
}
