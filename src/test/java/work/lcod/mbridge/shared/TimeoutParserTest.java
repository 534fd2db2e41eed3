package work.lcod.mbridge.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TimeoutParserTest {
    @Test
    void parsesUnits() {
        assertEquals(Optional.of(Duration.ofSeconds(5)), TimeoutParser.parse("5"));
        assertEquals(Optional.of(Duration.ofMillis(2500)), TimeoutParser.parse("2.5s"));
        assertEquals(Optional.of(Duration.ofMillis(250)), TimeoutParser.parse("250ms"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), TimeoutParser.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), TimeoutParser.parse(" 1H "));
    }

    @Test
    void foreverHasNoDuration() {
        assertEquals(Optional.empty(), TimeoutParser.parse("-1"));
        assertEquals(Optional.empty(), TimeoutParser.parse("forever"));
        assertEquals(Optional.empty(), TimeoutParser.parse(""));
    }

    @Test
    void rejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> TimeoutParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> TimeoutParser.parse("-2"));
    }

    @Test
    void rejectsDurationsBeyondRange() {
        var ex = assertThrows(IllegalArgumentException.class, () -> TimeoutParser.parse("99999999999999999999h"));
        assertEquals("Timeout out of range: 99999999999999999999h", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> TimeoutParser.parse("1e+300"));
    }

    @Test
    void formatsEngineSeconds() {
        assertEquals("-1", TimeoutParser.toEngineSeconds(Optional.empty()));
        assertEquals("0", TimeoutParser.toEngineSeconds(Optional.of(Duration.ZERO)));
        assertEquals("2.5", TimeoutParser.toEngineSeconds(Optional.of(Duration.ofMillis(2500))));
        assertEquals("30", TimeoutParser.toEngineSeconds(Optional.of(Duration.ofSeconds(30))));
    }
}
