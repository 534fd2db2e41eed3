package work.lcod.mbridge.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses lock wait durations ({@code 30s}, {@code 250ms}, {@code 2m}, {@code 1h}). Bare numbers
 * are seconds, the engine's own unit; {@code -1} and {@code forever} mean wait without limit.
 */
public final class TimeoutParser {
    public static final String FOREVER = "-1";

    private static final BigDecimal MILLIS_PER_SECOND = BigDecimal.valueOf(1000);

    private TimeoutParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (FOREVER.equals(trimmed) || "forever".equals(trimmed)) {
            return Optional.empty();
        }
        BigDecimal millisPerUnit = MILLIS_PER_SECOND;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            millisPerUnit = BigDecimal.ONE;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            millisPerUnit = BigDecimal.valueOf(60_000L);
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            millisPerUnit = BigDecimal.valueOf(3_600_000L);
        }
        BigDecimal value;
        try {
            value = new BigDecimal(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid timeout: " + raw);
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + raw);
        }
        long millis;
        try {
            millis = value.multiply(millisPerUnit).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Timeout out of range: " + raw, ex);
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    /**
     * Seconds as the engine's lock command expects them, or {@link #FOREVER}.
     */
    public static String toEngineSeconds(Optional<Duration> timeout) {
        if (timeout.isEmpty()) {
            return FOREVER;
        }
        BigDecimal seconds = BigDecimal.valueOf(timeout.get().toMillis()).divide(MILLIS_PER_SECOND);
        return seconds.signum() == 0 ? "0" : seconds.stripTrailingZeros().toPlainString();
    }
}
