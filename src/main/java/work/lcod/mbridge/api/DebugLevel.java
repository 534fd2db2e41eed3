package work.lcod.mbridge.api;

import java.util.Locale;

/**
 * Trace verbosity of the bridge, ordered from silent to most verbose.
 */
public enum DebugLevel {
    OFF,
    LOW,
    MEDIUM,
    HIGH;

    public boolean includes(DebugLevel other) {
        return other != OFF && ordinal() >= other.ordinal();
    }

    public static DebugLevel from(String value) {
        if (value == null || value.isBlank()) {
            return OFF;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            int level = Integer.parseInt(trimmed);
            if (level < 0 || level >= values().length) {
                throw new IllegalArgumentException("Unsupported debug level: " + value);
            }
            return values()[level];
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return OFF;
        }
        if ("true".equalsIgnoreCase(trimmed)) {
            return LOW;
        }
        try {
            return DebugLevel.valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported debug level: " + value);
        }
    }
}
