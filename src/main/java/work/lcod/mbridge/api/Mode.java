package work.lcod.mbridge.api;

import java.util.Locale;

/**
 * Data mode of a call. Strict mode keeps every value a string; canonical mode infers numbers.
 */
public enum Mode {
    STRICT,
    CANONICAL;

    public static Mode from(String value) {
        if (value == null || value.isBlank()) {
            return CANONICAL;
        }
        try {
            return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported mode: " + value);
        }
    }
}
