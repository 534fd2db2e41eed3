package work.lcod.mbridge.api;

import java.util.Locale;

/**
 * Which engine channel a bridge talks to.
 */
public enum EngineKind {
    /** In-process engine, no native library required. */
    MEMORY,
    /** Native engine reached through its call-in library. */
    NATIVE;

    public static EngineKind from(String value) {
        if (value == null || value.isBlank()) {
            return MEMORY;
        }
        try {
            return EngineKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported engine: " + value);
        }
    }
}
