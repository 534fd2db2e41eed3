package work.lcod.mbridge.runtime;

import java.util.Locale;

/**
 * Operations the bridge can send through the engine channel, with the engine routine that
 * serves each of them.
 */
public enum Operation {
    DATA("data"),
    GET("get"),
    SET("set"),
    KILL("kill"),
    ORDER("order"),
    PREVIOUS("previous"),
    NEXT_NODE("nextNode"),
    PREVIOUS_NODE("previousNode"),
    LOCK("lock"),
    UNLOCK("unlock"),
    MERGE("merge"),
    INCREMENT("increment"),
    FUNCTION("function"),
    PROCEDURE("procedure"),
    GLOBAL_DIRECTORY("globalDirectory"),
    LOCAL_DIRECTORY("localDirectory"),
    VERSION("version"),
    DEBUG("debug");

    private final String routine;

    Operation(String routine) {
        this.routine = routine;
    }

    public String routine() {
        return routine;
    }

    /**
     * Accepts the routine name ({@code nextNode}), the enum name ({@code NEXT_NODE}) or the
     * dashed form ({@code next-node}).
     */
    public static Operation from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing operation name");
        }
        String trimmed = value.trim();
        for (Operation operation : values()) {
            if (operation.routine.equalsIgnoreCase(trimmed)) {
                return operation;
            }
        }
        try {
            return Operation.valueOf(trimmed.replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown operation: " + value);
        }
    }
}
