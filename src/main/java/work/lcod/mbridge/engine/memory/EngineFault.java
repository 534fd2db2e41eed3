package work.lcod.mbridge.engine.memory;

/**
 * An error raised inside the in-memory engine. The engine turns it into a non-zero status and
 * a {@code <code>,<message>} error text, the way a native engine reports failures.
 */
public class EngineFault extends RuntimeException {
    public static final int UNDEFINED_LOCAL = 150373850;
    public static final int UNDEFINED_GLOBAL = 150372994;
    public static final int NULL_SUBSCRIPT = 150372990;
    public static final int INVALID_EXPRESSION = 150372778;
    public static final int UNKNOWN_ROUTINE = 150374066;
    public static final int INVALID_SPECIAL_VARIABLE = 150373074;
    public static final int INTERRUPTED = 150372986;
    public static final int NOT_OPEN = 150379106;
    public static final int ROUTINE_FAILED = 150373562;

    private final int code;

    public EngineFault(int code, String message) {
        super(message);
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Text written to the engine's error buffer.
     */
    public String statusText() {
        return code + "," + getMessage();
    }
}
