package work.lcod.mbridge.engine;

import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

/**
 * A non-zero engine status with its message, parsed from the {@code <code>,<message>} text the
 * engine writes on failure.
 */
public record EngineStatus(int code, String message) {
    public static final int OK = 0;
    /** Invalid intrinsic special variable name. */
    public static final int INVSVN = 150373074;

    private static final String[] INTERRUPT_MARKERS = {"%YDB-E-CTRAP", "%GTM-E-CTRAP"};

    public static EngineStatus parse(String text, int fallbackCode) {
        if (text == null || text.isEmpty()) {
            return new EngineStatus(fallbackCode, "Engine call failed with status " + fallbackCode);
        }
        int comma = text.indexOf(',');
        if (comma < 0) {
            return new EngineStatus(fallbackCode, text);
        }
        String head = text.substring(0, comma).trim();
        try {
            return new EngineStatus(Integer.parseInt(head), text.substring(comma + 1));
        } catch (NumberFormatException ex) {
            return new EngineStatus(fallbackCode, text);
        }
    }

    public boolean isInterrupt() {
        for (String marker : INTERRUPT_MARKERS) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public BridgeException toException() {
        return new BridgeException(isInterrupt() ? ErrorKind.INTERRUPT : ErrorKind.ENGINE, code, message);
    }
}
