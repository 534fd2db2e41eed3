package work.lcod.mbridge.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception carrying the failure kind and, for engine failures, the engine status code.
 */
public class BridgeException extends RuntimeException {
    private final ErrorKind kind;
    private final int code;

    public BridgeException(ErrorKind kind, int code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public BridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = 0;
    }

    public static BridgeException encoding(String message) {
        return new BridgeException(ErrorKind.ENCODING, 0, message);
    }

    public static BridgeException resource(String message) {
        return new BridgeException(ErrorKind.RESOURCE, 0, message);
    }

    public ErrorKind kind() {
        return kind;
    }

    public int code() {
        return code;
    }

    /**
     * Error object in the shape callers receive in place of a result.
     */
    public Map<String, Object> toMap(Mode mode) {
        var map = new LinkedHashMap<String, Object>();
        if (mode == Mode.STRICT) {
            map.put("ok", 0);
            map.put("errorCode", code);
            map.put("errorMessage", getMessage());
        } else {
            map.put("ok", false);
            map.put("errorCode", code);
            map.put("errorMessage", getMessage());
        }
        if (kind == ErrorKind.INTERRUPT) {
            map.put("interrupted", mode == Mode.STRICT ? (Object) 1 : (Object) true);
        }
        return map;
    }
}
