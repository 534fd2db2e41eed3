package work.lcod.mbridge.runtime;

import java.nio.charset.StandardCharsets;
import work.lcod.mbridge.api.BridgeException;

/**
 * Fixed-capacity text buffer owned by one call at a time. Writes that exceed the capacity are
 * rejected instead of truncated.
 */
public final class CallBuffer {
    private final String label;
    private final int capacity;
    private String contents = "";

    public CallBuffer(String label, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive");
        }
        this.label = label;
        this.capacity = capacity;
    }

    public void write(String text) {
        int length = byteLength(text);
        if (length > capacity) {
            throw BridgeException.resource(label + " buffer overflow: " + length + " bytes exceeds capacity " + capacity);
        }
        contents = text;
    }

    public String contents() {
        return contents;
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        contents = "";
    }

    static int byteLength(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
