package work.lcod.mbridge.runtime;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.mbridge.api.DebugLevel;

/**
 * Process-wide trace level shared by the dispatcher, the operation handlers and the engine.
 * LOW traces operation entry and exit, MEDIUM adds arguments and replies, HIGH adds codec
 * internals.
 */
public final class DebugTrace {
    private static final Logger log = LoggerFactory.getLogger("work.lcod.mbridge.trace");

    private final AtomicReference<DebugLevel> level;

    public DebugTrace(DebugLevel initial) {
        this.level = new AtomicReference<>(initial == null ? DebugLevel.OFF : initial);
    }

    public DebugLevel level() {
        return level.get();
    }

    public void setLevel(DebugLevel next) {
        level.set(next == null ? DebugLevel.OFF : next);
    }

    public boolean enabled(DebugLevel threshold) {
        return level.get().includes(threshold);
    }

    public void enter(Operation operation) {
        if (enabled(DebugLevel.LOW)) {
            log.debug("{} enter", operation.routine());
        }
    }

    public void exit(Operation operation, int status) {
        if (enabled(DebugLevel.LOW)) {
            log.debug("{} exit, status {}", operation.routine(), status);
        }
    }

    public void detail(String format, Object... args) {
        if (enabled(DebugLevel.MEDIUM)) {
            log.debug(format, args);
        }
    }

    public void internal(String format, Object... args) {
        if (enabled(DebugLevel.HIGH)) {
            log.debug(format, args);
        }
    }

    /**
     * Traces a documented downgrade (a trapped engine status replaced by a synthesized result).
     */
    public void downgrade(String format, Object... args) {
        if (enabled(DebugLevel.LOW)) {
            log.debug(format, args);
        }
    }
}
