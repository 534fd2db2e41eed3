package work.lcod.mbridge.engine;

import work.lcod.mbridge.runtime.CallBuffer;

/**
 * The engine's native call interface: synchronous, non-reentrant, and not thread-safe.
 * Callers must serialise every method through a single gate.
 */
public interface EngineChannel extends AutoCloseable {
    /**
     * Initialises the engine for this process.
     */
    void open();

    /**
     * Invokes an engine routine. A zero status means the reply was written to {@code result};
     * any other value is an engine error whose text is available from {@link #status(CallBuffer)}.
     */
    int call(String routine, CallBuffer result, Object... args);

    /**
     * Writes the last failure as {@code <code>,<message>}.
     */
    void status(CallBuffer error);

    /**
     * Short label used in traces and version output.
     */
    String describe();

    @Override
    void close();
}
