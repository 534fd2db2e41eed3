package work.lcod.mbridge.runtime;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import work.lcod.mbridge.api.Mode;

/**
 * One request travelling from a caller through the dispatcher to the engine and back.
 *
 * <p>A descriptor is single-use. Its state only moves forward
 * ({@code CREATED -> QUEUED -> EXECUTING -> COMPLETED | FAILED}) and its buffers belong to
 * whichever stage currently holds it.</p>
 */
public final class CallDescriptor {
    private final Operation operation;
    private final List<Object> arguments;
    private final Mode mode;
    private final boolean async;
    private final CallBuffer result;
    private final CallBuffer error;
    private final AtomicReference<CallState> state = new AtomicReference<>(CallState.CREATED);
    private volatile int status = -1;
    private volatile Throwable failure;

    public CallDescriptor(Operation operation, List<Object> arguments, Mode mode, boolean async,
                          int resultCapacity, int errorCapacity) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.arguments = List.copyOf(arguments);
        this.mode = Objects.requireNonNull(mode, "mode");
        this.async = async;
        this.result = new CallBuffer("result", resultCapacity);
        this.error = new CallBuffer("error", errorCapacity);
    }

    public Operation operation() {
        return operation;
    }

    public String routine() {
        return operation.routine();
    }

    public List<Object> arguments() {
        return arguments;
    }

    public Mode mode() {
        return mode;
    }

    public boolean async() {
        return async;
    }

    public CallBuffer result() {
        return result;
    }

    public CallBuffer error() {
        return error;
    }

    public CallState state() {
        return state.get();
    }

    public int status() {
        return status;
    }

    public Throwable failure() {
        return failure;
    }

    void markQueued() {
        advance(CallState.CREATED, CallState.QUEUED);
    }

    void markExecuting() {
        advance(CallState.QUEUED, CallState.EXECUTING);
    }

    void complete(int status) {
        this.status = status;
        advance(CallState.EXECUTING, CallState.COMPLETED);
    }

    /**
     * Moves any non-terminal descriptor to {@code FAILED}; a descriptor that already finished
     * keeps its state.
     */
    void fail(int status, Throwable cause) {
        while (true) {
            CallState current = state.get();
            if (current.isTerminal()) {
                return;
            }
            if (state.compareAndSet(current, CallState.FAILED)) {
                this.status = status;
                this.failure = cause;
                return;
            }
        }
    }

    private void advance(CallState expected, CallState next) {
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException("Call " + operation.routine() + " cannot move from "
                + state.get() + " to " + next);
        }
    }

    @Override
    public String toString() {
        return "CallDescriptor[" + operation.routine() + ", " + state.get() + ", " + mode + (async ? ", async" : "") + "]";
    }
}
