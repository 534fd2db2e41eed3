package work.lcod.mbridge.runtime;

/**
 * Life cycle of a {@link CallDescriptor}.
 */
public enum CallState {
    CREATED,
    QUEUED,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
