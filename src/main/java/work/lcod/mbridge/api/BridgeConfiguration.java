package work.lcod.mbridge.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a bridge: engine channel, default mode, tracing, worker pool and
 * the fixed buffer ceilings of the call channel.
 */
public record BridgeConfiguration(
    EngineKind engine,
    String libraryName,
    String functionPrefix,
    Optional<String> callInTable,
    Mode mode,
    DebugLevel debugLevel,
    int workers,
    int errorCapacity,
    int resultCapacity,
    int inputCapacity,
    int indirectionLimit,
    boolean autoRelink,
    boolean utf8,
    Optional<Duration> lockTimeout
) {
    public static final int DEFAULT_ERROR_CAPACITY = 2048;
    public static final int DEFAULT_RESULT_CAPACITY = 1048576;
    public static final int DEFAULT_INPUT_CAPACITY = 1048576;
    public static final int DEFAULT_INDIRECTION_LIMIT = 8192;

    public BridgeConfiguration {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(libraryName, "libraryName");
        Objects.requireNonNull(functionPrefix, "functionPrefix");
        Objects.requireNonNull(callInTable, "callInTable");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(debugLevel, "debugLevel");
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        requirePositive(workers, "workers");
        requirePositive(errorCapacity, "errorCapacity");
        requirePositive(resultCapacity, "resultCapacity");
        requirePositive(inputCapacity, "inputCapacity");
        requirePositive(indirectionLimit, "indirectionLimit");
        if (!functionPrefix.equals("ydb") && !functionPrefix.equals("gtm")) {
            throw new IllegalArgumentException("functionPrefix must be ydb or gtm, got " + functionPrefix);
        }
    }

    public static BridgeConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .engine(engine)
            .libraryName(libraryName)
            .functionPrefix(functionPrefix)
            .callInTable(callInTable)
            .mode(mode)
            .debugLevel(debugLevel)
            .workers(workers)
            .errorCapacity(errorCapacity)
            .resultCapacity(resultCapacity)
            .inputCapacity(inputCapacity)
            .indirectionLimit(indirectionLimit)
            .autoRelink(autoRelink)
            .utf8(utf8)
            .lockTimeout(lockTimeout);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public static final class Builder {
        private EngineKind engine = EngineKind.MEMORY;
        private String libraryName = "yottadb";
        private String functionPrefix = "ydb";
        private Optional<String> callInTable = Optional.empty();
        private Mode mode = Mode.CANONICAL;
        private DebugLevel debugLevel = DebugLevel.OFF;
        private int workers = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int errorCapacity = DEFAULT_ERROR_CAPACITY;
        private int resultCapacity = DEFAULT_RESULT_CAPACITY;
        private int inputCapacity = DEFAULT_INPUT_CAPACITY;
        private int indirectionLimit = DEFAULT_INDIRECTION_LIMIT;
        private boolean autoRelink;
        private boolean utf8 = true;
        private Optional<Duration> lockTimeout = Optional.empty();

        public Builder engine(EngineKind engine) {
            this.engine = engine;
            return this;
        }

        public Builder libraryName(String libraryName) {
            this.libraryName = libraryName;
            return this;
        }

        public Builder functionPrefix(String functionPrefix) {
            this.functionPrefix = functionPrefix;
            return this;
        }

        public Builder callInTable(Optional<String> callInTable) {
            this.callInTable = callInTable;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder debugLevel(DebugLevel debugLevel) {
            this.debugLevel = debugLevel;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder errorCapacity(int errorCapacity) {
            this.errorCapacity = errorCapacity;
            return this;
        }

        public Builder resultCapacity(int resultCapacity) {
            this.resultCapacity = resultCapacity;
            return this;
        }

        public Builder inputCapacity(int inputCapacity) {
            this.inputCapacity = inputCapacity;
            return this;
        }

        public Builder indirectionLimit(int indirectionLimit) {
            this.indirectionLimit = indirectionLimit;
            return this;
        }

        public Builder autoRelink(boolean autoRelink) {
            this.autoRelink = autoRelink;
            return this;
        }

        public Builder utf8(boolean utf8) {
            this.utf8 = utf8;
            return this;
        }

        public Builder lockTimeout(Optional<Duration> lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public BridgeConfiguration build() {
            return new BridgeConfiguration(
                engine,
                libraryName,
                functionPrefix,
                callInTable,
                mode,
                debugLevel,
                workers,
                errorCapacity,
                resultCapacity,
                inputCapacity,
                indirectionLimit,
                autoRelink,
                utf8,
                lockTimeout
            );
        }
    }
}
