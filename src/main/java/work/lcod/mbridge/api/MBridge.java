package work.lcod.mbridge.api;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.mbridge.engine.EngineChannel;
import work.lcod.mbridge.engine.EngineStatus;
import work.lcod.mbridge.engine.callin.CallInChannel;
import work.lcod.mbridge.engine.memory.InMemoryDatabase;
import work.lcod.mbridge.engine.memory.InMemoryEngine;
import work.lcod.mbridge.runtime.CallDispatcher;
import work.lcod.mbridge.runtime.CallGate;
import work.lcod.mbridge.runtime.DebugTrace;
import work.lcod.mbridge.runtime.EngineCapabilities;
import work.lcod.mbridge.runtime.EngineOperations;
import work.lcod.mbridge.runtime.Operation;
import work.lcod.mbridge.runtime.OperationTable;
import work.lcod.mbridge.runtime.PreparedCall;

/**
 * Public entry point for talking to an M database engine.
 *
 * <p>Every data operation takes a JSON-like argument map and returns the result map for the
 * call's mode. Blocking calls run on the caller's thread; the {@code *Async} variants return
 * at once with a future completed by the worker pool. All calls share one engine channel and
 * pass through a single gate, so at most one of them is inside the engine at any time.</p>
 */
public final class MBridge {
    private static final Logger log = LoggerFactory.getLogger(MBridge.class);

    enum Lifecycle { NOT_OPEN, OPEN, CLOSED }

    private final BridgeConfiguration config;
    private final EngineChannel channel;
    private final DebugTrace trace;
    private final CallDispatcher dispatcher;
    private final OperationTable operations;
    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.NOT_OPEN);
    private volatile EngineCapabilities capabilities = EngineCapabilities.unknown();
    private volatile HelpCatalog help;

    private MBridge(BridgeConfiguration config, EngineChannel channel) {
        this.config = Objects.requireNonNull(config, "config");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.trace = new DebugTrace(config.debugLevel());
        this.dispatcher = new CallDispatcher(channel, new CallGate(), trace, config.workers());
        this.operations = new EngineOperations(config, () -> capabilities, trace).register(new OperationTable());
    }

    public static MBridge create(BridgeConfiguration config) {
        return new MBridge(config, channelFor(config));
    }

    public static MBridge create(BridgeConfiguration config, EngineChannel channel) {
        return new MBridge(config, channel);
    }

    private static EngineChannel channelFor(BridgeConfiguration config) {
        switch (config.engine()) {
            case NATIVE:
                return new CallInChannel(config);
            case MEMORY:
            default:
                return new InMemoryEngine(new InMemoryDatabase());
        }
    }

    /**
     * Bridge version from the jar manifest, or {@code development} when running from classes.
     */
    public static String bridgeVersion() {
        String implementationVersion = MBridge.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : "development";
    }

    /**
     * Initialises the engine, pushes the debug level to it and negotiates its capabilities.
     */
    public Map<String, Object> open() {
        if (!lifecycle.compareAndSet(Lifecycle.NOT_OPEN, Lifecycle.OPEN)) {
            throw BridgeException.encoding("Bridge is " + lifecycle.get().name().toLowerCase(Locale.ROOT) + ", it can only be opened once");
        }
        try {
            dispatcher.gate().enter(() -> {
                channel.open();
                return null;
            });
            invoke(Operation.DEBUG, Map.of("level", trace.level().ordinal()), config.mode());
            capabilities = EngineCapabilities.fromVersion(probeVersion());
        } catch (RuntimeException ex) {
            close();
            throw ex;
        }
        log.debug("Opened {} ({}), reverse traversal {}", channel.describe(), capabilities.versionText(),
            capabilities.reverseQuery() ? "available" : "unavailable");
        var result = new LinkedHashMap<String, Object>();
        result.put("ok", true);
        result.put("pid", ProcessHandle.current().pid());
        result.put("engine", capabilities.versionText());
        return result;
    }

    private String probeVersion() {
        try {
            return versionText(EngineOperations.RELEASE_SOURCE);
        } catch (BridgeException ex) {
            if (ex.code() != EngineStatus.INVSVN) {
                throw ex;
            }
            trace.downgrade("Engine has no release variable ({}), asking for the zversion instead", ex.getMessage());
            return versionText(EngineOperations.ZVERSION_SOURCE);
        }
    }

    private String versionText(String source) {
        Object version = invoke(Operation.VERSION, Map.of(EngineOperations.VERSION_SOURCE, source), config.mode()).get("version");
        return version == null ? "" : version.toString();
    }

    /**
     * Closes the engine channel and the worker pool. A closed bridge stays closed.
     */
    public boolean close() {
        Lifecycle previous = lifecycle.getAndSet(Lifecycle.CLOSED);
        if (previous == Lifecycle.CLOSED) {
            return true;
        }
        dispatcher.close();
        if (previous == Lifecycle.OPEN) {
            dispatcher.gate().enter(() -> {
                channel.close();
                return null;
            });
            log.debug("Closed {}", channel.describe());
        }
        return true;
    }

    public boolean isOpen() {
        return lifecycle.get() == Lifecycle.OPEN;
    }

    public BridgeConfiguration configuration() {
        return config;
    }

    public EngineCapabilities capabilities() {
        return capabilities;
    }

    public CallGate gate() {
        return dispatcher.gate();
    }

    public String version() {
        requireOpen();
        return "MBridge Version: " + bridgeVersion() + "; " + capabilities.versionText();
    }

    public String help(String topic) {
        HelpCatalog catalog = help;
        if (catalog == null) {
            catalog = HelpCatalog.load();
            help = catalog;
        }
        return catalog.text(topic);
    }

    public DebugLevel debugLevel() {
        return trace.level();
    }

    /**
     * Changes the process-wide trace level of the bridge and the engine.
     */
    public void setDebugLevel(DebugLevel level) {
        trace.setLevel(level);
        if (isOpen()) {
            invoke(Operation.DEBUG, Map.of("level", trace.level().ordinal()), config.mode());
        }
    }

    public Map<String, Object> call(Operation operation, Map<String, Object> args) {
        return call(operation, args, config.mode());
    }

    public Map<String, Object> call(Operation operation, Map<String, Object> args, Mode mode) {
        requireOpen();
        return invoke(operation, args, mode);
    }

    public CompletableFuture<Map<String, Object>> callAsync(Operation operation, Map<String, Object> args) {
        return callAsync(operation, args, config.mode());
    }

    /**
     * Asynchronous form of {@link #call(Operation, Map, Mode)}. Argument errors fail the
     * returned future without reaching the engine.
     */
    public CompletableFuture<Map<String, Object>> callAsync(Operation operation, Map<String, Object> args, Mode mode) {
        PreparedCall prepared;
        try {
            requireOpen();
            prepared = operations.prepare(operation, args, mode, true);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (prepared.isImmediate()) {
            return CompletableFuture.completedFuture(prepared.immediateResult());
        }
        return dispatcher.submit(prepared.descriptor()).thenApply(prepared::shape);
    }

    private Map<String, Object> invoke(Operation operation, Map<String, Object> args, Mode mode) {
        PreparedCall prepared = operations.prepare(operation, args, mode, false);
        if (prepared.isImmediate()) {
            return prepared.immediateResult();
        }
        return prepared.shape(dispatcher.execute(prepared.descriptor()));
    }

    private void requireOpen() {
        Lifecycle state = lifecycle.get();
        if (state != Lifecycle.OPEN) {
            throw BridgeException.encoding("Bridge is not open (" + state.name().toLowerCase(Locale.ROOT) + ")");
        }
    }

    public Map<String, Object> data(Map<String, Object> args) {
        return call(Operation.DATA, args);
    }

    public CompletableFuture<Map<String, Object>> dataAsync(Map<String, Object> args) {
        return callAsync(Operation.DATA, args);
    }

    public Map<String, Object> get(Map<String, Object> args) {
        return call(Operation.GET, args);
    }

    public CompletableFuture<Map<String, Object>> getAsync(Map<String, Object> args) {
        return callAsync(Operation.GET, args);
    }

    public Map<String, Object> set(Map<String, Object> args) {
        return call(Operation.SET, args);
    }

    public CompletableFuture<Map<String, Object>> setAsync(Map<String, Object> args) {
        return callAsync(Operation.SET, args);
    }

    public Map<String, Object> kill(Map<String, Object> args) {
        return call(Operation.KILL, args);
    }

    public CompletableFuture<Map<String, Object>> killAsync(Map<String, Object> args) {
        return callAsync(Operation.KILL, args);
    }

    public Map<String, Object> order(Map<String, Object> args) {
        return call(Operation.ORDER, args);
    }

    public CompletableFuture<Map<String, Object>> orderAsync(Map<String, Object> args) {
        return callAsync(Operation.ORDER, args);
    }

    public Map<String, Object> previous(Map<String, Object> args) {
        return call(Operation.PREVIOUS, args);
    }

    public CompletableFuture<Map<String, Object>> previousAsync(Map<String, Object> args) {
        return callAsync(Operation.PREVIOUS, args);
    }

    public Map<String, Object> nextNode(Map<String, Object> args) {
        return call(Operation.NEXT_NODE, args);
    }

    public CompletableFuture<Map<String, Object>> nextNodeAsync(Map<String, Object> args) {
        return callAsync(Operation.NEXT_NODE, args);
    }

    public Map<String, Object> previousNode(Map<String, Object> args) {
        return call(Operation.PREVIOUS_NODE, args);
    }

    public CompletableFuture<Map<String, Object>> previousNodeAsync(Map<String, Object> args) {
        return callAsync(Operation.PREVIOUS_NODE, args);
    }

    public Map<String, Object> lock(Map<String, Object> args) {
        return call(Operation.LOCK, args);
    }

    public CompletableFuture<Map<String, Object>> lockAsync(Map<String, Object> args) {
        return callAsync(Operation.LOCK, args);
    }

    public Map<String, Object> unlock(Map<String, Object> args) {
        return call(Operation.UNLOCK, args);
    }

    public CompletableFuture<Map<String, Object>> unlockAsync(Map<String, Object> args) {
        return callAsync(Operation.UNLOCK, args);
    }

    public Map<String, Object> merge(Map<String, Object> args) {
        return call(Operation.MERGE, args);
    }

    public CompletableFuture<Map<String, Object>> mergeAsync(Map<String, Object> args) {
        return callAsync(Operation.MERGE, args);
    }

    public Map<String, Object> increment(Map<String, Object> args) {
        return call(Operation.INCREMENT, args);
    }

    public CompletableFuture<Map<String, Object>> incrementAsync(Map<String, Object> args) {
        return callAsync(Operation.INCREMENT, args);
    }

    public Map<String, Object> function(Map<String, Object> args) {
        return call(Operation.FUNCTION, args);
    }

    public CompletableFuture<Map<String, Object>> functionAsync(Map<String, Object> args) {
        return callAsync(Operation.FUNCTION, args);
    }

    public Map<String, Object> procedure(Map<String, Object> args) {
        return call(Operation.PROCEDURE, args);
    }

    public CompletableFuture<Map<String, Object>> procedureAsync(Map<String, Object> args) {
        return callAsync(Operation.PROCEDURE, args);
    }

    public Map<String, Object> globalDirectory(Map<String, Object> args) {
        return call(Operation.GLOBAL_DIRECTORY, args);
    }

    public CompletableFuture<Map<String, Object>> globalDirectoryAsync(Map<String, Object> args) {
        return callAsync(Operation.GLOBAL_DIRECTORY, args);
    }

    public Map<String, Object> localDirectory(Map<String, Object> args) {
        return call(Operation.LOCAL_DIRECTORY, args);
    }

    public CompletableFuture<Map<String, Object>> localDirectoryAsync(Map<String, Object> args) {
        return callAsync(Operation.LOCAL_DIRECTORY, args);
    }
}
