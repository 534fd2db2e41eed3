package work.lcod.mbridge.engine.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.mbridge.api.DebugLevel;
import work.lcod.mbridge.codec.SubscriptPacker;
import work.lcod.mbridge.engine.EngineChannel;
import work.lcod.mbridge.runtime.CallBuffer;

/**
 * One engine process running in memory: its own local variables, lock ownership and interrupt
 * trap, attached to a shared {@link InMemoryDatabase}. Like a native engine it refuses to be
 * entered by two calls at once.
 */
public final class InMemoryEngine implements EngineChannel {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEngine.class);
    private static final AtomicLong PROCESS_IDS = new AtomicLong(1000);

    private final InMemoryDatabase database;
    private final long processId = PROCESS_IDS.incrementAndGet();
    private final NavigableMap<String, NodeTree> locals = new TreeMap<>();
    private final IntegrationRoutine integration;
    private final AtomicBoolean busy = new AtomicBoolean();
    private final AtomicBoolean interruptPending = new AtomicBoolean();
    private volatile DebugLevel debugLevel = DebugLevel.OFF;
    private volatile boolean open;
    private volatile boolean closed;
    private String lastError = "";

    public InMemoryEngine(InMemoryDatabase database) {
        this.database = database;
        this.integration = new IntegrationRoutine(this);
    }

    @Override
    public void open() {
        if (closed) {
            throw new IllegalStateException("Engine process " + processId + " has exited");
        }
        open = true;
    }

    @Override
    public int call(String routine, CallBuffer result, Object... args) {
        if (!busy.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine process " + processId + " entered by two calls at once");
        }
        try {
            if (!open) {
                throw new EngineFault(EngineFault.NOT_OPEN, "%YDB-E-CALLINAFTERXIT, After a ydb_exit(), a process cannot create a valid YottaDB context");
            }
            if (interruptPending.getAndSet(false)) {
                throw interruptFault();
            }
            var arguments = new ArrayList<String>(args.length);
            for (Object arg : args) {
                arguments.add(String.valueOf(arg));
            }
            if (debugLevel.includes(DebugLevel.MEDIUM)) {
                log.debug("[engine {}] {} enter {}", processId, routine, arguments);
            }
            List<String> reply = integration.invoke(routine, arguments);
            result.write(SubscriptPacker.pack(reply));
            if (debugLevel.includes(DebugLevel.MEDIUM)) {
                log.debug("[engine {}] {} exit {}", processId, routine, reply);
            }
            lastError = "";
            return 0;
        } catch (EngineFault fault) {
            lastError = fault.statusText();
            if (debugLevel.includes(DebugLevel.LOW)) {
                log.debug("[engine {}] {} failed: {}", processId, routine, lastError);
            }
            return fault.code();
        } finally {
            locals.remove(IntegrationRoutine.TEMP_ARRAY);
            busy.set(false);
        }
    }

    @Override
    public void status(CallBuffer error) {
        error.write(lastError);
    }

    @Override
    public String describe() {
        return "memory engine process " + processId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        database.locks().releaseAll(processId);
        locals.clear();
        open = false;
        closed = true;
    }

    /**
     * Delivers an interrupt. The call running now, or the next one, completes with an
     * interrupt status instead of its result.
     */
    public void raiseInterrupt() {
        interruptPending.set(true);
    }

    boolean takeInterrupt() {
        return interruptPending.getAndSet(false);
    }

    static EngineFault interruptFault() {
        return new EngineFault(EngineFault.INTERRUPTED, "%YDB-E-CTRAP, Character trap $C(3) encountered");
    }

    public long processId() {
        return processId;
    }

    public InMemoryDatabase database() {
        return database;
    }

    public DebugLevel debugLevel() {
        return debugLevel;
    }

    void setDebugLevel(DebugLevel level) {
        this.debugLevel = level;
    }

    NavigableMap<String, NodeTree> locals() {
        return locals;
    }

    /**
     * Runs {@code action} on the variable table holding {@code name}: the shared globals for
     * {@code ^name}, this process's locals otherwise.
     */
    <T> T variables(String name, Function<NavigableMap<String, NodeTree>, T> action) {
        if (name.startsWith("^")) {
            return database.globals(action);
        }
        return action.apply(locals);
    }

    /**
     * Value of a node, or {@code null} when undefined. For use by {@link EngineRoutine} code.
     */
    public String value(String name, List<String> subscripts) {
        return variables(name, table -> {
            NodeTree root = table.get(name);
            return root == null ? null : root.get(subscripts);
        });
    }

    /**
     * Stores a node value. For use by {@link EngineRoutine} code.
     */
    public void store(String name, List<String> subscripts, String value) {
        variables(name, table -> {
            table.computeIfAbsent(name, key -> new NodeTree()).set(subscripts, value);
            return null;
        });
    }
}
