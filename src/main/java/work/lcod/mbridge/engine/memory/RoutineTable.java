package work.lcod.mbridge.engine.memory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routines known to a database, keyed by entry reference ({@code label^routine}, {@code ^routine}
 * or a bare label).
 */
public final class RoutineTable {
    private final Map<String, EngineRoutine> routines = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> links = new ConcurrentHashMap<>();

    public RoutineTable define(String entryRef, EngineRoutine routine) {
        routines.put(entryRef, routine);
        return this;
    }

    public EngineRoutine lookup(String entryRef) {
        EngineRoutine routine = routines.get(entryRef);
        if (routine == null) {
            throw new EngineFault(EngineFault.UNKNOWN_ROUTINE,
                "%YDB-E-ZLINKFILE, Error while zlinking \"" + routineName(entryRef) + "\"");
        }
        return routine;
    }

    /**
     * Records a relink of the routine that holds {@code entryRef}.
     */
    public void relink(String entryRef) {
        links.computeIfAbsent(routineName(entryRef), key -> new AtomicInteger()).incrementAndGet();
    }

    public int relinkCount(String routine) {
        AtomicInteger count = links.get(routine);
        return count == null ? 0 : count.get();
    }

    /**
     * Routine part of an entry reference, with {@code %} mapped to {@code _} as in routine file names.
     */
    static String routineName(String entryRef) {
        int caret = entryRef.indexOf('^');
        String routine = caret >= 0 ? entryRef.substring(caret + 1) : entryRef;
        return routine.replace('%', '_');
    }
}
