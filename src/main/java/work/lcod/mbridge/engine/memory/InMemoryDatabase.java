package work.lcod.mbridge.engine.memory;

import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * State shared by every engine process attached to the same database: globals, the lock table,
 * the routine table, and the engine's version identity.
 */
public final class InMemoryDatabase {
    public static final String DEFAULT_ZVERSION = "GT.M V6.3-008 Linux x86_64";
    public static final String DEFAULT_RELEASE = "YottaDB r1.30 Linux x86_64";

    private final NavigableMap<String, NodeTree> globals = new TreeMap<>();
    private final LockTable locks = new LockTable();
    private final RoutineTable routines = new RoutineTable();
    private final String zversion;
    private final String release;

    public InMemoryDatabase() {
        this(DEFAULT_ZVERSION, DEFAULT_RELEASE);
    }

    /**
     * @param release release text, or {@code null} for an engine without the release special variable
     */
    public InMemoryDatabase(String zversion, String release) {
        this.zversion = zversion;
        this.release = release;
    }

    public static InMemoryDatabase yottaDb(String release) {
        return new InMemoryDatabase(DEFAULT_ZVERSION, "YottaDB " + release + " Linux x86_64");
    }

    public static InMemoryDatabase gtm(String version) {
        return new InMemoryDatabase("GT.M " + version + " Linux x86_64", null);
    }

    /**
     * Runs {@code action} with exclusive access to the globals.
     */
    public synchronized <T> T globals(Function<NavigableMap<String, NodeTree>, T> action) {
        return action.apply(globals);
    }

    public LockTable locks() {
        return locks;
    }

    public RoutineTable routines() {
        return routines;
    }

    public String zversion() {
        return zversion;
    }

    public String release() {
        return release;
    }
}
