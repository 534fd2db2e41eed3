package work.lcod.mbridge.engine.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Incremental, hierarchical locks shared by every engine process of a database. Locking a node
 * conflicts with any lock another process holds on the same node, an ancestor, or a descendant.
 */
public final class LockTable {
    private static final long POLL_MILLIS = 20;

    private final Map<List<String>, Holder> held = new HashMap<>();

    /**
     * Waits up to {@code timeoutMillis} (negative waits forever) for the lock.
     *
     * @return {@code true} when acquired, {@code false} on timeout
     * @throws EngineFault when {@code interrupted} reports an interrupt while waiting
     */
    public synchronized boolean lock(List<String> resource, long owner, long timeoutMillis, BooleanSupplier interrupted) {
        List<String> key = List.copyOf(resource);
        long deadline = timeoutMillis < 0 ? Long.MAX_VALUE : System.currentTimeMillis() + timeoutMillis;
        while (conflicts(key, owner)) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            if (interrupted.getAsBoolean()) {
                throw InMemoryEngine.interruptFault();
            }
            try {
                wait(Math.min(remaining, POLL_MILLIS));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw InMemoryEngine.interruptFault();
            }
        }
        held.computeIfAbsent(key, k -> new Holder(owner)).count++;
        return true;
    }

    public synchronized void unlock(List<String> resource, long owner) {
        Holder holder = held.get(resource);
        if (holder == null || holder.owner != owner) {
            return;
        }
        if (--holder.count == 0) {
            held.remove(resource);
        }
        notifyAll();
    }

    public synchronized void releaseAll(long owner) {
        Iterator<Holder> holders = held.values().iterator();
        while (holders.hasNext()) {
            if (holders.next().owner == owner) {
                holders.remove();
            }
        }
        notifyAll();
    }

    public synchronized int count(List<String> resource, long owner) {
        Holder holder = held.get(resource);
        return holder == null || holder.owner != owner ? 0 : holder.count;
    }

    public synchronized List<List<String>> heldBy(long owner) {
        var resources = new ArrayList<List<String>>();
        held.forEach((resource, holder) -> {
            if (holder.owner == owner) {
                resources.add(resource);
            }
        });
        return resources;
    }

    private boolean conflicts(List<String> resource, long owner) {
        for (Map.Entry<List<String>, Holder> entry : held.entrySet()) {
            if (entry.getValue().owner != owner && overlaps(entry.getKey(), resource)) {
                return true;
            }
        }
        return false;
    }

    private static boolean overlaps(List<String> left, List<String> right) {
        int shared = Math.min(left.size(), right.size());
        return left.subList(0, shared).equals(right.subList(0, shared));
    }

    private static final class Holder {
        private final long owner;
        private int count;

        private Holder(long owner) {
            this.owner = owner;
        }
    }
}
