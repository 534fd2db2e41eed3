package work.lcod.mbridge.runtime;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;

/**
 * The single mutual-exclusion gate in front of the engine channel. It counts the calls inside
 * the gate so that the one-at-a-time rule can be observed.
 */
public final class CallGate {
    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxObserved = new AtomicInteger();

    public <T> T enter(Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            throw BridgeException.resource("Engine channel is not reentrant");
        }
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BridgeException(ErrorKind.RESOURCE, "Interrupted while waiting for the engine gate", ex);
        }
        try {
            int current = inFlight.incrementAndGet();
            maxObserved.accumulateAndGet(current, Math::max);
            return action.get();
        } finally {
            inFlight.decrementAndGet();
            lock.unlock();
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int maxObserved() {
        return maxObserved.get();
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
