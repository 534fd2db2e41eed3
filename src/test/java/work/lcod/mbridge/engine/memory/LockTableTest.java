package work.lcod.mbridge.engine.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LockTableTest {
    private static final long FIRST = 1;
    private static final long SECOND = 2;

    private final LockTable locks = new LockTable();

    @Test
    void ancestorsAndDescendantsConflict() {
        assertTrue(locks.lock(List.of("^a", "1"), FIRST, 0, () -> false));
        assertFalse(locks.lock(List.of("^a"), SECOND, 0, () -> false));
        assertFalse(locks.lock(List.of("^a", "1", "x"), SECOND, 0, () -> false));
        assertTrue(locks.lock(List.of("^a", "2"), SECOND, 0, () -> false));
        assertTrue(locks.lock(List.of("^b"), SECOND, 0, () -> false));
    }

    @Test
    void locksAreIncrementalPerOwner() {
        assertTrue(locks.lock(List.of("^a"), FIRST, 0, () -> false));
        assertTrue(locks.lock(List.of("^a"), FIRST, 0, () -> false));
        assertEquals(2, locks.count(List.of("^a"), FIRST));

        locks.unlock(List.of("^a"), FIRST);
        assertFalse(locks.lock(List.of("^a"), SECOND, 0, () -> false));
        locks.unlock(List.of("^a"), FIRST);
        assertEquals(0, locks.count(List.of("^a"), FIRST));
        assertTrue(locks.lock(List.of("^a"), SECOND, 0, () -> false));
    }

    @Test
    void unlockByOtherOwnerIsIgnored() {
        assertTrue(locks.lock(List.of("^a"), FIRST, 0, () -> false));
        locks.unlock(List.of("^a"), SECOND);
        assertEquals(1, locks.count(List.of("^a"), FIRST));
    }

    @Test
    void releaseAllDropsEveryLockOfTheOwner() {
        locks.lock(List.of("^a"), FIRST, 0, () -> false);
        locks.lock(List.of("x"), FIRST, 0, () -> false);
        locks.lock(List.of("^b"), SECOND, 0, () -> false);

        locks.releaseAll(FIRST);

        assertEquals(List.of(), locks.heldBy(FIRST));
        assertEquals(List.of(List.of("^b")), locks.heldBy(SECOND));
    }

    @Test
    void waiterAcquiresOnceReleased() throws Exception {
        locks.lock(List.of("^a"), FIRST, 0, () -> false);
        var waiter = CompletableFuture.supplyAsync(() -> locks.lock(List.of("^a"), SECOND, 5000, () -> false));
        Thread.sleep(60);
        assertFalse(waiter.isDone());

        locks.unlock(List.of("^a"), FIRST);

        assertTrue(waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void interruptStopsTheWait() {
        locks.lock(List.of("^a"), FIRST, 0, () -> false);
        var fault = assertThrows(EngineFault.class, () -> locks.lock(List.of("^a"), SECOND, -1, () -> true));
        assertEquals(EngineFault.INTERRUPTED, fault.code());
        assertTrue(fault.getMessage().contains("CTRAP"));
    }
}
