package work.lcod.mbridge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.DebugLevel;
import work.lcod.mbridge.api.ErrorKind;
import work.lcod.mbridge.api.Mode;
import work.lcod.mbridge.engine.EngineChannel;

class CallDispatcherTest {
    private final CountingChannel channel = new CountingChannel();
    private final CallDispatcher dispatcher = new CallDispatcher(channel, new CallGate(), new DebugTrace(DebugLevel.HIGH), 4);

    @AfterEach
    void shutdown() {
        dispatcher.close();
    }

    private static CallDescriptor call(Operation operation, Object... args) {
        return new CallDescriptor(operation, List.of(args), Mode.CANONICAL, true, 256, 256);
    }

    @Test
    void executeReturnsTheReply() {
        var call = call(Operation.DATA, "x", "");
        assertEquals("1:0", dispatcher.execute(call));
        assertEquals(CallState.COMPLETED, call.state());
        assertEquals(0, call.status());
    }

    @Test
    void concurrentSubmissionsNeverOverlap() throws Exception {
        var futures = new ArrayList<CompletableFuture<String>>();
        for (int i = 0; i < 40; i++) {
            futures.add(dispatcher.submit(call(Operation.DATA, "x" + i, "")));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertEquals(40, channel.calls.get());
        assertEquals(1, channel.maxConcurrent.get());
        assertEquals(1, dispatcher.gate().maxObserved());
        assertEquals(0, dispatcher.gate().inFlight());
    }

    @Test
    void engineFailureBecomesBridgeException() {
        var call = call(Operation.GET, "fail", "");
        var ex = assertThrows(BridgeException.class, () -> dispatcher.execute(call));
        assertEquals(ErrorKind.ENGINE, ex.kind());
        assertEquals(150372990, ex.code());
        assertTrue(ex.getMessage().contains("NULSUBSC"));
        assertEquals(CallState.FAILED, call.state());
        assertFalse(dispatcher.gate().isLocked());
    }

    @Test
    void interruptStatusIsReportedAsInterrupt() {
        var call = call(Operation.LOCK, "interrupt", "");
        var ex = assertThrows(BridgeException.class, () -> dispatcher.execute(call));
        assertEquals(ErrorKind.INTERRUPT, ex.kind());
    }

    @Test
    void asyncFailureCompletesExceptionallyAndReleasesTheGate() throws Exception {
        var failing = call(Operation.GET, "throw", "");
        var future = dispatcher.submit(failing);
        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals(CallState.FAILED, failing.state());

        assertEquals("1:0", dispatcher.submit(call(Operation.DATA, "x", "")).get(5, TimeUnit.SECONDS));
    }

    @Test
    void gateRefusesReentry() {
        var gate = dispatcher.gate();
        var ex = assertThrows(BridgeException.class, () -> gate.enter(() -> gate.enter(() -> "inner")));
        assertEquals(ErrorKind.RESOURCE, ex.kind());
        assertFalse(gate.isLocked());
    }

    @Test
    void submitAfterCloseFails() {
        dispatcher.close();
        var call = call(Operation.DATA, "x", "");
        var future = dispatcher.submit(call);
        var ex = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(BridgeException.class, ex.getCause());
        assertEquals(CallState.FAILED, call.state());
    }

    private static final class CountingChannel implements EngineChannel {
        private final AtomicInteger inside = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();
        private final AtomicInteger calls = new AtomicInteger();
        private String lastError = "";

        @Override
        public void open() {}

        @Override
        public int call(String routine, CallBuffer result, Object... args) {
            int now = inside.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            calls.incrementAndGet();
            try {
                Thread.sleep(2);
                switch (String.valueOf(args[0])) {
                    case "fail":
                        lastError = "150372990,%YDB-E-NULSUBSC, Null subscripts are not allowed";
                        return 150372990;
                    case "interrupt":
                        lastError = "150372986,%YDB-E-CTRAP, Character trap $C(3) encountered";
                        return 150372986;
                    case "throw":
                        throw new IllegalStateException("channel broke");
                    default:
                        result.write("1:0");
                        return 0;
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            } finally {
                inside.decrementAndGet();
            }
        }

        @Override
        public void status(CallBuffer error) {
            error.write(lastError);
        }

        @Override
        public String describe() {
            return "counting channel";
        }

        @Override
        public void close() {}
    }
}
