package work.lcod.mbridge.runtime;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.ErrorKind;
import work.lcod.mbridge.engine.EngineChannel;
import work.lcod.mbridge.engine.EngineStatus;

/**
 * Runs call descriptors against the engine channel, one at a time. Blocking calls execute on
 * the caller's thread; asynchronous calls are handed to a fixed worker pool and complete a
 * future.
 */
public final class CallDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CallDispatcher.class);
    private static final long SHUTDOWN_SECONDS = 5;

    private final EngineChannel channel;
    private final CallGate gate;
    private final DebugTrace trace;
    private final ExecutorService workers;

    public CallDispatcher(EngineChannel channel, CallGate gate, DebugTrace trace, int workerCount) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.trace = Objects.requireNonNull(trace, "trace");
        this.workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory("mbridge-worker"));
    }

    public CallGate gate() {
        return gate;
    }

    /**
     * Executes the call on the current thread and returns the raw engine reply.
     */
    public String execute(CallDescriptor call) {
        call.markQueued();
        return guarded(call);
    }

    /**
     * Queues the call on the worker pool. The returned future completes with the raw engine
     * reply, or exceptionally with a {@link BridgeException}.
     */
    public CompletableFuture<String> submit(CallDescriptor call) {
        call.markQueued();
        try {
            return CompletableFuture.supplyAsync(() -> guarded(call), workers);
        } catch (RejectedExecutionException ex) {
            var failure = new BridgeException(ErrorKind.RESOURCE, "Worker pool rejected " + call.routine(), ex);
            call.fail(-1, failure);
            return CompletableFuture.failedFuture(failure);
        }
    }

    private String guarded(CallDescriptor call) {
        try {
            return gate.enter(() -> run(call));
        } catch (RuntimeException ex) {
            call.fail(-1, ex);
            throw ex;
        }
    }

    private String run(CallDescriptor call) {
        call.markExecuting();
        trace.enter(call.operation());
        trace.detail("{} arguments {}", call.routine(), call.arguments());
        int status = -1;
        try {
            status = channel.call(call.routine(), call.result(), call.arguments().toArray());
            if (status != EngineStatus.OK) {
                channel.status(call.error());
                EngineStatus engineStatus = EngineStatus.parse(call.error().contents(), status);
                throw engineStatus.toException();
            }
            call.complete(status);
            trace.detail("{} reply {}", call.routine(), call.result().contents());
            return call.result().contents();
        } catch (RuntimeException ex) {
            call.fail(status, ex);
            throw ex;
        } finally {
            trace.exit(call.operation(), status);
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not stop within {}s, interrupting", SHUTDOWN_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static final class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger count = new AtomicInteger();

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setDaemon(true);
            thread.setName(namePrefix + "-" + count.incrementAndGet());
            return thread;
        }
    }
}
