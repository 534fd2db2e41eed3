package work.lcod.mbridge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.Mode;

class CallDescriptorTest {
    private static CallDescriptor descriptor() {
        return new CallDescriptor(Operation.GET, List.of("^a", ""), Mode.CANONICAL, false, 64, 64);
    }

    @Test
    void movesForwardThroughItsStates() {
        var call = descriptor();
        assertEquals(CallState.CREATED, call.state());
        call.markQueued();
        call.markExecuting();
        call.complete(0);
        assertEquals(CallState.COMPLETED, call.state());
        assertEquals(0, call.status());
        assertEquals("get", call.routine());
    }

    @Test
    void refusesToSkipOrRepeatStates() {
        var call = descriptor();
        assertThrows(IllegalStateException.class, call::markExecuting);
        call.markQueued();
        assertThrows(IllegalStateException.class, call::markQueued);
    }

    @Test
    void failKeepsTheFirstTerminalState() {
        var call = descriptor();
        call.markQueued();
        var cause = new IllegalStateException("boom");
        call.fail(7, cause);
        assertEquals(CallState.FAILED, call.state());
        assertSame(cause, call.failure());

        call.fail(9, new IllegalStateException("later"));
        assertEquals(7, call.status());
        assertSame(cause, call.failure());

        var done = descriptor();
        done.markQueued();
        done.markExecuting();
        done.complete(0);
        done.fail(1, cause);
        assertEquals(CallState.COMPLETED, done.state());
    }

    @Test
    void argumentsAreCopied() {
        var arguments = new ArrayList<Object>(List.of("x"));
        var call = new CallDescriptor(Operation.DATA, arguments, Mode.STRICT, true, 8, 8);
        arguments.add("y");
        assertEquals(List.of("x"), call.arguments());
    }
}
