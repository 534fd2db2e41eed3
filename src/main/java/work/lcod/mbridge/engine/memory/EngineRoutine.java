package work.lcod.mbridge.engine.memory;

import java.util.List;

/**
 * User code callable through the function and procedure operations. Arguments arrive as
 * evaluated engine values; the return value of a procedure is ignored.
 *
 * <p>The argument list is mutable. A value left in the slot of an argument passed by reference
 * is stored back into the caller's local variable when the routine returns.</p>
 */
@FunctionalInterface
public interface EngineRoutine {
    String invoke(InMemoryEngine engine, List<String> arguments);
}
