package work.lcod.mbridge.runtime;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.mbridge.api.Mode;

/**
 * Fixed table of operation handlers. Requests are typed by their {@link Operation} and routed
 * here instead of being assembled into engine command strings.
 */
public final class OperationTable {
    private final Map<Operation, OperationHandler> handlers = new EnumMap<>(Operation.class);

    public OperationTable register(Operation operation, OperationHandler handler) {
        handlers.put(Objects.requireNonNull(operation, "operation"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public PreparedCall prepare(Operation operation, Map<String, Object> args, Mode mode, boolean async) {
        OperationHandler handler = handlers.get(operation);
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for " + operation.routine());
        }
        return handler.prepare(args == null ? Map.of() : args, mode, async);
    }
}
