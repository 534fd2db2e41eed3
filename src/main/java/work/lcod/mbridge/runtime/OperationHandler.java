package work.lcod.mbridge.runtime;

import java.util.Map;
import work.lcod.mbridge.api.Mode;

/**
 * Validates and encodes the arguments of one operation into a {@link PreparedCall}. Encoding
 * failures are thrown from here, before anything reaches the dispatcher.
 */
@FunctionalInterface
public interface OperationHandler {
    PreparedCall prepare(Map<String, Object> args, Mode mode, boolean async);
}
