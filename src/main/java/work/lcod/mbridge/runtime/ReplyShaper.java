package work.lcod.mbridge.runtime;

import java.util.List;
import java.util.Map;

/**
 * Turns the raw values of an engine reply into the result object returned to the caller.
 */
@FunctionalInterface
public interface ReplyShaper {
    Map<String, Object> shape(List<String> rawValues);
}
