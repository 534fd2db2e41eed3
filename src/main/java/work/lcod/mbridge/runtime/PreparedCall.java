package work.lcod.mbridge.runtime;

import java.util.Map;
import java.util.Objects;
import work.lcod.mbridge.codec.SubscriptPacker;

/**
 * A call ready for dispatch plus the shaper for its reply, or a result that needs no engine
 * round trip at all.
 */
public final class PreparedCall {
    private final CallDescriptor descriptor;
    private final ReplyShaper shaper;
    private final Map<String, Object> immediate;

    private PreparedCall(CallDescriptor descriptor, ReplyShaper shaper, Map<String, Object> immediate) {
        this.descriptor = descriptor;
        this.shaper = shaper;
        this.immediate = immediate;
    }

    public static PreparedCall of(CallDescriptor descriptor, ReplyShaper shaper) {
        return new PreparedCall(Objects.requireNonNull(descriptor, "descriptor"), Objects.requireNonNull(shaper, "shaper"), null);
    }

    public static PreparedCall immediate(Map<String, Object> result) {
        return new PreparedCall(null, null, Objects.requireNonNull(result, "result"));
    }

    public boolean isImmediate() {
        return immediate != null;
    }

    public CallDescriptor descriptor() {
        return descriptor;
    }

    public Map<String, Object> immediateResult() {
        return immediate;
    }

    public Map<String, Object> shape(String reply) {
        return shaper.shape(SubscriptPacker.unpack(reply));
    }
}
