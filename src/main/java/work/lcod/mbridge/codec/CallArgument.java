package work.lcod.mbridge.codec;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import work.lcod.mbridge.api.BridgeException;

/**
 * One function or procedure argument. Plain host values, and {@code {"type": "value"}}
 * wrappers, become data tokens that still go through input conversion. {@code {"type":
 * "variable"}} names a local whose value is passed, {@code {"type": "reference"}} passes that
 * local by reference ({@code .name}); both travel as engine-ready text.
 */
public record CallArgument(String token, boolean engineReady) {
    public static final String TYPE = "type";
    public static final String VALUE = "value";
    public static final String VARIABLE = "variable";
    public static final String REFERENCE = "reference";

    private static final Pattern LOCAL_NAME = Pattern.compile("%?[A-Za-z][A-Za-z0-9]*");

    public static CallArgument from(Object argument, int position) {
        if (argument == null) {
            throw BridgeException.encoding("Null value at position " + position);
        }
        if (!(argument instanceof Map<?, ?> typed)) {
            return new CallArgument(HostTokens.fromHost(argument), false);
        }
        Object type = typed.get(TYPE);
        Object value = typed.get(VALUE);
        if (type == null) {
            throw BridgeException.encoding("Argument at position " + position + " needs a type");
        }
        switch (type.toString().toLowerCase(Locale.ROOT)) {
            case VALUE:
                return new CallArgument(HostTokens.fromHost(value == null ? "" : value), false);
            case VARIABLE:
                return new CallArgument(localName(value, position), true);
            case REFERENCE:
                return new CallArgument("." + localName(value, position), true);
            default:
                throw BridgeException.encoding("Unknown argument type '" + type + "' at position " + position);
        }
    }

    private static String localName(Object value, int position) {
        if (!(value instanceof CharSequence)) {
            throw BridgeException.encoding("Argument at position " + position + " must name a local variable");
        }
        String name = NameRules.localName(value.toString());
        if (!LOCAL_NAME.matcher(name).matches()) {
            throw BridgeException.encoding("Invalid local name at position " + position + ": " + name);
        }
        return name;
    }
}
