package work.lcod.mbridge.runtime;

import java.util.List;
import java.util.Map;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.codec.NameRules;

/**
 * Typed accessors over the JSON-shaped argument objects callers pass to operations.
 */
final class CallArguments {
    private CallArguments() {}

    /**
     * The global or local a node operation addresses.
     */
    record Target(String kind, String wireName, String displayName) {
        static final String GLOBAL = "global";
        static final String LOCAL = "local";
    }

    static Target target(Map<String, Object> args) {
        Object global = args.get(Target.GLOBAL);
        if (global != null) {
            String wire = NameRules.globalName(text(global, Target.GLOBAL));
            return new Target(Target.GLOBAL, wire, NameRules.localize(wire));
        }
        Object local = args.get(Target.LOCAL);
        if (local != null) {
            String wire = NameRules.localName(text(local, Target.LOCAL));
            return new Target(Target.LOCAL, wire, wire);
        }
        throw BridgeException.encoding("Need a global or a local name");
    }

    static boolean hasTarget(Map<String, Object> args) {
        return args.get(Target.GLOBAL) != null || args.get(Target.LOCAL) != null;
    }

    static List<Object> list(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            List<Object> items = (List<Object>) list;
            return items;
        }
        throw BridgeException.encoding(key + " must be an array, got " + value.getClass().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw BridgeException.encoding(key + " must be an object");
    }

    static String string(Map<String, Object> args, String key, String fallback) {
        Object value = args.get(key);
        return value == null ? fallback : text(value, key);
    }

    static int integer(Map<String, Object> args, String key, int fallback) {
        Object value = args.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw BridgeException.encoding(key + " must be an integer, got " + value);
        }
    }

    static boolean flag(Map<String, Object> args, String key, boolean fallback) {
        Object value = args.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static String text(Object value, String key) {
        if (value instanceof CharSequence sequence) {
            return sequence.toString();
        }
        throw BridgeException.encoding(key + " must be a string, got " + value.getClass().getSimpleName());
    }
}
