package work.lcod.mbridge.codec;

import work.lcod.mbridge.api.BridgeException;

/**
 * Validation and normalisation of global and local variable names.
 */
public final class NameRules {
    public static final String INTERNAL_PREFIX = "v4w";
    public static final int MAX_SUBSCRIPTS = 31;

    private NameRules() {}

    public static String globalName(String name) {
        requireName(name, "global");
        return name.startsWith("^") ? name : "^" + name;
    }

    public static String localName(String name) {
        requireName(name, "local");
        String local = name.startsWith("^") ? name.substring(1) : name;
        if (isInternal(local)) {
            throw BridgeException.encoding("Local names starting with " + INTERNAL_PREFIX + " are reserved: " + name);
        }
        return local;
    }

    /**
     * Name as reported back to callers, without the global marker.
     */
    public static String localize(String name) {
        return name.startsWith("^") ? name.substring(1) : name;
    }

    public static boolean isInternal(String name) {
        return name.startsWith(INTERNAL_PREFIX);
    }

    public static void requireSubscriptCount(int count) {
        if (count > MAX_SUBSCRIPTS) {
            throw BridgeException.encoding("At most " + MAX_SUBSCRIPTS + " subscripts are allowed, got " + count);
        }
    }

    public static void requireRoutineName(String name, String kind) {
        requireName(name, kind);
    }

    private static void requireName(String name, String kind) {
        if (name == null || name.isBlank() || name.equals("^")) {
            throw BridgeException.encoding("Missing " + kind + " name");
        }
        if (name.indexOf('(') >= 0 || name.indexOf(')') >= 0) {
            throw BridgeException.encoding("Invalid " + kind + " name, parentheses are not allowed: " + name);
        }
    }
}
