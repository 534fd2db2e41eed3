package work.lcod.mbridge.runtime;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * What the connected engine supports, negotiated once when the bridge opens.
 */
public record EngineCapabilities(String product, String release, String versionText, boolean reverseQuery) {
    private static final Pattern VERSION_LINE = Pattern.compile("(YottaDB|GT\\.M) Version: ([^\\s;]*)");
    private static final Pattern RELEASE_NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final BigDecimal REVERSE_QUERY_RELEASE = new BigDecimal("1.10");

    public static EngineCapabilities unknown() {
        return new EngineCapabilities("unknown", "", "", false);
    }

    /**
     * Reads an engine version line such as {@code YottaDB Version: 1.30} or
     * {@code GT.M Version: 6.3-008}. Reverse depth-first traversal needs YottaDB 1.10 or newer.
     */
    public static EngineCapabilities fromVersion(String versionText) {
        if (versionText == null) {
            return unknown();
        }
        Matcher matcher = VERSION_LINE.matcher(versionText);
        if (!matcher.find()) {
            return new EngineCapabilities("unknown", "", versionText, false);
        }
        String product = matcher.group(1);
        String release = matcher.group(2);
        return new EngineCapabilities(product, release, versionText, product.equals("YottaDB") && atLeast(release));
    }

    private static boolean atLeast(String release) {
        Matcher matcher = RELEASE_NUMBER.matcher(release);
        if (!matcher.find()) {
            return false;
        }
        return new BigDecimal(matcher.group()).compareTo(REVERSE_QUERY_RELEASE) >= 0;
    }
}
