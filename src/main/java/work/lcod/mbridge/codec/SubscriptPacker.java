package work.lcod.mbridge.codec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import work.lcod.mbridge.api.BridgeException;

/**
 * Length-prefixed transport form of a token list: {@code <bytes>:<token>} repeated with no
 * separators. Lengths count UTF-8 bytes, so the format survives any token content.
 */
public final class SubscriptPacker {
    private static final char LENGTH_DELIMITER = ':';

    private SubscriptPacker() {}

    public static String pack(List<String> tokens) {
        var builder = new StringBuilder();
        for (String token : tokens) {
            builder.append(token.getBytes(StandardCharsets.UTF_8).length)
                .append(LENGTH_DELIMITER)
                .append(token);
        }
        return builder.toString();
    }

    public static List<String> unpack(String packed) {
        return unpack(packed, false);
    }

    /**
     * Parses a packed string. With {@code dropLast} the final token is discarded, which merge
     * uses to address the parent of the last packed node.
     */
    public static List<String> unpack(String packed, boolean dropLast) {
        var tokens = new ArrayList<String>();
        byte[] bytes = packed.getBytes(StandardCharsets.UTF_8);
        int position = 0;
        while (position < bytes.length) {
            int start = position;
            long length = 0;
            while (position < bytes.length && bytes[position] >= '0' && bytes[position] <= '9') {
                length = length * 10 + (bytes[position] - '0');
                if (length > Integer.MAX_VALUE) {
                    throw BridgeException.encoding("Packed length overflows at offset " + start);
                }
                position++;
            }
            if (position == start) {
                throw BridgeException.encoding("Expected a length prefix at offset " + start);
            }
            if (position >= bytes.length || bytes[position] != LENGTH_DELIMITER) {
                throw BridgeException.encoding("Expected '" + LENGTH_DELIMITER + "' at offset " + position);
            }
            position++;
            if (bytes.length - position < length) {
                throw BridgeException.encoding("Token at offset " + start + " declares " + length
                    + " bytes but only " + (bytes.length - position) + " remain");
            }
            tokens.add(new String(bytes, position, (int) length, StandardCharsets.UTF_8));
            position += (int) length;
        }
        if (dropLast && !tokens.isEmpty()) {
            tokens.remove(tokens.size() - 1);
        }
        return tokens;
    }
}
