package work.lcod.mbridge.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import work.lcod.mbridge.api.BridgeException;

/**
 * Quoting rules for both sides of the channel. Transport escaping makes a raw engine value safe
 * inside a JSON string literal; engine escaping doubles quotes so the engine's own string
 * literal grammar accepts the token.
 */
public final class StringEscaper {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private StringEscaper() {}

    public static String escapeForTransport(String token) {
        if (!needsTransportEscape(token)) {
            return token;
        }
        var builder = new StringBuilder(token.length() + 8);
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '"' || c == '\\') {
                builder.append('\\').append(c);
            } else if (isControl(c)) {
                builder.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    /**
     * Reverses {@link #escapeForTransport(String)} by reading the text as a JSON string body.
     */
    public static String unescapeTransport(String escaped) {
        try {
            return JSON.readValue("\"" + escaped + "\"", String.class);
        } catch (JsonProcessingException ex) {
            throw BridgeException.encoding("Malformed escaped token: " + escaped);
        }
    }

    /**
     * Doubles every quote between the first and last character of the token.
     */
    public static String escapeForEngine(String token) {
        if (token.length() < 3 || token.indexOf('"', 1) < 0) {
            return token;
        }
        int last = token.length() - 1;
        var builder = new StringBuilder(token.length() + 4);
        builder.append(token.charAt(0));
        for (int i = 1; i < last; i++) {
            char c = token.charAt(i);
            if (c == '"') {
                builder.append('"');
            }
            builder.append(c);
        }
        builder.append(token.charAt(last));
        return builder.toString();
    }

    /**
     * Reads an engine string literal ({@code "a""b"}) back to its value ({@code a"b}).
     */
    public static String unquoteEngineLiteral(String literal) {
        if (!ValueClassifier.isQuoted(literal)) {
            throw BridgeException.encoding("Not a string literal: " + literal);
        }
        return literal.substring(1, literal.length() - 1).replace("\"\"", "\"");
    }

    private static boolean needsTransportEscape(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '"' || c == '\\' || isControl(c)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isControl(char c) {
        return c < 0x20 || c == 0x7F;
    }
}
