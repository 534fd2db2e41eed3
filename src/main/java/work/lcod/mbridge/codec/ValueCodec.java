package work.lcod.mbridge.codec;

import work.lcod.mbridge.api.Mode;

/**
 * Converts one token between host literal form and engine form. The codec only reshapes
 * delimiters and leading zeros; it never changes a value.
 */
public final class ValueCodec {
    private ValueCodec() {}

    /**
     * Host token to engine token. Data values are stored as-is by the engine, so they lose one
     * layer of quotes; subscripts and arguments are evaluated by the engine, so strings stay
     * quoted literals.
     */
    public static String encodeInput(String token, Mode mode, boolean dataValue) {
        if (token.isEmpty()) {
            return token;
        }
        var tokenClass = ValueClassifier.classify(token, Direction.INPUT);
        if (mode == Mode.CANONICAL && tokenClass == TokenClass.NUMBER) {
            return stripLeadingZero(token);
        }
        if (dataValue) {
            return tokenClass == TokenClass.ALREADY_QUOTED ? token.substring(1, token.length() - 1) : token;
        }
        if (tokenClass == TokenClass.ALREADY_QUOTED) {
            return StringEscaper.escapeForEngine(token);
        }
        return StringEscaper.escapeForEngine("\"" + token + "\"");
    }

    /**
     * Raw engine value to a host JSON literal.
     */
    public static String decodeOutput(String token, Mode mode) {
        if (mode == Mode.CANONICAL && ValueClassifier.classify(token, Direction.OUTPUT) == TokenClass.NUMBER) {
            return restoreLeadingZero(token);
        }
        return "\"" + StringEscaper.escapeForTransport(token) + "\"";
    }

    static String stripLeadingZero(String token) {
        if (token.startsWith("0.")) {
            return token.substring(1);
        }
        if (token.startsWith("-0.")) {
            return "-" + token.substring(2);
        }
        return token;
    }

    static String restoreLeadingZero(String token) {
        if (token.startsWith(".")) {
            return "0" + token;
        }
        if (token.startsWith("-.")) {
            return "-0" + token.substring(1);
        }
        return token;
    }
}
