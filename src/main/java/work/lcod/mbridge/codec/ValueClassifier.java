package work.lcod.mbridge.codec;

/**
 * Decides whether a token travels as a number or as a string.
 *
 * <p>The engine keeps about 18 significant digits and overflows near 47, while the host keeps
 * about 16 and switches to exponent notation at 21. Tokens longer than
 * {@link #MAX_NUMERIC_LENGTH} characters are therefore always strings, in both directions.</p>
 */
public final class ValueClassifier {
    public static final int MAX_NUMERIC_LENGTH = 15;

    private ValueClassifier() {}

    public static TokenClass classify(String token, Direction direction) {
        if (isQuoted(token)) {
            return TokenClass.ALREADY_QUOTED;
        }
        if (token.length() > MAX_NUMERIC_LENGTH) {
            return TokenClass.QUOTED_STRING;
        }
        if (direction == Direction.INPUT && token.contains("e+")) {
            return TokenClass.QUOTED_STRING;
        }
        return isNumber(token, direction) ? TokenClass.NUMBER : TokenClass.QUOTED_STRING;
    }

    public static boolean isQuoted(String token) {
        return token.length() >= 2 && token.charAt(0) == '"' && token.charAt(token.length() - 1) == '"';
    }

    static boolean isNumber(String token, Direction direction) {
        if (token.indexOf('e') >= 0 || token.indexOf('E') >= 0) {
            return false;
        }
        if (CanonicalNumbers.isCanonical(token)) {
            return true;
        }
        return direction == Direction.INPUT && CanonicalNumbers.isLeadingZeroFraction(token);
    }
}
