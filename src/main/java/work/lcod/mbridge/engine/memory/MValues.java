package work.lcod.mbridge.engine.memory;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.mbridge.codec.CanonicalNumbers;
import work.lcod.mbridge.codec.StringEscaper;
import work.lcod.mbridge.codec.ValueClassifier;

/**
 * Value rules of the engine: literal evaluation and numeric interpretation of strings.
 */
public final class MValues {
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^[+-]*([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private MValues() {}

    /**
     * Evaluates a literal token: a quoted string with doubled inner quotes, or a number.
     */
    public static String evaluateLiteral(String token) {
        if (ValueClassifier.isQuoted(token)) {
            return StringEscaper.unquoteEngineLiteral(token);
        }
        if (NUMERIC_LITERAL.matcher(token).matches()) {
            return CanonicalNumbers.format(new BigDecimal(token));
        }
        throw new EngineFault(EngineFault.INVALID_EXPRESSION, "%YDB-E-EXPR, Expression expected but not found: " + token);
    }

    /**
     * Numeric interpretation of any string: its leading numeric part, or zero.
     */
    public static BigDecimal toNumber(String value) {
        Matcher matcher = NUMERIC_PREFIX.matcher(value);
        if (!matcher.find()) {
            return BigDecimal.ZERO;
        }
        String text = matcher.group();
        int minus = 0;
        int index = 0;
        while (index < text.length() && (text.charAt(index) == '-' || text.charAt(index) == '+')) {
            if (text.charAt(index) == '-') {
                minus++;
            }
            index++;
        }
        BigDecimal number = new BigDecimal(text.substring(index));
        return minus % 2 == 1 ? number.negate() : number;
    }

    public static String add(String value, String amount) {
        return CanonicalNumbers.format(toNumber(value).add(toNumber(amount)));
    }
}
