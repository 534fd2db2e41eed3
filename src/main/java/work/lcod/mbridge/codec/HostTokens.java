package work.lcod.mbridge.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import work.lcod.mbridge.api.BridgeException;

/**
 * Turns host values (as found in JSON-shaped argument maps) into tokens: numbers travel bare,
 * everything else as a quoted string.
 */
public final class HostTokens {
    private static final double EXPONENT_THRESHOLD = 1e21;
    private static final double SMALL_THRESHOLD = 1e-6;

    private HostTokens() {}

    public static List<String> fromHostList(List<?> values) {
        if (values == null) {
            return List.of();
        }
        var tokens = new ArrayList<String>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value == null) {
                throw BridgeException.encoding("Null value at position " + i);
            }
            tokens.add(fromHost(value));
        }
        return tokens;
    }

    public static String fromHost(Object value) {
        if (value == null) {
            throw BridgeException.encoding("Null values cannot be encoded");
        }
        if (value instanceof Number number) {
            return numberLiteral(number);
        }
        if (value instanceof CharSequence || value instanceof Boolean || value instanceof Character) {
            return "\"" + value + "\"";
        }
        throw BridgeException.encoding("Unsupported value type: " + value.getClass().getName());
    }

    /**
     * Renders a number the way the host's own number-to-string conversion does, including the
     * lower-case {@code e+} exponent for very large magnitudes.
     */
    public static String numberLiteral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
            || number instanceof Byte || number instanceof BigInteger) {
            return number.toString();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw BridgeException.encoding("Cannot encode non-finite number " + number);
        }
        if (value == 0) {
            return "0";
        }
        double magnitude = Math.abs(value);
        if (magnitude >= EXPONENT_THRESHOLD || magnitude < SMALL_THRESHOLD) {
            return exponentLiteral(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String exponentLiteral(double value) {
        String text = Double.toString(value);
        int marker = text.indexOf('E');
        String mantissa = text.substring(0, marker);
        String exponent = text.substring(marker + 1);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        if (!exponent.startsWith("-")) {
            exponent = "+" + exponent;
        }
        return mantissa + "e" + exponent;
    }
}
