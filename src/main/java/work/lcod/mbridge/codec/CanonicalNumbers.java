package work.lcod.mbridge.codec;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Engine canonical numeric form: no leading zeros, no trailing fractional zeros, no exponent,
 * no {@code -0}, and a bare {@code .5} instead of {@code 0.5}.
 */
public final class CanonicalNumbers {
    private static final Pattern CANONICAL = Pattern.compile("0|-?[1-9][0-9]*(\\.[0-9]*[1-9])?|-?\\.[0-9]*[1-9]");
    private static final Pattern LEADING_ZERO_FRACTION = Pattern.compile("-?0\\.[0-9]+");

    private CanonicalNumbers() {}

    public static boolean isCanonical(String token) {
        return token != null && CANONICAL.matcher(token).matches();
    }

    /**
     * Host spelling of a fraction below one, {@code 0.5} or {@code -0.25}.
     */
    public static boolean isLeadingZeroFraction(String token) {
        return token != null && LEADING_ZERO_FRACTION.matcher(token).matches();
    }

    /**
     * Renders a decimal in canonical form.
     */
    public static String format(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        String plain = value.stripTrailingZeros().toPlainString();
        if (plain.startsWith("0.")) {
            return plain.substring(1);
        }
        if (plain.startsWith("-0.")) {
            return "-" + plain.substring(2);
        }
        return plain;
    }
}
