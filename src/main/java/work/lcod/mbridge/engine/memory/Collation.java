package work.lcod.mbridge.engine.memory;

import java.math.BigDecimal;
import java.util.Comparator;
import work.lcod.mbridge.codec.CanonicalNumbers;

/**
 * Subscript collation: canonical numbers first, in numeric order, then every other string in
 * code point order.
 */
public final class Collation implements Comparator<String> {
    public static final Collation INSTANCE = new Collation();

    private Collation() {}

    @Override
    public int compare(String left, String right) {
        boolean leftNumeric = CanonicalNumbers.isCanonical(left);
        boolean rightNumeric = CanonicalNumbers.isCanonical(right);
        if (leftNumeric && rightNumeric) {
            return new BigDecimal(left).compareTo(new BigDecimal(right));
        }
        if (leftNumeric) {
            return -1;
        }
        if (rightNumeric) {
            return 1;
        }
        return left.compareTo(right);
    }
}
