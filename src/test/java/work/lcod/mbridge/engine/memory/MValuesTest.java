package work.lcod.mbridge.engine.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class MValuesTest {
    @Test
    void evaluatesStringLiterals() {
        assertEquals("a\"b", MValues.evaluateLiteral("\"a\"\"b\""));
        assertEquals("", MValues.evaluateLiteral("\"\""));
        assertEquals("007", MValues.evaluateLiteral("\"007\""));
    }

    @Test
    void evaluatesNumericLiteralsToCanonicalForm() {
        assertEquals(".5", MValues.evaluateLiteral("0.50"));
        assertEquals("100", MValues.evaluateLiteral("1E2"));
        assertEquals("-.25", MValues.evaluateLiteral("-.25"));
        assertEquals("0", MValues.evaluateLiteral("-0"));
    }

    @Test
    void rejectsOtherExpressions() {
        var fault = assertThrows(EngineFault.class, () -> MValues.evaluateLiteral("abc"));
        assertEquals(EngineFault.INVALID_EXPRESSION, fault.code());
    }

    @Test
    void numericInterpretationUsesLeadingDigits() {
        assertEquals(0, new BigDecimal("12").compareTo(MValues.toNumber("12abc")));
        assertEquals(0, new BigDecimal("3").compareTo(MValues.toNumber("--3")));
        assertEquals(0, BigDecimal.ZERO.compareTo(MValues.toNumber("abc")));
        assertEquals(0, new BigDecimal("-1.5").compareTo(MValues.toNumber("-1.5x")));
    }

    @Test
    void addsInCanonicalForm() {
        assertEquals("3.5", MValues.add("1.5", "2"));
        assertEquals("1", MValues.add(".5", ".5"));
        assertEquals("5", MValues.add("", "5"));
    }
}
