package work.lcod.mbridge.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeException;

class HostTokensTest {
    @Test
    void numbersTravelBare() {
        assertEquals("42", HostTokens.fromHost(42));
        assertEquals("-7", HostTokens.fromHost(-7L));
        assertEquals("0.5", HostTokens.fromHost(0.5));
        assertEquals("3", HostTokens.fromHost(3.0));
        assertEquals("-0.25", HostTokens.fromHost(-0.25));
        assertEquals("123456789.125", HostTokens.fromHost(123456789.125));
        assertEquals("1.5", HostTokens.fromHost(new BigDecimal("1.50")));
    }

    @Test
    void extremeMagnitudesUseExponentForm() {
        assertEquals("1e+21", HostTokens.fromHost(1e21));
        assertEquals("1.5e-7", HostTokens.fromHost(1.5e-7));
    }

    @Test
    void everythingElseIsQuoted() {
        assertEquals("\"abc\"", HostTokens.fromHost("abc"));
        assertEquals("\"\"", HostTokens.fromHost(""));
        assertEquals("\"true\"", HostTokens.fromHost(true));
        assertEquals("\"42\"", HostTokens.fromHost("42"));
    }

    @Test
    void convertsLists() {
        assertEquals(List.of("1", "\"a\""), HostTokens.fromHostList(List.of(1, "a")));
        assertEquals(List.of(), HostTokens.fromHostList(null));
    }

    @Test
    void rejectsNullsAndStructures() {
        assertThrows(BridgeException.class, () -> HostTokens.fromHost(null));
        assertThrows(BridgeException.class, () -> HostTokens.fromHostList(Arrays.asList("a", null)));
        assertThrows(BridgeException.class, () -> HostTokens.fromHost(Map.of("a", 1)));
        assertThrows(BridgeException.class, () -> HostTokens.fromHost(Double.NaN));
    }
}
