package work.lcod.mbridge.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeException;

class NameRulesTest {
    @Test
    void globalsGetTheirMarker() {
        assertEquals("^people", NameRules.globalName("people"));
        assertEquals("^people", NameRules.globalName("^people"));
        assertEquals("people", NameRules.localize("^people"));
    }

    @Test
    void localsLoseTheMarker() {
        assertEquals("x", NameRules.localName("x"));
        assertEquals("x", NameRules.localName("^x"));
    }

    @Test
    void internalLocalsAreReserved() {
        assertThrows(BridgeException.class, () -> NameRules.localName("v4wTempArgs"));
    }

    @Test
    void rejectsMalformedNames() {
        assertThrows(BridgeException.class, () -> NameRules.globalName(""));
        assertThrows(BridgeException.class, () -> NameRules.globalName("^"));
        assertThrows(BridgeException.class, () -> NameRules.globalName("a(1)"));
        assertThrows(BridgeException.class, () -> NameRules.requireRoutineName(null, "function"));
    }

    @Test
    void limitsSubscriptCount() {
        NameRules.requireSubscriptCount(NameRules.MAX_SUBSCRIPTS);
        assertThrows(BridgeException.class, () -> NameRules.requireSubscriptCount(NameRules.MAX_SUBSCRIPTS + 1));
    }
}
