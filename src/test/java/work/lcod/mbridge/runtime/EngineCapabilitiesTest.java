package work.lcod.mbridge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EngineCapabilitiesTest {
    @Test
    void reverseQueryNeedsRecentYottaDb() {
        assertTrue(EngineCapabilities.fromVersion("YottaDB Version: 1.30").reverseQuery());
        assertTrue(EngineCapabilities.fromVersion("YottaDB Version: 1.10").reverseQuery());
        assertTrue(EngineCapabilities.fromVersion("YottaDB Version: 2.00").reverseQuery());
        assertFalse(EngineCapabilities.fromVersion("YottaDB Version: 1.08").reverseQuery());
        assertFalse(EngineCapabilities.fromVersion("GT.M Version: 6.3-008").reverseQuery());
    }

    @Test
    void readsProductAndRelease() {
        var capabilities = EngineCapabilities.fromVersion("GT.M Version: 6.3-008");
        assertEquals("GT.M", capabilities.product());
        assertEquals("6.3-008", capabilities.release());
    }

    @Test
    void unrecognisedTextHasNoCapabilities() {
        var capabilities = EngineCapabilities.fromVersion("something else");
        assertEquals("unknown", capabilities.product());
        assertFalse(capabilities.reverseQuery());
        assertFalse(EngineCapabilities.fromVersion(null).reverseQuery());
    }
}
