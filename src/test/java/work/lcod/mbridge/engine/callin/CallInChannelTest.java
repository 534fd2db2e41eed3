package work.lcod.mbridge.engine.callin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.mbridge.api.BridgeConfiguration;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.EngineKind;
import work.lcod.mbridge.api.ErrorKind;
import work.lcod.mbridge.runtime.CallBuffer;

class CallInChannelTest {
    private static final BridgeConfiguration MISSING = BridgeConfiguration.builder()
        .engine(EngineKind.NATIVE)
        .libraryName("mbridge-no-such-engine")
        .build();

    @Test
    void mapsMethodsToPrefixedSymbols() {
        assertEquals("ydb_ci", CallInLibrary.symbol("ydb", "ci"));
        assertEquals("ydb_ci_tab_open", CallInLibrary.symbol("ydb", "ciTabOpen"));
        assertEquals("gtm_ci_tab_switch", CallInLibrary.symbol("gtm", "ciTabSwitch"));
        assertEquals("gtm_zstatus", CallInLibrary.symbol("gtm", "zstatus"));
    }

    @Test
    void missingLibraryIsAResourceError() {
        var channel = new CallInChannel(MISSING);
        var ex = assertThrows(BridgeException.class, channel::open);
        assertEquals(ErrorKind.RESOURCE, ex.kind());
        assertTrue(ex.getMessage().contains("mbridge-no-such-engine"));
    }

    @Test
    void callsNeedAnOpenChannel() {
        var channel = new CallInChannel(MISSING);
        var ex = assertThrows(BridgeException.class, () -> channel.call("data", new CallBuffer("result", 16), "x", ""));
        assertEquals(ErrorKind.RESOURCE, ex.kind());
        channel.close();
        assertEquals("mbridge-no-such-engine (ydb call-in)", channel.describe());
    }
}
