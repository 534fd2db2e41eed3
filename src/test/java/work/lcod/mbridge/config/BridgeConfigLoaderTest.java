package work.lcod.mbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.mbridge.api.BridgeConfiguration;
import work.lcod.mbridge.api.DebugLevel;
import work.lcod.mbridge.api.EngineKind;
import work.lcod.mbridge.api.Mode;

class BridgeConfigLoaderTest {
    @Test
    void readsEveryTable() throws Exception {
        Path file = Path.of(BridgeConfigLoaderTest.class.getResource("bridge.toml").toURI());

        BridgeConfiguration config = BridgeConfigLoader.load(file);

        assertEquals(Mode.STRICT, config.mode());
        assertEquals(DebugLevel.MEDIUM, config.debugLevel());
        assertEquals(3, config.workers());
        assertTrue(config.autoRelink());
        assertEquals(Optional.of(Duration.ofMillis(2500)), config.lockTimeout());
        assertEquals(EngineKind.NATIVE, config.engine());
        assertEquals("gtmshr", config.libraryName());
        assertEquals("gtm", config.functionPrefix());
        assertEquals(Optional.of("/opt/app/mbridge.ci"), config.callInTable());
        assertFalse(config.utf8());
        assertEquals(4096, config.errorCapacity());
        assertEquals(65536, config.resultCapacity());
        assertEquals(BridgeConfiguration.DEFAULT_INPUT_CAPACITY, config.inputCapacity());
        assertEquals(512, config.indirectionLimit());
    }

    @Test
    void missingKeysKeepTheBase() {
        BridgeConfiguration base = BridgeConfiguration.builder().workers(7).build();
        BridgeConfiguration config = BridgeConfigLoader.parse("[bridge]\ndebug = 2\n", "inline", base);
        assertEquals(DebugLevel.MEDIUM, config.debugLevel());
        assertEquals(7, config.workers());
        assertEquals(Mode.CANONICAL, config.mode());
    }

    @Test
    void syntaxErrorsNameTheSource() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> BridgeConfigLoader.parse("[bridge\nmode = ", "inline.toml", BridgeConfiguration.defaults()));
        assertTrue(ex.getMessage().startsWith("Invalid configuration\ninline.toml:1:"), ex.getMessage());
    }

    @Test
    void rejectsBadValues() {
        BridgeConfiguration base = BridgeConfiguration.defaults();
        assertThrows(IllegalArgumentException.class, () -> BridgeConfigLoader.parse("[bridge]\nworkers = \"three\"\n", "inline", base));
        assertThrows(IllegalArgumentException.class, () -> BridgeConfigLoader.parse("[engine]\ncharset = \"latin1\"\n", "inline", base));
        assertThrows(IllegalArgumentException.class, () -> BridgeConfigLoader.parse("[engine]\nprefix = \"xyz\"\n", "inline", base));
        assertThrows(IllegalArgumentException.class, () -> BridgeConfigLoader.parse("[bridge]\nmode = \"loose\"\n", "inline", base));
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> BridgeConfigLoader.load(dir.resolve("absent.toml")));
    }
}
