package work.lcod.mbridge.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.mbridge.api.BridgeConfiguration;
import work.lcod.mbridge.api.DebugLevel;
import work.lcod.mbridge.api.EngineKind;
import work.lcod.mbridge.api.Mode;
import work.lcod.mbridge.shared.TimeoutParser;

/**
 * Reads a {@link BridgeConfiguration} from a TOML file:
 *
 * <pre>
 * [bridge]
 * mode = "canonical"        # or "strict"
 * debug = "off"             # off | low | medium | high
 * workers = 4
 * autoRelink = false
 * lockTimeout = "30s"       # "-1" waits forever
 *
 * [engine]
 * kind = "native"           # or "memory"
 * library = "yottadb"
 * prefix = "ydb"            # or "gtm"
 * callInTable = "/opt/app/mbridge.ci"
 * charset = "utf-8"         # or "m"
 *
 * [buffers]
 * error = 2048
 * result = 1048576
 * input = 1048576
 * indirection = 8192
 * </pre>
 *
 * Missing keys keep the values of the base configuration; unknown keys are ignored.
 */
public final class BridgeConfigLoader {
    private BridgeConfigLoader() {}

    public static BridgeConfiguration load(Path file) {
        return load(file, BridgeConfiguration.defaults());
    }

    public static BridgeConfiguration load(Path file, BridgeConfiguration base) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read configuration " + file, ex);
        }
        return parse(content, file.toString(), base);
    }

    public static BridgeConfiguration parse(String content, String source, BridgeConfiguration base) {
        TomlParseResult result = Toml.parse(content);
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(error -> source + ":" + error.position().line() + ":" + error.position().column() + ": " + error.getMessage())
                .collect(Collectors.joining("\n"));
            throw new IllegalArgumentException("Invalid configuration\n" + errors);
        }
        try {
            return fromToml(result, base.toBuilder()).build();
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException(source + ": " + ex.getMessage(), ex);
        }
    }

    static BridgeConfiguration.Builder fromToml(TomlParseResult result, BridgeConfiguration.Builder builder) {
        TomlTable bridge = result.getTable("bridge");
        if (bridge != null) {
            string(bridge, "mode").map(Mode::from).ifPresent(builder::mode);
            string(bridge, "debug").map(DebugLevel::from).ifPresent(builder::debugLevel);
            integer(bridge, "workers").ifPresent(builder::workers);
            Optional.ofNullable(bridge.getBoolean("autoRelink")).ifPresent(builder::autoRelink);
            string(bridge, "lockTimeout").ifPresent(raw -> builder.lockTimeout(TimeoutParser.parse(raw)));
        }
        TomlTable engine = result.getTable("engine");
        if (engine != null) {
            string(engine, "kind").map(EngineKind::from).ifPresent(builder::engine);
            string(engine, "library").ifPresent(builder::libraryName);
            string(engine, "prefix").map(prefix -> prefix.toLowerCase(Locale.ROOT)).ifPresent(builder::functionPrefix);
            string(engine, "callInTable").ifPresent(table -> builder.callInTable(Optional.of(table)));
            string(engine, "charset").ifPresent(charset -> builder.utf8(isUtf8(charset)));
        }
        TomlTable buffers = result.getTable("buffers");
        if (buffers != null) {
            integer(buffers, "error").ifPresent(builder::errorCapacity);
            integer(buffers, "result").ifPresent(builder::resultCapacity);
            integer(buffers, "input").ifPresent(builder::inputCapacity);
            integer(buffers, "indirection").ifPresent(builder::indirectionLimit);
        }
        return builder;
    }

    private static Optional<String> string(TomlTable table, String key) {
        Object value = table.get(key);
        if (value == null) {
            return Optional.empty();
        }
        // numbers are read as text too (debug = 2)
        return Optional.of(value.toString());
    }

    private static Optional<Integer> integer(TomlTable table, String key) {
        Long value = table.getLong(key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(Math.toIntExact(value));
    }

    private static boolean isUtf8(String charset) {
        String normalised = charset.trim().toLowerCase(Locale.ROOT);
        if (normalised.equals("utf-8") || normalised.equals("utf8")) {
            return true;
        }
        if (normalised.equals("m")) {
            return false;
        }
        throw new IllegalArgumentException("Unsupported charset: " + charset);
    }
}
