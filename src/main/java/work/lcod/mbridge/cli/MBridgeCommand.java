package work.lcod.mbridge.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.mbridge.api.BridgeConfiguration;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.DebugLevel;
import work.lcod.mbridge.api.EngineKind;
import work.lcod.mbridge.api.HelpCatalog;
import work.lcod.mbridge.api.MBridge;
import work.lcod.mbridge.api.Mode;
import work.lcod.mbridge.config.BridgeConfigLoader;
import work.lcod.mbridge.runtime.Operation;
import work.lcod.mbridge.shared.TimeoutParser;

@CommandLine.Command(
    name = "mbridge",
    description = "Run operations against an M database engine and print their JSON results.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MBridgeCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String HELP = "help";
    private static final String VERSION = "version";

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "OPERATION",
        description = "Operation name (get, set, order, next-node, ...), 'version' or 'help'."
    )
    private String operation;

    @CommandLine.Parameters(
        index = "1",
        arity = "0..1",
        paramLabel = "JSON|PATH|-",
        description = "Argument object as inline JSON, a JSON file, or '-' for stdin (default: {}). For 'help', the topic."
    )
    private String arguments;

    @CommandLine.Option(
        names = {"-s", "--script"},
        paramLabel = "PATH|-",
        description = "JSON Lines file of {\"operation\": ..., \"args\": {...}} requests run on one connection.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String script;

    @CommandLine.Option(
        names = "--config",
        description = "TOML configuration file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--engine",
        description = "Engine channel (memory|native).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String engineRaw;

    @CommandLine.Option(
        names = "--library",
        description = "Native engine library name.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String library;

    @CommandLine.Option(
        names = "--prefix",
        description = "Call-in function prefix (ydb|gtm).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String prefix;

    @CommandLine.Option(
        names = {"-m", "--mode"},
        description = "Data mode (canonical|strict).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String modeRaw;

    @CommandLine.Option(
        names = {"-d", "--debug"},
        description = "Trace level (off|low|medium|high or 0-3).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String debugRaw;

    @CommandLine.Option(
        names = "--lock-timeout",
        description = "Default lock wait (e.g. 5, 250ms, 2m, -1 for forever).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String lockTimeoutRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        if (operation == null && script == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Give an OPERATION or --script.");
        }
        if (HELP.equals(operation)) {
            out.println(HelpCatalog.load().text(arguments));
            return 0;
        }

        MBridge bridge = MBridge.create(resolveConfiguration());
        try {
            bridge.open();
            if (script != null) {
                return runScript(bridge, out);
            }
            if (VERSION.equals(operation)) {
                out.println(bridge.version());
                return 0;
            }
            return runOne(bridge, operation, loadArguments(arguments), out) ? 0 : 1;
        } finally {
            bridge.close();
        }
    }

    private int runScript(MBridge bridge, PrintWriter out) throws IOException {
        int exitCode = 0;
        try (BufferedReader reader = new BufferedReader(openScript())) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.trim().startsWith("#")) {
                    continue;
                }
                Map<String, Object> request;
                try {
                    request = JSON.readValue(line, MAP_TYPE);
                } catch (JsonProcessingException ex) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                        "Invalid request on line " + lineNumber + ": " + ex.getOriginalMessage());
                }
                Object name = request.get("operation");
                if (name == null) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "Missing operation on line " + lineNumber);
                }
                Object args = request.getOrDefault("args", Map.of());
                if (!(args instanceof Map<?, ?>)) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "args must be an object on line " + lineNumber);
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> argumentMap = (Map<String, Object>) args;
                if (!runOne(bridge, name.toString(), argumentMap, out)) {
                    exitCode = 1;
                }
            }
        }
        return exitCode;
    }

    private Reader openScript() throws IOException {
        if ("-".equals(script)) {
            return new InputStreamReader(System.in, StandardCharsets.UTF_8);
        }
        Path path = Paths.get(script).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Script not found: " + path);
        }
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    private boolean runOne(MBridge bridge, String name, Map<String, Object> args, PrintWriter out) throws IOException {
        Operation op;
        try {
            op = Operation.from(name);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
        Mode mode = bridge.configuration().mode();
        Map<String, Object> result;
        boolean ok = true;
        try {
            result = bridge.call(op, args, mode);
        } catch (BridgeException ex) {
            result = new LinkedHashMap<>(ex.toMap(mode));
            result.put("kind", ex.kind().name().toLowerCase(Locale.ROOT));
            ok = false;
        }
        out.println(JSON_WRITER.writeValueAsString(result));
        out.flush();
        return ok;
    }

    private Map<String, Object> loadArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        String content;
        String trimmed = raw.trim();
        if ("-".equals(trimmed)) {
            content = readStdin();
        } else if (trimmed.startsWith("{")) {
            content = trimmed;
        } else {
            Path path = Paths.get(trimmed).toAbsolutePath().normalize();
            try {
                content = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read arguments file: " + path);
            }
        }
        try {
            return JSON.readValue(content, MAP_TYPE);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON arguments: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            byte[] bytes = System.in.readAllBytes();
            return bytes.length == 0 ? "{}" : new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }

    BridgeConfiguration resolveConfiguration() {
        try {
            BridgeConfiguration base = config != null
                ? BridgeConfigLoader.load(config)
                : BridgeConfiguration.defaults();
            BridgeConfiguration.Builder builder = base.toBuilder();
            Optional.ofNullable(engineRaw).map(EngineKind::from).ifPresent(builder::engine);
            Optional.ofNullable(library).ifPresent(builder::libraryName);
            Optional.ofNullable(prefix).ifPresent(builder::functionPrefix);
            Optional.ofNullable(modeRaw).map(Mode::from).ifPresent(builder::mode);
            Optional.ofNullable(debugRaw).map(DebugLevel::from).ifPresent(builder::debugLevel);
            if (lockTimeoutRaw != null) {
                builder.lockTimeout(TimeoutParser.parse(lockTimeoutRaw));
            }
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
