package work.lcod.mbridge.runtime;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import work.lcod.mbridge.api.BridgeConfiguration;
import work.lcod.mbridge.api.BridgeException;
import work.lcod.mbridge.api.Mode;
import work.lcod.mbridge.codec.CallArgument;
import work.lcod.mbridge.codec.HostTokens;
import work.lcod.mbridge.codec.NameRules;
import work.lcod.mbridge.codec.Reference;
import work.lcod.mbridge.codec.ReferenceBuilder;
import work.lcod.mbridge.codec.ValueCodec;
import work.lcod.mbridge.runtime.CallArguments.Target;
import work.lcod.mbridge.shared.TimeoutParser;

/**
 * Handlers for every engine operation: encode the caller's arguments into engine references,
 * and shape the engine's raw reply into the result object for the call's mode.
 */
public final class EngineOperations {
    public static final String VERSION_SOURCE = "source";
    public static final String RELEASE_SOURCE = "release";
    public static final String ZVERSION_SOURCE = "zversion";

    private final BridgeConfiguration config;
    private final Supplier<EngineCapabilities> capabilities;
    private final DebugTrace trace;
    private final ReferenceBuilder references;

    public EngineOperations(BridgeConfiguration config, Supplier<EngineCapabilities> capabilities, DebugTrace trace) {
        this.config = config;
        this.capabilities = capabilities;
        this.trace = trace;
        this.references = new ReferenceBuilder(config.indirectionLimit());
    }

    public OperationTable register(OperationTable table) {
        table.register(Operation.DATA, this::data);
        table.register(Operation.GET, this::get);
        table.register(Operation.SET, this::set);
        table.register(Operation.KILL, this::kill);
        table.register(Operation.ORDER, (args, mode, async) -> order(Operation.ORDER, args, mode, async));
        table.register(Operation.PREVIOUS, (args, mode, async) -> order(Operation.PREVIOUS, args, mode, async));
        table.register(Operation.NEXT_NODE, (args, mode, async) -> node(Operation.NEXT_NODE, args, mode, async));
        table.register(Operation.PREVIOUS_NODE, this::previousNode);
        table.register(Operation.LOCK, this::lock);
        table.register(Operation.UNLOCK, this::unlock);
        table.register(Operation.MERGE, this::merge);
        table.register(Operation.INCREMENT, this::increment);
        table.register(Operation.FUNCTION, this::function);
        table.register(Operation.PROCEDURE, this::procedure);
        table.register(Operation.GLOBAL_DIRECTORY, (args, mode, async) -> directory(Operation.GLOBAL_DIRECTORY, args, mode, async));
        table.register(Operation.LOCAL_DIRECTORY, (args, mode, async) -> directory(Operation.LOCAL_DIRECTORY, args, mode, async));
        table.register(Operation.VERSION, this::version);
        table.register(Operation.DEBUG, this::debug);
        return table;
    }

    private PreparedCall data(Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        return PreparedCall.of(descriptor(Operation.DATA, mode, async, reference.literal(), reference.packedSpill()), raw -> {
            Map<String, Object> reply = new ReplyJson().integer("defined", first(raw)).toMap();
            return mode == Mode.STRICT ? annotate(target, subscripts, reply) : reply;
        });
    }

    private PreparedCall get(Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        return PreparedCall.of(descriptor(Operation.GET, mode, async, reference.literal(), reference.packedSpill()), raw -> {
            expect(Operation.GET, raw, 2);
            Map<String, Object> reply = new ReplyJson()
                .integer("defined", raw.get(0))
                .literal("data", decode(raw.get(1), mode))
                .toMap();
            return mode == Mode.STRICT ? annotate(target, subscripts, reply) : reply;
        });
    }

    private PreparedCall set(Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        Object data = args.get("data");
        String value = data == null ? "" : ValueCodec.encodeInput(HostTokens.fromHost(data), mode, true);
        trace.internal("set data {} -> {}", data, value);
        return PreparedCall.of(descriptor(Operation.SET, mode, async, reference.literal(), reference.packedSpill(), value), raw -> {
            if (mode != Mode.STRICT) {
                return new LinkedHashMap<>();
            }
            Map<String, Object> result = annotate(target, subscripts, Map.of());
            result.put("data", data == null ? "" : data);
            result.put("result", 0);
            return result;
        });
    }

    private PreparedCall kill(Map<String, Object> args, Mode mode, boolean async) {
        boolean nodeOnly = CallArguments.flag(args, "nodeOnly", false);
        if (!CallArguments.hasTarget(args)) {
            return PreparedCall.of(descriptor(Operation.KILL, mode, async, "", "", "0"), raw -> strictVoid(mode, null, List.of()));
        }
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        return PreparedCall.of(
            descriptor(Operation.KILL, mode, async, reference.literal(), reference.packedSpill(), nodeOnly ? "1" : "0"),
            raw -> strictVoid(mode, target, subscripts));
    }

    private PreparedCall order(Operation operation, Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        return PreparedCall.of(descriptor(operation, mode, async, reference.literal(), reference.packedSpill()), raw -> {
            Map<String, Object> reply = new ReplyJson().literal("result", decode(first(raw), mode)).toMap();
            if (mode != Mode.STRICT) {
                return reply;
            }
            Object next = reply.get("result");
            List<Object> advanced = new ArrayList<>(subscripts);
            if (!advanced.isEmpty()) {
                advanced.set(advanced.size() - 1, next);
            }
            return annotate(target, advanced, reply);
        });
    }

    private PreparedCall previousNode(Map<String, Object> args, Mode mode, boolean async) {
        if (!capabilities.get().reverseQuery()) {
            CallArguments.target(args);
            trace.downgrade("previousNode is not supported by {}, returning a not-implemented result",
                capabilities.get().versionText());
            var result = new LinkedHashMap<String, Object>();
            result.put("ok", mode == Mode.STRICT ? (Object) 0 : (Object) false);
            result.put("status", "previous_node not yet implemented");
            return PreparedCall.immediate(result);
        }
        return node(Operation.PREVIOUS_NODE, args, mode, async);
    }

    private PreparedCall node(Operation operation, Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        return PreparedCall.of(descriptor(operation, mode, async, reference.literal(), reference.packedSpill()), raw -> {
            var json = new ReplyJson();
            if (raw.isEmpty()) {
                json.literal("defined", "0");
            } else {
                var found = new ArrayList<String>(raw.size() - 1);
                for (String subscript : raw.subList(1, raw.size())) {
                    found.add(decode(subscript, mode));
                }
                json.array("subscripts", found).literal("defined", "1").literal("data", decode(raw.get(0), mode));
            }
            Map<String, Object> reply = json.toMap();
            if (mode != Mode.STRICT) {
                return reply;
            }
            var result = new LinkedHashMap<String, Object>();
            result.put("ok", 1);
            result.put(target.kind(), target.displayName());
            result.putAll(reply);
            return result;
        });
    }

    private PreparedCall lock(Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        String timeout = TimeoutParser.toEngineSeconds(timeout(args));
        return PreparedCall.of(descriptor(Operation.LOCK, mode, async, reference.literal(), reference.packedSpill(), timeout), raw -> {
            Map<String, Object> reply = new ReplyJson().integer("result", first(raw)).toMap();
            return mode == Mode.STRICT ? annotate(target, subscripts, reply) : reply;
        });
    }

    private PreparedCall unlock(Map<String, Object> args, Mode mode, boolean async) {
        if (!CallArguments.hasTarget(args)) {
            return PreparedCall.of(descriptor(Operation.UNLOCK, mode, async, "", ""), raw -> strictVoid(mode, null, List.of()));
        }
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        return PreparedCall.of(descriptor(Operation.UNLOCK, mode, async, reference.literal(), reference.packedSpill()),
            raw -> strictVoid(mode, target, subscripts));
    }

    private PreparedCall merge(Map<String, Object> args, Mode mode, boolean async) {
        Map<String, Object> from = CallArguments.object(args, "from");
        Map<String, Object> to = CallArguments.object(args, "to");
        Target fromTarget = CallArguments.target(from);
        Target toTarget = CallArguments.target(to);
        List<Object> fromSubscripts = CallArguments.list(from, "subscripts");
        List<Object> toSubscripts = CallArguments.list(to, "subscripts");
        Reference fromReference = nodeReference(fromTarget, fromSubscripts, mode);
        Reference toReference = nodeReference(toTarget, toSubscripts, mode);
        CallDescriptor call = descriptor(Operation.MERGE, mode, async,
            toReference.literal(), toReference.packedSpill(), fromReference.literal(), fromReference.packedSpill());
        return PreparedCall.of(call, raw -> {
            if (mode != Mode.STRICT) {
                return new LinkedHashMap<>();
            }
            var result = new LinkedHashMap<String, Object>();
            result.put("ok", 1);
            result.put("from", annotateSide(fromTarget, fromSubscripts));
            result.put("to", annotateSide(toTarget, toSubscripts));
            result.put("result", 0);
            return result;
        });
    }

    private PreparedCall increment(Map<String, Object> args, Mode mode, boolean async) {
        Target target = CallArguments.target(args);
        List<Object> subscripts = CallArguments.list(args, "subscripts");
        Reference reference = nodeReference(target, subscripts, mode);
        Object amount = args.getOrDefault("increment", 1);
        String token = ValueCodec.encodeInput(HostTokens.fromHost(amount), Mode.CANONICAL, false);
        return PreparedCall.of(descriptor(Operation.INCREMENT, mode, async, reference.literal(), reference.packedSpill(), token), raw -> {
            Map<String, Object> reply = new ReplyJson().literal("data", decode(first(raw), mode)).toMap();
            return mode == Mode.STRICT ? annotate(target, subscripts, reply) : reply;
        });
    }

    private PreparedCall function(Map<String, Object> args, Mode mode, boolean async) {
        String name = CallArguments.string(args, "function", null);
        NameRules.requireRoutineName(name, "function");
        List<Object> arguments = CallArguments.list(args, "arguments");
        Reference reference = callReference(name, arguments, mode);
        boolean relink = CallArguments.flag(args, "autoRelink", config.autoRelink());
        return PreparedCall.of(descriptor(Operation.FUNCTION, mode, async, reference.literal(), reference.packedSpill(), relink ? "1" : "0"), raw -> {
            Map<String, Object> reply = new ReplyJson().literal("result", decode(first(raw), mode)).toMap();
            if (mode != Mode.STRICT) {
                return reply;
            }
            var result = new LinkedHashMap<String, Object>();
            result.put("ok", 1);
            result.put("function", name);
            if (!arguments.isEmpty()) {
                result.put("arguments", arguments);
            }
            result.putAll(reply);
            return result;
        });
    }

    private PreparedCall procedure(Map<String, Object> args, Mode mode, boolean async) {
        String name = CallArguments.string(args, "procedure", CallArguments.string(args, "routine", null));
        NameRules.requireRoutineName(name, "procedure");
        List<Object> arguments = CallArguments.list(args, "arguments");
        Reference reference = callReference(name, arguments, mode);
        boolean relink = CallArguments.flag(args, "autoRelink", config.autoRelink());
        return PreparedCall.of(descriptor(Operation.PROCEDURE, mode, async, reference.literal(), reference.packedSpill(), relink ? "1" : "0"), raw -> {
            var result = new LinkedHashMap<String, Object>();
            if (mode != Mode.STRICT) {
                return result;
            }
            result.put("ok", 1);
            result.put("procedure", name);
            if (!arguments.isEmpty()) {
                result.put("arguments", arguments);
            }
            result.put("result", 0);
            return result;
        });
    }

    private PreparedCall directory(Operation operation, Map<String, Object> args, Mode mode, boolean async) {
        int max = CallArguments.integer(args, "max", 0);
        String lo = CallArguments.string(args, "lo", "");
        String hi = CallArguments.string(args, "hi", "");
        return PreparedCall.of(descriptor(operation, mode, async, Integer.toString(Math.max(0, max)), lo, hi), raw -> {
            var names = new ArrayList<String>(raw.size());
            for (String name : raw) {
                names.add(ValueCodec.decodeOutput(name, Mode.STRICT));
            }
            Map<String, Object> reply = new ReplyJson().array("result", names).toMap();
            if (mode != Mode.STRICT) {
                return reply;
            }
            var result = new LinkedHashMap<String, Object>();
            result.put("ok", 1);
            result.putAll(reply);
            return result;
        });
    }

    private PreparedCall version(Map<String, Object> args, Mode mode, boolean async) {
        String source = CallArguments.string(args, VERSION_SOURCE, RELEASE_SOURCE);
        return PreparedCall.of(descriptor(Operation.VERSION, mode, async, source), raw -> {
            var result = new LinkedHashMap<String, Object>();
            result.put("version", first(raw));
            return result;
        });
    }

    private PreparedCall debug(Map<String, Object> args, Mode mode, boolean async) {
        int level = CallArguments.integer(args, "level", trace.level().ordinal());
        return PreparedCall.of(descriptor(Operation.DEBUG, mode, async, Integer.toString(level)), raw -> new LinkedHashMap<>());
    }

    private Reference nodeReference(Target target, List<Object> subscripts, Mode mode) {
        NameRules.requireSubscriptCount(subscripts.size());
        Reference reference = references.build(target.wireName(), encodeTokens(subscripts, mode));
        if (reference.isSpilled()) {
            trace.detail("{} spilled {} tokens to {}", target.wireName(), reference.spilled().size(), Reference.TEMP_ARRAY);
        }
        return reference;
    }

    private Reference callReference(String name, List<Object> arguments, Mode mode) {
        var tokens = new ArrayList<String>(arguments.size());
        boolean variables = false;
        for (int i = 0; i < arguments.size(); i++) {
            CallArgument argument = CallArgument.from(arguments.get(i), i);
            if (argument.engineReady()) {
                variables = true;
                tokens.add(argument.token());
            } else {
                String encoded = ValueCodec.encodeInput(argument.token(), mode, false);
                trace.internal("encode {} -> {}", argument.token(), encoded);
                tokens.add(encoded);
            }
        }
        Reference reference = references.build(name, tokens);
        // temp slots hold values, so names cannot be spilled
        if (variables && reference.isSpilled()) {
            throw BridgeException.encoding("Call to " + name + " exceeds the indirection limit of "
                + references.indirectionLimit() + " and passes local variables, which cannot be spilled");
        }
        return reference;
    }

    private List<String> encodeTokens(List<Object> values, Mode mode) {
        List<String> hostTokens = HostTokens.fromHostList(values);
        var engineTokens = new ArrayList<String>(hostTokens.size());
        for (String token : hostTokens) {
            String encoded = ValueCodec.encodeInput(token, mode, false);
            trace.internal("encode {} -> {}", token, encoded);
            engineTokens.add(encoded);
        }
        return engineTokens;
    }

    private String decode(String raw, Mode mode) {
        String decoded = ValueCodec.decodeOutput(raw, mode);
        trace.internal("decode {} -> {}", raw, decoded);
        return decoded;
    }

    private CallDescriptor descriptor(Operation operation, Mode mode, boolean async, Object... arguments) {
        long size = 0;
        for (Object argument : arguments) {
            size += argument.toString().getBytes(StandardCharsets.UTF_8).length;
        }
        if (size > config.inputCapacity()) {
            throw BridgeException.encoding(operation.routine() + " arguments take " + size
                + " bytes, more than the input capacity of " + config.inputCapacity());
        }
        return new CallDescriptor(operation, List.of(arguments), mode, async, config.resultCapacity(), config.errorCapacity());
    }

    private Optional<Duration> timeout(Map<String, Object> args) {
        Object value = args.get("timeout");
        if (value == null) {
            return config.lockTimeout();
        }
        try {
            if (value instanceof Number number) {
                if (number.doubleValue() < 0) {
                    return Optional.empty();
                }
                return TimeoutParser.parse(HostTokens.numberLiteral(number));
            }
            return TimeoutParser.parse(value.toString());
        } catch (IllegalArgumentException ex) {
            throw BridgeException.encoding(ex.getMessage());
        }
    }

    private static Map<String, Object> strictVoid(Mode mode, Target target, List<Object> subscripts) {
        if (mode != Mode.STRICT) {
            return new LinkedHashMap<>();
        }
        var result = target == null ? new LinkedHashMap<String, Object>(Map.of("ok", 1)) : annotate(target, subscripts, Map.of());
        result.put("result", 0);
        return result;
    }

    private static LinkedHashMap<String, Object> annotate(Target target, List<Object> subscripts, Map<String, Object> reply) {
        var result = new LinkedHashMap<String, Object>();
        result.put("ok", 1);
        result.putAll(annotateSide(target, subscripts));
        result.putAll(reply);
        return result;
    }

    private static Map<String, Object> annotateSide(Target target, List<Object> subscripts) {
        var side = new LinkedHashMap<String, Object>();
        side.put(target.kind(), target.displayName());
        if (!subscripts.isEmpty()) {
            side.put("subscripts", subscripts);
        }
        return side;
    }

    private static String first(List<String> raw) {
        if (raw.isEmpty()) {
            throw BridgeException.encoding("Engine reply is empty");
        }
        return raw.get(0);
    }

    private static void expect(Operation operation, List<String> raw, int count) {
        if (raw.size() < count) {
            throw BridgeException.encoding(operation.routine() + " reply has " + raw.size() + " values, expected " + count);
        }
    }
}
