package work.lcod.mbridge.engine.memory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.function.Function;
import java.util.function.IntFunction;
import work.lcod.mbridge.api.DebugLevel;
import work.lcod.mbridge.codec.CanonicalNumbers;
import work.lcod.mbridge.codec.NameRules;
import work.lcod.mbridge.codec.Reference;
import work.lcod.mbridge.codec.SubscriptPacker;
import work.lcod.mbridge.engine.memory.Indirection.Resolved;

/**
 * Engine-side entry points called through the channel. Every entry point takes its arguments
 * as strings and answers with the raw values that are packed into the reply.
 */
final class IntegrationRoutine {
    static final String TEMP_ARRAY = Reference.TEMP_ARRAY;

    private final InMemoryEngine engine;
    private final Map<String, Function<List<String>, List<String>>> entryPoints = new HashMap<>();

    IntegrationRoutine(InMemoryEngine engine) {
        this.engine = engine;
        entryPoints.put("version", this::version);
        entryPoints.put("debug", this::debug);
        entryPoints.put("data", this::data);
        entryPoints.put("get", this::get);
        entryPoints.put("set", this::set);
        entryPoints.put("kill", this::kill);
        entryPoints.put("merge", this::merge);
        entryPoints.put("order", args -> order(args, true));
        entryPoints.put("previous", args -> order(args, false));
        entryPoints.put("nextNode", args -> node(args, true));
        entryPoints.put("previousNode", args -> node(args, false));
        entryPoints.put("increment", this::increment);
        entryPoints.put("lock", this::lock);
        entryPoints.put("unlock", this::unlock);
        entryPoints.put("function", args -> invoke(args, true));
        entryPoints.put("procedure", args -> invoke(args, false));
        entryPoints.put("globalDirectory", args -> directory(args, true));
        entryPoints.put("localDirectory", args -> directory(args, false));
    }

    List<String> invoke(String routine, List<String> args) {
        Function<List<String>, List<String>> entryPoint = entryPoints.get(routine);
        if (entryPoint == null) {
            throw new EngineFault(EngineFault.UNKNOWN_ROUTINE, "%YDB-E-CINOENTRY, No entry specified for " + routine + " in the call-in table");
        }
        return entryPoint.apply(args);
    }

    private List<String> version(List<String> args) {
        InMemoryDatabase database = engine.database();
        if ("zversion".equals(arg(args, 0))) {
            return List.of("GT.M Version: " + releaseNumber(database.zversion()));
        }
        if (database.release() == null) {
            throw new EngineFault(EngineFault.INVALID_SPECIAL_VARIABLE, "%YDB-E-INVSVN, Invalid special variable name");
        }
        return List.of("YottaDB Version: " + releaseNumber(database.release()));
    }

    private List<String> debug(List<String> args) {
        int level = Integer.parseInt(arg(args, 0));
        DebugLevel[] levels = DebugLevel.values();
        engine.setDebugLevel(levels[Math.max(0, Math.min(level, levels.length - 1))]);
        return List.of();
    }

    private List<String> data(List<String> args) {
        Resolved node = resolve(args, 0);
        int defined = engine.variables(node.name(), table -> {
            NodeTree root = table.get(node.name());
            return root == null ? 0 : root.data(node.values());
        });
        return List.of(Integer.toString(defined));
    }

    private List<String> get(List<String> args) {
        Resolved node = resolve(args, 0);
        String value = engine.value(node.name(), node.values());
        return value == null ? List.of("0", "") : List.of("1", value);
    }

    private List<String> set(List<String> args) {
        Resolved node = resolve(args, 0);
        requireSubscripts(node);
        engine.store(node.name(), node.values(), arg(args, 2));
        return List.of();
    }

    private List<String> kill(List<String> args) {
        if (arg(args, 0).isEmpty()) {
            engine.locals().keySet().removeIf(name -> !NameRules.isInternal(name));
            return List.of();
        }
        Resolved node = resolve(args, 0);
        boolean nodeOnly = "1".equals(arg(args, 2));
        engine.variables(node.name(), table -> {
            NodeTree root = table.get(node.name());
            if (root != null) {
                if (nodeOnly) {
                    root.killValue(node.values());
                } else {
                    root.kill(node.values());
                }
                if (root.isEmpty()) {
                    table.remove(node.name());
                }
            }
            return null;
        });
        return List.of();
    }

    private List<String> merge(List<String> args) {
        Resolved to = resolve(args, 0);
        Resolved from = resolve(args, 2);
        requireSubscripts(to);
        NodeTree source = engine.variables(from.name(), table -> {
            NodeTree root = table.get(from.name());
            NodeTree node = root == null ? null : root.find(from.values());
            return node == null ? null : node.copy();
        });
        if (source != null) {
            engine.variables(to.name(), table -> {
                table.computeIfAbsent(to.name(), key -> new NodeTree()).merge(to.values(), source);
                return null;
            });
        }
        return List.of();
    }

    private List<String> order(List<String> args, boolean forward) {
        Resolved node = resolve(args, 0);
        if (node.values().isEmpty()) {
            return List.of(nextName(node.name(), forward));
        }
        String next = engine.variables(node.name(), table -> {
            NodeTree root = table.get(node.name());
            return root == null ? "" : root.order(node.values(), forward);
        });
        return List.of(next);
    }

    private List<String> node(List<String> args, boolean forward) {
        Resolved node = resolve(args, 0);
        return engine.variables(node.name(), table -> {
            NodeTree root = table.get(node.name());
            if (root == null) {
                return List.<String>of();
            }
            List<String> found = root.query(node.values(), forward);
            if (found == null) {
                return List.<String>of();
            }
            var reply = new ArrayList<String>(found.size() + 1);
            reply.add(root.get(found));
            reply.addAll(found);
            return reply;
        });
    }

    private List<String> increment(List<String> args) {
        Resolved node = resolve(args, 0);
        requireSubscripts(node);
        String amount = MValues.evaluateLiteral(arg(args, 2));
        String updated = engine.variables(node.name(), table -> {
            NodeTree root = table.computeIfAbsent(node.name(), key -> new NodeTree());
            String current = root.get(node.values());
            String next = MValues.add(current == null ? "0" : current, amount);
            root.set(node.values(), next);
            return next;
        });
        return List.of(updated);
    }

    private List<String> lock(List<String> args) {
        Resolved node = resolve(args, 0);
        long timeoutMillis = timeoutMillis(arg(args, 2));
        boolean acquired = engine.database().locks()
            .lock(node.path(), engine.processId(), timeoutMillis, engine::takeInterrupt);
        return List.of(acquired ? "1" : "0");
    }

    private List<String> unlock(List<String> args) {
        if (arg(args, 0).isEmpty()) {
            engine.database().locks().releaseAll(engine.processId());
            return List.of();
        }
        Resolved node = resolve(args, 0);
        engine.database().locks().unlock(node.path(), engine.processId());
        return List.of();
    }

    private List<String> invoke(List<String> args, boolean function) {
        Resolved call = resolveCall(args, 0);
        RoutineTable routines = engine.database().routines();
        if ("1".equals(arg(args, 2))) {
            routines.relink(call.name());
        }
        EngineRoutine routine = routines.lookup(call.name());
        var arguments = new ArrayList<String>(call.values());
        String result;
        try {
            result = routine.invoke(engine, arguments);
        } catch (EngineFault fault) {
            throw fault;
        } catch (RuntimeException ex) {
            throw new EngineFault(EngineFault.ROUTINE_FAILED, "%YDB-E-RTNFAIL, " + call.name() + " failed: " + ex.getMessage());
        }
        for (Map.Entry<Integer, String> reference : call.byReference().entrySet()) {
            String before = call.values().get(reference.getKey());
            String after = arguments.get(reference.getKey());
            if (after != null && !after.equals(before)) {
                engine.store(reference.getValue(), List.of(), after);
            }
        }
        if (!function) {
            return List.of();
        }
        return List.of(result == null ? "" : result);
    }

    private List<String> directory(List<String> args, boolean globals) {
        int max = Integer.parseInt(arg(args, 0));
        String lo = bound(arg(args, 1));
        String hi = bound(arg(args, 2));
        String prefix = globals ? "^" : "";
        Function<NavigableMap<String, NodeTree>, List<String>> listing = table -> {
            NavigableMap<String, NodeTree> range = lo.isEmpty() ? table : table.tailMap(prefix + lo, true);
            var names = new ArrayList<String>();
            for (Map.Entry<String, NodeTree> entry : range.entrySet()) {
                String name = entry.getKey().substring(prefix.length());
                if (!hi.isEmpty() && name.compareTo(hi) > 0) {
                    break;
                }
                if (entry.getValue().isEmpty() || (!globals && NameRules.isInternal(name))) {
                    continue;
                }
                names.add(name);
                if (max > 0 && names.size() >= max) {
                    break;
                }
            }
            return names;
        };
        return globals ? engine.database().globals(listing) : listing.apply(engine.locals());
    }

    private String nextName(String name, boolean forward) {
        return engine.variables(name, table -> {
            String current = forward ? table.higherKey(name) : table.lowerKey(name);
            while (current != null && (table.get(current).isEmpty()
                || (!current.startsWith("^") && NameRules.isInternal(current)))) {
                current = forward ? table.higherKey(current) : table.lowerKey(current);
            }
            return current == null ? "" : current;
        });
    }

    /**
     * Resolves the reference at {@code index}, first loading the spilled tokens at
     * {@code index + 1} into the temp array.
     */
    private Resolved resolve(List<String> args, int index) {
        return Indirection.resolve(arg(args, index), loadSlots(arg(args, index + 1)));
    }

    private Resolved resolveCall(List<String> args, int index) {
        return Indirection.resolveCall(arg(args, index), loadSlots(arg(args, index + 1)),
            local -> NameRules.isInternal(local) ? null : engine.value(local, List.of()));
    }

    private IntFunction<String> loadSlots(String spilled) {
        engine.locals().remove(TEMP_ARRAY);
        if (!spilled.isEmpty()) {
            var slots = new NodeTree();
            List<String> tokens = SubscriptPacker.unpack(spilled);
            for (int i = 0; i < tokens.size(); i++) {
                slots.set(List.of(Integer.toString(i + 1)), MValues.evaluateLiteral(tokens.get(i)));
            }
            engine.locals().put(TEMP_ARRAY, slots);
        }
        return slot -> {
            NodeTree slots = engine.locals().get(TEMP_ARRAY);
            String value = slots == null ? null : slots.get(List.of(Integer.toString(slot)));
            if (value == null) {
                throw new EngineFault(EngineFault.UNDEFINED_LOCAL, "%YDB-E-LVUNDEF, Undefined local variable: " + TEMP_ARRAY + "(" + slot + ")");
            }
            return value;
        };
    }

    private static void requireSubscripts(Resolved node) {
        for (String subscript : node.values()) {
            if (subscript.isEmpty()) {
                throw new EngineFault(EngineFault.NULL_SUBSCRIPT, "%YDB-E-NULSUBSC, Null subscripts are not allowed for " + node.name());
            }
        }
    }

    private static long timeoutMillis(String seconds) {
        BigDecimal value = new BigDecimal(seconds);
        if (value.signum() < 0) {
            return -1;
        }
        return value.multiply(BigDecimal.valueOf(1000)).setScale(0, RoundingMode.HALF_UP).longValue();
    }

    /**
     * Directory bounds ignore numbers and the global marker.
     */
    private static String bound(String raw) {
        if (raw.isEmpty() || CanonicalNumbers.isCanonical(raw)) {
            return "";
        }
        return raw.startsWith("^") ? raw.substring(1) : raw;
    }

    private static String releaseNumber(String versionText) {
        String[] pieces = versionText.split(" ");
        if (pieces.length < 2 || pieces[1].isEmpty()) {
            return "";
        }
        return pieces[1].substring(1);
    }

    private static String arg(List<String> args, int index) {
        return index < args.size() ? args.get(index) : "";
    }
}
