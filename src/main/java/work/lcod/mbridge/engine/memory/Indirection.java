package work.lcod.mbridge.engine.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.regex.Pattern;
import work.lcod.mbridge.codec.Reference;

/**
 * Evaluates a literal reference ({@code ^name("a",2,v4wTempArgs(3))}) into a name and its
 * subscript or argument values. Call references may also name locals: {@code x} passes the
 * value of {@code x}, {@code .x} passes {@code x} by reference.
 */
final class Indirection {
    private static final String SLOT_PREFIX = Reference.TEMP_ARRAY + "(";
    private static final Pattern LOCAL_NAME = Pattern.compile("%?[A-Za-z][A-Za-z0-9]*");

    private Indirection() {}

    record Resolved(String name, List<String> values, Map<Integer, String> byReference) {
        Resolved(String name, List<String> values) {
            this(name, values, Map.of());
        }

        List<String> path() {
            var path = new ArrayList<String>(values.size() + 1);
            path.add(name);
            path.addAll(values);
            return path;
        }
    }

    static Resolved resolve(String literal, IntFunction<String> slots) {
        return resolve(literal, slots, null);
    }

    /**
     * Resolves a function or procedure reference. {@code locals} answers the value of a local
     * variable, or {@code null} when it is undefined.
     */
    static Resolved resolveCall(String literal, IntFunction<String> slots, Function<String, String> locals) {
        return resolve(literal, slots, locals);
    }

    private static Resolved resolve(String literal, IntFunction<String> slots, Function<String, String> locals) {
        int open = literal.indexOf('(');
        if (open < 0) {
            requireName(literal, literal);
            return new Resolved(literal, List.of());
        }
        String name = literal.substring(0, open);
        requireName(name, literal);
        if (!literal.endsWith(")")) {
            throw invalid(literal);
        }
        String body = literal.substring(open + 1, literal.length() - 1);
        var values = new ArrayList<String>();
        var byReference = new LinkedHashMap<Integer, String>();
        int position = 0;
        while (position <= body.length()) {
            int end = argumentEnd(body, position, literal);
            String argument = body.substring(position, end);
            if (locals != null && argument.startsWith(".") && LOCAL_NAME.matcher(argument.substring(1)).matches()) {
                String local = argument.substring(1);
                byReference.put(values.size(), local);
                String value = locals.apply(local);
                values.add(value == null ? "" : value);
            } else if (locals != null && !argument.startsWith(SLOT_PREFIX) && LOCAL_NAME.matcher(argument).matches()) {
                String value = locals.apply(argument);
                if (value == null) {
                    throw new EngineFault(EngineFault.UNDEFINED_LOCAL, "%YDB-E-LVUNDEF, Undefined local variable: " + argument);
                }
                values.add(value);
            } else {
                values.add(evaluate(argument, slots, literal));
            }
            if (end == body.length()) {
                break;
            }
            position = end + 1;
        }
        return new Resolved(name, values, byReference);
    }

    private static int argumentEnd(String body, int start, String literal) {
        if (start < body.length() && body.charAt(start) == '"') {
            int index = start + 1;
            while (index < body.length()) {
                if (body.charAt(index) == '"') {
                    if (index + 1 < body.length() && body.charAt(index + 1) == '"') {
                        index += 2;
                        continue;
                    }
                    return expectSeparator(body, index + 1, literal);
                }
                index++;
            }
            throw invalid(literal);
        }
        int depth = 0;
        for (int index = start; index < body.length(); index++) {
            char c = body.charAt(index);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                return index;
            }
        }
        return body.length();
    }

    private static int expectSeparator(String body, int index, String literal) {
        if (index < body.length() && body.charAt(index) != ',') {
            throw invalid(literal);
        }
        return index;
    }

    private static String evaluate(String argument, IntFunction<String> slots, String literal) {
        if (argument.isEmpty()) {
            throw invalid(literal);
        }
        if (argument.startsWith(SLOT_PREFIX) && argument.endsWith(")")) {
            String index = argument.substring(SLOT_PREFIX.length(), argument.length() - 1);
            try {
                return slots.apply(Integer.parseInt(index));
            } catch (NumberFormatException ex) {
                throw invalid(literal);
            }
        }
        return MValues.evaluateLiteral(argument);
    }

    private static void requireName(String name, String literal) {
        if (name.isEmpty()) {
            throw invalid(literal);
        }
    }

    private static EngineFault invalid(String literal) {
        return new EngineFault(EngineFault.INVALID_EXPRESSION, "%YDB-E-INDEXTRACHARS, Indirection string contains extra trailing characters: " + literal);
    }
}
