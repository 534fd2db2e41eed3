package work.lcod.mbridge.codec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import work.lcod.mbridge.api.BridgeException;

/**
 * Builds {@code name(tok1,tok2,...)} references for the engine's indirection mechanism.
 */
public final class ReferenceBuilder {
    private final int indirectionLimit;

    public ReferenceBuilder(int indirectionLimit) {
        if (indirectionLimit <= 0) {
            throw new IllegalArgumentException("Indirection limit must be positive");
        }
        this.indirectionLimit = indirectionLimit;
    }

    public int indirectionLimit() {
        return indirectionLimit;
    }

    public Reference build(String name, List<String> tokens) {
        String literal = render(name, tokens);
        if (byteLength(literal) <= indirectionLimit) {
            return new Reference(name, tokens, literal, List.of());
        }
        var slots = new ArrayList<String>(tokens.size());
        for (int i = 1; i <= tokens.size(); i++) {
            slots.add(Reference.TEMP_ARRAY + "(" + i + ")");
        }
        String indirect = render(name, slots);
        if (byteLength(indirect) > indirectionLimit) {
            throw BridgeException.encoding("Reference to " + name + " with " + tokens.size()
                + " tokens exceeds the indirection limit of " + indirectionLimit + " even in indirect form");
        }
        return new Reference(name, tokens, indirect, tokens);
    }

    static String render(String name, List<String> tokens) {
        if (tokens.isEmpty()) {
            return name;
        }
        return name + "(" + String.join(",", tokens) + ")";
    }

    private static int byteLength(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
