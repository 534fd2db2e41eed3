package work.lcod.mbridge.codec;

import java.util.List;

/**
 * A name plus engine-ready tokens, with the literal text handed to the engine.
 *
 * <p>When the literal would exceed the indirection limit the reference is <em>spilled</em>:
 * {@link #literal()} names the slots {@code v4wTempArgs(1..n)} and {@link #spilled()} holds the
 * tokens the engine assigns to those slots before evaluating it.</p>
 */
public record Reference(String name, List<String> tokens, String literal, List<String> spilled) {
    public static final String TEMP_ARRAY = "v4wTempArgs";

    public Reference {
        tokens = List.copyOf(tokens);
        spilled = List.copyOf(spilled);
    }

    public boolean isSpilled() {
        return !spilled.isEmpty();
    }

    /**
     * Packed temp-slot tokens sent alongside the literal; empty when not spilled.
     */
    public String packedSpill() {
        return SubscriptPacker.pack(spilled);
    }
}
