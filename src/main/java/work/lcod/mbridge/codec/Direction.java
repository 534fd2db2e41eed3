package work.lcod.mbridge.codec;

/**
 * Which way a token is travelling: towards the engine or back to the host.
 */
public enum Direction {
    INPUT,
    OUTPUT
}
