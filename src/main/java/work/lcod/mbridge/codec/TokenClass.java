package work.lcod.mbridge.codec;

/**
 * Classification of a single token as decided by {@link ValueClassifier}.
 */
public enum TokenClass {
    NUMBER,
    QUOTED_STRING,
    ALREADY_QUOTED
}
