package work.semiocore.kernel.engine;

/**
 * Committed decision label.
 */
public enum Outcome {
    AFFIRM,
    NEGATE;

    public static Outcome of(double value) {
        return value > 0.0 ? AFFIRM : NEGATE;
    }
}
