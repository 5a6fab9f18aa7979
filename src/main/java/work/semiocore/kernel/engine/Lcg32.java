package work.semiocore.kernel.engine;

/**
 * 32-bit linear congruential generator. Pure: callers own the state and thread it through.
 */
public final class Lcg32 {
    public static final long A = 1664525L;
    public static final long C = 1013904223L;
    public static final long M = 1L << 32;
    private static final long MASK = 0xFFFFFFFFL;

    private Lcg32() {}

    public static long seed(long seed) {
        return seed & MASK;
    }

    public static long next(long state) {
        return (A * (state & MASK) + C) & MASK;
    }

    /** Advances once and returns {@code u = state' / 2^32} in [0, 1) with the new state. */
    public static Draw draw(long state) {
        long advanced = next(state);
        return new Draw((double) advanced / (double) M, advanced);
    }

    public record Draw(double u, long state) {}
}
