package work.semiocore.kernel.engine;

import work.semiocore.kernel.model.Context;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.OpKind;

/**
 * Applies a context's operators, in declared order, to a raw value.
 */
public final class ContextPipeline {
    private ContextPipeline() {}

    /**
     * @param rngState current generator state, or {@code null} when the program has no seed
     * @return effective value, generator state after the draws, and the last jitter noise (or {@code null})
     */
    public static Result apply(double value, Context context, Long rngState) {
        double r = value;
        Long state = rngState;
        Double noise = null;
        for (Op op : context.ops()) {
            OpKind kind = op.kind().orElseThrow(() -> new EngineException("unknown_operator", "Unknown operator: " + op.name()));
            switch (kind) {
                case ADD -> r = r + requireArg(op);
                case SIGN -> r = r > 0.0 ? 1.0 : -1.0;
                case JITTER_U -> {
                    double eps = requireArg(op);
                    if (state == null) {
                        throw new EngineException("rng_required", "JitterU requires a seed (rng_state).");
                    }
                    Lcg32.Draw draw = Lcg32.draw(state);
                    state = draw.state();
                    noise = (2.0 * draw.u() - 1.0) * eps;
                    r = r + noise;
                }
                default -> throw new EngineException("unknown_operator", "Unknown operator: " + op.name());
            }
        }
        return new Result(r, state, noise);
    }

    private static double requireArg(Op op) {
        if (!op.hasArg()) {
            throw new EngineException("missing_operator_argument", op.name() + " requires an argument.");
        }
        return op.arg();
    }

    public record Result(double value, Long rngState, Double noise) {
        public boolean jittered() {
            return noise != null;
        }
    }
}
