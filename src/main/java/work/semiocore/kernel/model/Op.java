package work.semiocore.kernel.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One context operator. The name stays textual so contexts rebuilt outside the parser are
 * re-validated when the engine applies them; {@code arg} is {@code null} for operators without one.
 */
public record Op(String name, Double arg) {
    public Op {
        Objects.requireNonNull(name, "name");
    }

    public static Op add(double value) {
        return new Op(OpKind.ADD.opName(), value);
    }

    public static Op sign() {
        return new Op(OpKind.SIGN.opName(), null);
    }

    public static Op jitterU(double eps) {
        return new Op(OpKind.JITTER_U.opName(), eps);
    }

    public boolean hasArg() {
        return arg != null;
    }

    public Optional<OpKind> kind() {
        return OpKind.byName(name);
    }
}
