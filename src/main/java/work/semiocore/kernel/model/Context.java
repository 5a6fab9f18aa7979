package work.semiocore.kernel.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, non-empty operator chain. Order matters: operators generally do not commute.
 */
public record Context(List<Op> ops) {
    public Context {
        Objects.requireNonNull(ops, "ops");
        ops = List.copyOf(ops);
        if (ops.isEmpty()) {
            throw new IllegalArgumentException("Context must contain at least one operator.");
        }
    }

    public static Context of(Op... ops) {
        return new Context(List.of(ops));
    }

    public String canonical() {
        return CanonicalContext.render(ops);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
