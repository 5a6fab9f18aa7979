package work.semiocore.kernel.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable parsed program. Derived programs (seed override, permuted context) are structural
 * copies with one field replaced.
 */
public record Program(Optional<Long> seed, Context context, List<Stmt> body) {
    public Program {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(body, "body");
        body = List.copyOf(body);
    }

    public Program withContext(Context replacement) {
        return new Program(seed, replacement, body);
    }

    public Program withSeed(long replacement) {
        return new Program(Optional.of(replacement), context, body);
    }
}
