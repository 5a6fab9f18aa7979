package work.semiocore.kernel.model;

import java.util.Optional;

/**
 * The closed set of context operators the engine knows how to apply.
 */
public enum OpKind {
    ADD("Add", true),
    SIGN("Sign", false),
    JITTER_U("JitterU", true);

    private final String opName;
    private final boolean requiresArg;

    OpKind(String opName, boolean requiresArg) {
        this.opName = opName;
        this.requiresArg = requiresArg;
    }

    public String opName() {
        return opName;
    }

    public boolean requiresArg() {
        return requiresArg;
    }

    public static Optional<OpKind> byName(String name) {
        for (OpKind kind : values()) {
            if (kind.opName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
