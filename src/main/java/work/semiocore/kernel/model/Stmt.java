package work.semiocore.kernel.model;

import java.util.Objects;

/**
 * Statements allowed inside a context block.
 */
public interface Stmt {
    record Tick(double dt) implements Stmt {}

    record Sense(String var, String channel) implements Stmt {
        public Sense {
            Objects.requireNonNull(var, "var");
            Objects.requireNonNull(channel, "channel");
        }
    }

    record Commit(String var) implements Stmt {
        public Commit {
            Objects.requireNonNull(var, "var");
        }
    }

    record DoAddBias(double value) implements Stmt {}

    /** Structural marker ({@code out := summarize}); no effect on execution state. */
    record OutSummarize() implements Stmt {}
}
