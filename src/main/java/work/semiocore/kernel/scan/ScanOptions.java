package work.semiocore.kernel.scan;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable knobs for a context scan.
 */
public record ScanOptions(
    String programFile,
    String worldFile,
    String protocol,
    Optional<Integer> maxPermutations,
    int parallelism,
    Optional<TraceSink> traceSink
) {
    public ScanOptions {
        Objects.requireNonNull(programFile, "programFile");
        Objects.requireNonNull(worldFile, "worldFile");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(maxPermutations, "maxPermutations");
        Objects.requireNonNull(traceSink, "traceSink");
        if (maxPermutations.isPresent() && maxPermutations.get() < 1) {
            throw new IllegalArgumentException("maxPermutations must be >= 1, got " + maxPermutations.get());
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String programFile = "<memory>";
        private String worldFile = "<memory>";
        private String protocol = "Strict";
        private Optional<Integer> maxPermutations = Optional.empty();
        private int parallelism = 1;
        private Optional<TraceSink> traceSink = Optional.empty();

        public Builder programFile(String programFile) {
            this.programFile = programFile;
            return this;
        }

        public Builder worldFile(String worldFile) {
            this.worldFile = worldFile;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder maxPermutations(Optional<Integer> maxPermutations) {
            this.maxPermutations = maxPermutations;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder traceSink(TraceSink traceSink) {
            this.traceSink = Optional.ofNullable(traceSink);
            return this;
        }

        public ScanOptions build() {
            return new ScanOptions(programFile, worldFile, protocol, maxPermutations, parallelism, traceSink);
        }
    }
}
