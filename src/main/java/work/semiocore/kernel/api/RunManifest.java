package work.semiocore.kernel.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.semiocore.kernel.engine.Lcg32;

/**
 * Provenance written next to a run's trace; {@code replay} reproduces the trace from it.
 */
public record RunManifest(
    String programFile,
    String programHash,
    String worldFile,
    String worldHash,
    Optional<Long> seed
) {
    public static final String SCHEMA = "semiocore.manifest.v1";
    public static final String SEMIO_VERSION = "1.0.0";
    public static final String STDLIB_VERSION = "1.0.0";
    public static final String PROTOCOL = "Strict";
    // Fixed so manifests of identical inputs are byte-identical.
    public static final String TIMESTAMP = "1970-01-01T00:00:00+00:00";

    public RunManifest {
        Objects.requireNonNull(programFile, "programFile");
        Objects.requireNonNull(programHash, "programHash");
        Objects.requireNonNull(worldFile, "worldFile");
        Objects.requireNonNull(worldHash, "worldHash");
        Objects.requireNonNull(seed, "seed");
    }

    public String runId() {
        return "run-" + programHash.substring(0, Math.min(8, programHash.length()));
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> rng = null;
        if (seed.isPresent()) {
            rng = new LinkedHashMap<>();
            rng.put("type", "LCG32");
            rng.put("a", Lcg32.A);
            rng.put("c", Lcg32.C);
            rng.put("m", Lcg32.M);
            rng.put("state0", Lcg32.seed(seed.get()));
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("schema", SCHEMA);
        map.put("semio_version", SEMIO_VERSION);
        map.put("stdlib_version", STDLIB_VERSION);
        map.put("program_file", programFile);
        map.put("program_hash_sha256", programHash);
        map.put("world_file", worldFile);
        map.put("world_hash_sha256", worldHash);
        map.put("protocol", PROTOCOL);
        map.put("seed", seed.orElse(null));
        map.put("rng", rng);
        map.put("run_id", runId());
        map.put("timestamp", TIMESTAMP);
        return map;
    }
}
