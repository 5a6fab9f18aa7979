package work.semiocore.kernel.scan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.semiocore.kernel.engine.Summary;

/**
 * Result of a context-permutation scan. The baseline is always {@code permutations.get(0)}.
 */
public record CtxScanReport(
    String programFile,
    String worldFile,
    String protocol,
    String baselineCtx,
    Summary baselineSummary,
    boolean noncontextual,
    double dkappaMax,
    Optional<Witness> witness,
    List<PermutationResult> permutations
) {
    public static final String SCHEMA = "semiocore.ctxscan.v1";

    public CtxScanReport {
        Objects.requireNonNull(baselineCtx, "baselineCtx");
        Objects.requireNonNull(baselineSummary, "baselineSummary");
        Objects.requireNonNull(witness, "witness");
        permutations = List.copyOf(permutations);
    }

    /**
     * First permutation whose outcome sequence departs from the baseline's. Labels are {@code null}
     * when one signature is shorter than {@code diffStep}.
     */
    public record Witness(int permIndex, String ctx, int diffStep, String baselineObj, String obj) {
        public Map<String, Object> toSerializableMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("perm_i", permIndex);
            map.put("ctx", ctx);
            map.put("diff_step", diffStep);
            map.put("baseline_obj", baselineObj);
            map.put("obj", obj);
            return map;
        }
    }

    public record PermutationResult(int index, String ctx, Summary summary, double dkappa, Optional<String> traceFile) {
        public Map<String, Object> toSerializableMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("i", index);
            map.put("ctx", ctx);
            map.put("summary", summary.toSerializableMap());
            map.put("dkappa", dkappa);
            map.put("trace_file", traceFile.orElse(null));
            return map;
        }
    }

    public Map<String, Object> toSerializableMap() {
        var entries = new ArrayList<Map<String, Object>>(permutations.size());
        for (PermutationResult permutation : permutations) {
            entries.add(permutation.toSerializableMap());
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("schema", SCHEMA);
        map.put("program_file", programFile);
        map.put("world_file", worldFile);
        map.put("protocol", protocol);
        map.put("baseline_ctx", baselineCtx);
        map.put("baseline_summary", baselineSummary.toSerializableMap());
        map.put("noncontextual", noncontextual);
        map.put("dkappa_max", dkappaMax);
        map.put("witness", witness.map(Witness::toSerializableMap).orElse(null));
        map.put("permutations", entries);
        return map;
    }
}
