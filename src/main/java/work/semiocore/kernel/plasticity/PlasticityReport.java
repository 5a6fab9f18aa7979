package work.semiocore.kernel.plasticity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Windowed stability verdict for one context/channel pair.
 */
public record PlasticityReport(
    String programFile,
    String protocol,
    String ctx,
    String channel,
    Windowing windowing,
    Metrics metrics,
    Verdict verdict,
    Evidence evidence
) {
    public static final String SCHEMA = "semiocore.plasticity.v1";

    public enum State {
        STABLE,
        FRAGILE,
        DEGRADED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Trend {
        DECLINING,
        IMPROVING,
        STABLE;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record Windowing(int size, int step) {}

    public record Metrics(double partitionStability, double noiseSensitivity, double indeterminacyRate, double coherenceLoss) {}

    public record Verdict(State state, Trend trend, double confidence, List<String> reasons) {
        public Verdict {
            reasons = List.copyOf(reasons);
        }
    }

    public record Evidence(int traceCount, int eventCount, List<String> traceDigests) {
        public Evidence {
            traceDigests = List.copyOf(traceDigests);
        }
    }

    public Map<String, Object> toSerializableMap() {
        var windowingMap = new LinkedHashMap<String, Object>();
        windowingMap.put("mode", "fixed");
        windowingMap.put("size", windowing.size());
        windowingMap.put("step", windowing.step());

        var metricsMap = new LinkedHashMap<String, Object>();
        metricsMap.put("partition_stability", metrics.partitionStability());
        metricsMap.put("noise_sensitivity", metrics.noiseSensitivity());
        metricsMap.put("indeterminacy_rate", metrics.indeterminacyRate());
        metricsMap.put("coherence_loss", metrics.coherenceLoss());

        var verdictMap = new LinkedHashMap<String, Object>();
        verdictMap.put("plasticity_state", verdict.state().label());
        verdictMap.put("trend", verdict.trend().label());
        verdictMap.put("confidence", verdict.confidence());
        verdictMap.put("reasons", verdict.reasons());

        var evidenceMap = new LinkedHashMap<String, Object>();
        evidenceMap.put("N_traces", evidence.traceCount());
        evidenceMap.put("N_events", evidence.eventCount());
        evidenceMap.put("trace_digests", evidence.traceDigests());

        var map = new LinkedHashMap<String, Object>();
        map.put("schema", SCHEMA);
        map.put("program_file", programFile);
        map.put("protocol", protocol);
        map.put("ctx", ctx);
        map.put("channel", channel);
        map.put("windowing", windowingMap);
        map.put("metrics", metricsMap);
        map.put("verdict", verdictMap);
        map.put("evidence", evidenceMap);
        return map;
    }
}
