package work.semiocore.kernel.plasticity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges events from one or more traces and computes windowed stability metrics with a verdict.
 * Deterministic: stable merge order, explicit thresholds, evidence digests.
 */
public final class PlasticityAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(PlasticityAnalyzer.class);

    static final double LOW_PARTITION_STABILITY = 0.85;
    static final double HIGH_NOISE_SENSITIVITY = 2.0;
    static final double HIGH_INDETERMINACY_RATE = 0.05;
    static final double HIGH_COHERENCE_LOSS = 0.05;
    static final double FRAGILE_MIN_STABILITY = 0.70;
    static final double FRAGILE_MAX_INDETERMINACY = 0.20;
    static final double TREND_MARGIN = 0.05;
    static final double FULL_CONFIDENCE_EVENTS = 50.0;
    private static final double DENOMINATOR_EPSILON = 1e-9;
    private static final Set<String> INDETERMINATE_LABELS = Set.of("UNDETERMINED", "UNKNOWN");

    private static final Comparator<Indexed> MERGE_ORDER = Comparator
        .comparingDouble((Indexed indexed) -> indexed.event().t())
        .thenComparingInt(indexed -> indexed.event().step())
        .thenComparingInt(Indexed::traceIndex)
        .thenComparingInt(Indexed::eventIndex);

    private PlasticityAnalyzer() {}

    public static PlasticityReport analyze(List<TraceEvidence> traces, PlasticityRequest request) {
        if (request.windowSize() <= 0 || request.windowStep() <= 0) {
            throw new AnalysisException("invalid_window", "window_size and window_step must be > 0");
        }
        if (traces.isEmpty()) {
            throw new AnalysisException("no_traces", "trace list must be non-empty");
        }

        List<ObservedEvent> events = merge(traces, request.ctx(), request.channel());
        if (events.isEmpty()) {
            throw new AnalysisException("no_matching_events",
                "No events for ctx='" + request.ctx() + "' and channel='" + request.channel() + "' in provided traces");
        }

        int n = events.size();
        var objs = new ArrayList<String>(n);
        var kappas = new ArrayList<Double>(n);
        int indeterminate = 0;
        for (ObservedEvent event : events) {
            objs.add(event.obj());
            if (event.kappaLoc() != null) {
                kappas.add(event.kappaLoc());
            }
            if (INDETERMINATE_LABELS.contains(event.obj().toUpperCase(Locale.ROOT))) {
                indeterminate++;
            }
        }

        double partitionStability = partitionStability(objs, request.windowSize(), request.windowStep());
        double noiseSensitivity = noiseSensitivity(events);
        double indeterminacyRate = indeterminate / (double) n;
        double coherenceLoss = populationVariance(kappas);

        int half = n / 2;
        double firstHalf = majorityFraction(objs.subList(0, half));
        double secondHalf = majorityFraction(objs.subList(half, n));
        PlasticityReport.Trend trend;
        if (secondHalf < firstHalf - TREND_MARGIN) {
            trend = PlasticityReport.Trend.DECLINING;
        } else if (secondHalf > firstHalf + TREND_MARGIN) {
            trend = PlasticityReport.Trend.IMPROVING;
        } else {
            trend = PlasticityReport.Trend.STABLE;
        }

        var reasons = new ArrayList<String>();
        if (partitionStability < LOW_PARTITION_STABILITY) {
            reasons.add("low_partition_stability");
        }
        if (noiseSensitivity > HIGH_NOISE_SENSITIVITY) {
            reasons.add("high_noise_sensitivity");
        }
        if (indeterminacyRate > HIGH_INDETERMINACY_RATE) {
            reasons.add("high_indeterminacy_rate");
        }
        if (coherenceLoss > HIGH_COHERENCE_LOSS) {
            reasons.add("high_coherence_loss");
        }

        PlasticityReport.State state;
        if (reasons.isEmpty()) {
            state = PlasticityReport.State.STABLE;
        } else if (partitionStability >= FRAGILE_MIN_STABILITY && indeterminacyRate <= FRAGILE_MAX_INDETERMINACY) {
            state = PlasticityReport.State.FRAGILE;
        } else {
            state = PlasticityReport.State.DEGRADED;
        }
        double confidence = Math.min(1.0, n / FULL_CONFIDENCE_EVENTS);

        var digests = new ArrayList<String>(traces.size());
        for (TraceEvidence trace : traces) {
            digests.add(trace.digest());
        }
        String programFile = request.programFile().orElseGet(() -> {
            String first = traces.get(0).programFile();
            return first == null ? "" : first;
        });
        LOG.debug("Plasticity for {}/{}: {} event(s), state={}", request.ctx(), request.channel(), n, state.label());

        return new PlasticityReport(
            programFile,
            request.protocol(),
            request.ctx(),
            request.channel(),
            new PlasticityReport.Windowing(request.windowSize(), request.windowStep()),
            new PlasticityReport.Metrics(partitionStability, noiseSensitivity, indeterminacyRate, coherenceLoss),
            new PlasticityReport.Verdict(state, trend, confidence, reasons),
            new PlasticityReport.Evidence(traces.size(), n, digests)
        );
    }

    static List<ObservedEvent> merge(List<TraceEvidence> traces, String ctx, String channel) {
        var matching = new ArrayList<Indexed>();
        for (int ti = 0; ti < traces.size(); ti++) {
            List<ObservedEvent> events = traces.get(ti).events();
            for (int ei = 0; ei < events.size(); ei++) {
                ObservedEvent event = events.get(ei);
                if (ctx.equals(event.ctx()) && channel.equals(event.channel())) {
                    matching.add(new Indexed(ti, ei, event));
                }
            }
        }
        matching.sort(MERGE_ORDER);
        var merged = new ArrayList<ObservedEvent>(matching.size());
        for (Indexed indexed : matching) {
            merged.add(indexed.event());
        }
        return merged;
    }

    /** Mean majority fraction over windows of {@code size} starting every {@code step} events; 1.0 without windows. */
    static double partitionStability(List<String> objs, int size, int step) {
        double total = 0.0;
        int windows = 0;
        for (int start = 0; start < objs.size(); start += step) {
            List<String> window = objs.subList(start, Math.min(objs.size(), start + size));
            if (window.isEmpty()) {
                continue;
            }
            total += majorityFraction(window);
            windows++;
        }
        return windows == 0 ? 1.0 : total / windows;
    }

    /** Share of entries equal to the most frequent label (ties: lexicographically smallest); 1.0 when empty. */
    static double majorityFraction(List<String> labels) {
        if (labels.isEmpty()) {
            return 1.0;
        }
        Map<String, Integer> counts = new TreeMap<>();
        for (String label : labels) {
            counts.merge(label, 1, Integer::sum);
        }
        int best = 0;
        for (int count : counts.values()) {
            best = Math.max(best, count);
        }
        return best / (double) labels.size();
    }

    static double noiseSensitivity(List<ObservedEvent> events) {
        if (events.size() < 2) {
            return 0.0;
        }
        double changes = 0.0;
        double movement = 0.0;
        for (int i = 1; i < events.size(); i++) {
            if (!events.get(i).obj().equals(events.get(i - 1).obj())) {
                changes += 1.0;
            }
            movement += Math.abs(events.get(i).signal() - events.get(i - 1).signal());
        }
        return changes / (movement + DENOMINATOR_EPSILON);
    }

    static double populationVariance(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        double mean = sum / values.size();
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / values.size();
    }

    private record Indexed(int traceIndex, int eventIndex, ObservedEvent event) {}
}
