package work.semiocore.kernel.plasticity;

import java.util.List;
import java.util.Objects;
import work.semiocore.kernel.engine.Trace;

/**
 * One analyzer input: the trace's events plus the sha-256 of the document they were read from.
 */
public record TraceEvidence(String programFile, String digest, List<ObservedEvent> events) {
    public TraceEvidence {
        Objects.requireNonNull(digest, "digest");
        events = List.copyOf(events);
    }

    public static TraceEvidence of(Trace trace, String digest) {
        return new TraceEvidence(trace.programFile(), digest, trace.events().stream().map(ObservedEvent::from).toList());
    }
}
