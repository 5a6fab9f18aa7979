package work.semiocore.kernel.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Write-once output of a single engine run.
 */
public record Trace(String programFile, List<Event> events, Summary summary) {
    public static final String SCHEMA = "semiocore.trace.v1";

    public Trace {
        Objects.requireNonNull(programFile, "programFile");
        Objects.requireNonNull(summary, "summary");
        events = List.copyOf(events);
    }

    /** Ordered outcome labels, compared as opaque tokens by the scanner. */
    public List<Outcome> outcomeSignature() {
        var signature = new ArrayList<Outcome>(events.size());
        for (Event event : events) {
            signature.add(event.obj());
        }
        return signature;
    }

    public Map<String, Object> toSerializableMap() {
        var serialized = new ArrayList<Map<String, Object>>(events.size());
        for (Event event : events) {
            serialized.add(event.toSerializableMap());
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("schema", SCHEMA);
        map.put("program_file", programFile);
        map.put("events", serialized);
        map.put("summary", summary.toSerializableMap());
        return map;
    }
}
