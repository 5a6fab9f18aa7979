package work.semiocore.kernel.json;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import work.semiocore.kernel.plasticity.ObservedEvent;
import work.semiocore.kernel.plasticity.TraceEvidence;
import work.semiocore.kernel.shared.Digests;

/**
 * Reads trace documents back for analysis, digesting the exact file bytes as evidence.
 */
public final class TraceReader {
    private TraceReader() {}

    public static TraceEvidence read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Trace file not found: " + path);
        }
        byte[] content = Files.readAllBytes(path);
        JsonNode root = JsonDocuments.mapper().readTree(content);
        if (root == null || !root.isObject()) {
            throw new IOException("Trace document must be an object: " + path);
        }
        var events = new ArrayList<ObservedEvent>();
        for (JsonNode node : root.path("events")) {
            events.add(toEvent(node));
        }
        String programFile = root.hasNonNull("program_file") ? root.get("program_file").asText() : "";
        return new TraceEvidence(programFile, Digests.sha256Hex(content), events);
    }

    private static ObservedEvent toEvent(JsonNode node) {
        return new ObservedEvent(
            textOrNull(node, "ctx"),
            textOrNull(node, "ch"),
            node.path("t").asDouble(0.0),
            node.path("step").asInt(0),
            node.hasNonNull("obj") ? node.get("obj").asText() : "UNKNOWN",
            numberOrNull(node, "r_raw"),
            numberOrNull(node, "s"),
            numberOrNull(node, "kappa_loc")
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static Double numberOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asDouble() : null;
    }
}
