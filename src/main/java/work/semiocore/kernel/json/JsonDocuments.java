package work.semiocore.kernel.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import work.semiocore.kernel.shared.Digests;

/**
 * Stable JSON rendering for every document the toolchain emits: keys sorted, two-space indent,
 * trailing newline. Content hashes and golden comparisons depend on this being byte-stable.
 */
public final class JsonDocuments {
    private static final ObjectMapper JSON = new ObjectMapper(
        JsonFactory.builder().enable(StreamWriteFeature.USE_FAST_DOUBLE_WRITER).build()
    ).enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final ObjectWriter WRITER = JSON.writer(prettyPrinter());

    private JsonDocuments() {}

    public static String render(Map<String, Object> document) {
        try {
            return WRITER.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize document: " + ex.getOriginalMessage(), ex);
        }
    }

    public static byte[] bytes(Map<String, Object> document) {
        return render(document).getBytes(StandardCharsets.UTF_8);
    }

    public static String sha256(Map<String, Object> document) {
        return Digests.sha256Hex(bytes(document));
    }

    public static void write(Path target, Map<String, Object> document) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, bytes(document));
    }

    // "key": value, [] and {} for empty containers, line feeds regardless of the platform.
    private static DefaultPrettyPrinter prettyPrinter() {
        var separators = Separators.createDefaultInstance()
            .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
            .withObjectEmptySeparator("")
            .withArrayEmptySeparator("");
        var indenter = new DefaultIndenter("  ", "\n");
        var printer = new DefaultPrettyPrinter().withSeparators(separators);
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }

    static ObjectMapper mapper() {
        return JSON;
    }
}
