package work.semiocore.kernel.world;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.semiocore.kernel.model.World;

/**
 * Loads world files (JSON, or YAML for {@code .yaml}/{@code .yml}) into a flat channel map.
 * Channel values may be plain numbers or wrappers such as {@code {"value": 0.1}}.
 */
public final class WorldLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final List<String> WRAPPER_KEYS = List.of("value", "const", "s", "signal");

    private WorldLoader() {}

    public static World load(Path path) {
        JsonNode root;
        try (var in = Files.newInputStream(path)) {
            root = mapperFor(path).readTree(in);
        } catch (IOException ex) {
            throw new WorldFormatException("Failed to read world: " + path + " (" + ex.getMessage() + ")", ex);
        }
        return fromTree(root, path.toString());
    }

    public static World fromJson(String json) {
        try {
            return fromTree(JSON_MAPPER.readTree(json), "<memory>");
        } catch (IOException ex) {
            throw new WorldFormatException("Invalid world JSON: " + ex.getMessage(), ex);
        }
    }

    static World fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new WorldFormatException("World document must be an object: " + source);
        }
        JsonNode rawChannels = root.path("channels");
        if (rawChannels.isMissingNode() || rawChannels.isNull()) {
            return new World(Map.of());
        }
        if (!rawChannels.isObject()) {
            throw new WorldFormatException("world must contain an object 'channels' mapping names to values/descriptors: " + source);
        }
        var channels = new LinkedHashMap<String, Double>();
        Iterator<Map.Entry<String, JsonNode>> fields = rawChannels.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            channels.put(entry.getKey(), coerce(entry.getKey(), entry.getValue()));
        }
        return new World(channels);
    }

    private static double coerce(String channel, JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isObject()) {
            for (String key : WRAPPER_KEYS) {
                if (node.has(key)) {
                    return coerce(channel, node.get(key));
                }
            }
            if (node.size() == 1) {
                return coerce(channel, node.elements().next());
            }
            var keys = new ArrayList<String>();
            node.fieldNames().forEachRemaining(keys::add);
            throw new WorldFormatException("Cannot coerce channel '" + channel + "' descriptor to float. Keys=" + keys);
        }
        throw new WorldFormatException("Cannot coerce channel '" + channel + "' value to float. Type=" + node.getNodeType());
    }

    private static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
    }
}
