package work.semiocore.kernel.world;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WorldLoaderTest {
    private static final Path WORLDS = Path.of("src", "test", "resources", "worlds");

    @Test
    void loadsJsonWorldWithWrappedValues() {
        var world = WorldLoader.load(WORLDS.resolve("paper_world.json"));
        assertEquals(Map.of("border", -0.3, "bright", 0.3, "wrapped", 0.1), world.channels());
    }

    @Test
    void loadsYamlWorldWithDescriptors() {
        var world = WorldLoader.load(WORLDS.resolve("paper_world.yaml"));
        assertEquals(-0.3, world.value("border"));
        assertEquals(0.3, world.value("bright"));
        assertEquals(0.1, world.value("wrapped"));
    }

    @Test
    void wrapperKeysWinOverOtherFields() {
        var world = WorldLoader.fromJson("{\"channels\": {\"a\": {\"unit\": \"lux\", \"const\": 2}, \"b\": 1}}");
        assertEquals(2.0, world.value("a"));
        assertEquals(1.0, world.value("b"));
    }

    @Test
    void missingChannelsMeansEmptyWorld() {
        assertTrue(WorldLoader.fromJson("{}").channels().isEmpty());
    }

    @Test
    void rejectsUncoercibleValues() {
        assertInvalid("{\"channels\": {\"a\": \"bright\"}}");
        assertInvalid("{\"channels\": {\"a\": {\"p\": 1, \"q\": 2}}}");
        assertInvalid("{\"channels\": [1, 2]}");
        assertInvalid("[]");
        assertInvalid("{not json");
    }

    @Test
    void missingFileIsInvalidWorld() {
        var ex = assertThrows(WorldFormatException.class, () -> WorldLoader.load(WORLDS.resolve("absent.json")));
        assertEquals("invalid_world", ex.code());
    }

    private static void assertInvalid(String json) {
        var ex = assertThrows(WorldFormatException.class, () -> WorldLoader.fromJson(json));
        assertEquals("invalid_world", ex.code());
    }
}
