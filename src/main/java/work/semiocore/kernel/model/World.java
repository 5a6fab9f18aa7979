package work.semiocore.kernel.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Simulated world: named numeric channels.
 */
public record World(Map<String, Double> channels) {
    public World {
        Objects.requireNonNull(channels, "channels");
        channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    public boolean hasChannel(String name) {
        return channels.containsKey(name);
    }

    public double value(String name) {
        Double value = channels.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown channel in world: " + name);
        }
        return value;
    }
}
