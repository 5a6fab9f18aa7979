package work.semiocore.kernel.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.semiocore.kernel.shared.SemioException;

/**
 * Defaults for the scanner and analyzer, read from {@code semiocore.toml}:
 *
 * <pre>
 * [scan]
 * max_perms = 64
 * parallelism = 4
 *
 * [plasticity]
 * window_size = 10
 * window_step = 10
 * protocol = "Strict"
 * </pre>
 */
public record ToolchainConfig(
    Optional<Integer> maxPermutations,
    int parallelism,
    int windowSize,
    int windowStep,
    String protocol
) {
    public static final String FILE_NAME = "semiocore.toml";

    public static ToolchainConfig defaults() {
        return new ToolchainConfig(Optional.empty(), 1, 10, 10, "Strict");
    }

    /**
     * Loads {@code explicit} when given, else {@code semiocore.toml} in {@code workingDirectory}
     * when present, else the defaults.
     */
    public static ToolchainConfig resolve(Path explicit, Path workingDirectory) {
        if (explicit != null) {
            if (!Files.isRegularFile(explicit)) {
                throw new SemioException("invalid_config", "Config file not found: " + explicit);
            }
            return load(explicit);
        }
        Path candidate = workingDirectory.resolve(FILE_NAME);
        return Files.isRegularFile(candidate) ? load(candidate) : defaults();
    }

    public static ToolchainConfig load(Path path) {
        TomlParseResult result;
        try {
            result = Toml.parse(path);
        } catch (IOException ex) {
            throw new SemioException("invalid_config", "Failed to read config: " + path, ex);
        }
        if (result.hasErrors()) {
            throw new SemioException("invalid_config", "Invalid config " + path + ": " + result.errors().get(0).toString());
        }
        var defaults = defaults();
        try {
            Optional<Integer> maxPerms = Optional.ofNullable(result.getLong("scan.max_perms")).map(Math::toIntExact);
            int parallelism = intOr(result.getLong("scan.parallelism"), defaults.parallelism());
            int windowSize = intOr(result.getLong("plasticity.window_size"), defaults.windowSize());
            int windowStep = intOr(result.getLong("plasticity.window_step"), defaults.windowStep());
            String protocol = Optional.ofNullable(result.getString("plasticity.protocol")).orElse(defaults.protocol());
            if (maxPerms.isPresent() && maxPerms.get() < 1) {
                throw new SemioException("invalid_config", "scan.max_perms must be >= 1 in " + path);
            }
            if (parallelism < 1) {
                throw new SemioException("invalid_config", "scan.parallelism must be >= 1 in " + path);
            }
            return new ToolchainConfig(maxPerms, parallelism, windowSize, windowStep, protocol);
        } catch (TomlInvalidTypeException ex) {
            throw new SemioException("invalid_config", "Invalid config " + path + ": " + ex.getMessage(), ex);
        } catch (ArithmeticException ex) {
            throw new SemioException("invalid_config", "Integer setting out of range in " + path, ex);
        }
    }

    private static int intOr(Long value, int fallback) {
        return value == null ? fallback : Math.toIntExact(value);
    }
}
