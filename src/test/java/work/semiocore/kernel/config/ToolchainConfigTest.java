package work.semiocore.kernel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.semiocore.kernel.shared.SemioException;

class ToolchainConfigTest {
    @TempDir
    Path tempDir;

    @Test
    void defaultsWithoutConfigFile() {
        assertEquals(ToolchainConfig.defaults(), ToolchainConfig.resolve(null, tempDir));
        assertEquals(new ToolchainConfig(Optional.empty(), 1, 10, 10, "Strict"), ToolchainConfig.defaults());
    }

    @Test
    void picksUpConfigInWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve(ToolchainConfig.FILE_NAME), String.join("\n",
            "[scan]",
            "max_perms = 12",
            "parallelism = 3",
            "",
            "[plasticity]",
            "window_size = 5",
            "protocol = \"Loose\"",
            ""
        ));
        var config = ToolchainConfig.resolve(null, tempDir);
        assertEquals(Optional.of(12), config.maxPermutations());
        assertEquals(3, config.parallelism());
        assertEquals(5, config.windowSize());
        assertEquals(10, config.windowStep());
        assertEquals("Loose", config.protocol());
    }

    @Test
    void explicitFileMustExist() {
        var ex = assertThrows(SemioException.class, () -> ToolchainConfig.resolve(tempDir.resolve("missing.toml"), tempDir));
        assertEquals("invalid_config", ex.code());
    }

    @Test
    void rejectsInvalidValues() throws Exception {
        assertInvalid("[scan]\nmax_perms = 0\n");
        assertInvalid("[scan]\nparallelism = 0\n");
        assertInvalid("[scan]\nparallelism = \"many\"\n");
        assertInvalid("[scan\nmax_perms = 1\n");
    }

    @Test
    void rejectsValuesBeyondIntRange() throws Exception {
        assertInvalid("[scan]\nmax_perms = 4294967297\n");
        assertInvalid("[plasticity]\nwindow_size = 3000000000\n");
    }

    private void assertInvalid(String content) throws Exception {
        Path file = tempDir.resolve("bad.toml");
        Files.writeString(file, content);
        var ex = assertThrows(SemioException.class, () -> ToolchainConfig.resolve(file, tempDir));
        assertEquals("invalid_config", ex.code(), ex.getMessage());
    }
}
