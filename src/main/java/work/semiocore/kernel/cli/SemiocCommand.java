package work.semiocore.kernel.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.semiocore.kernel.api.LogLevel;
import work.semiocore.kernel.api.SemioToolchain;
import work.semiocore.kernel.config.ToolchainConfig;

@CommandLine.Command(
    name = "semioc",
    description = "SemioCore toolchain: parse, run, replay, context-scan and analyze sensing programs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE,
    subcommands = {
        CheckCommand.class,
        ParseCommand.class,
        RunCommand.class,
        ReplayCommand.class,
        CtxscanCommand.class,
        PlasticityCommand.class
    }
)
final class SemiocCommand implements Callable<Integer> {
    static final int EXIT_FAILURE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--config",
        description = "Toolchain config (default: ./semiocore.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    // Created lazily: loggers must not initialize before --log-level has been applied.
    private SemioToolchain toolchain;
    private ToolchainConfig config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = "warn"
    )
    void setLogLevel(String raw) {
        LogLevel.from(raw).apply();
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_FAILURE;
    }

    SemioToolchain toolchain() {
        if (toolchain == null) {
            toolchain = new SemioToolchain();
        }
        return toolchain;
    }

    ToolchainConfig config() {
        if (config == null) {
            config = ToolchainConfig.resolve(configPath, Path.of("").toAbsolutePath());
        }
        return config;
    }

    static void ok(CommandLine.Model.CommandSpec spec, Object target) {
        spec.commandLine().getOut().println("OK: " + target);
    }
}
