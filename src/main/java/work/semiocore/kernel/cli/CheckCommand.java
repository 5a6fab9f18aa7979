package work.semiocore.kernel.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "check",
    description = "Parse a program and optionally apply the Strict gate.",
    mixinStandardHelpOptions = true,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SemiocCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--strict", description = "Enable the Strict gate.")
    private boolean strict;

    @CommandLine.Parameters(index = "0", paramLabel = "PROGRAM", description = "Path to the .sc program.")
    private Path program;

    @Override
    public Integer call() {
        parent.toolchain().check(program, strict);
        SemiocCommand.ok(spec, program);
        return 0;
    }
}
