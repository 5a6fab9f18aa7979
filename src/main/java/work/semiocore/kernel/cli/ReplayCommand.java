package work.semiocore.kernel.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.semiocore.kernel.json.JsonDocuments;

@CommandLine.Command(
    name = "replay",
    description = "Replay a run deterministically from its manifest.",
    mixinStandardHelpOptions = true,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE
)
final class ReplayCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SemiocCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--manifest", required = true, description = "Manifest JSON path.")
    private Path manifest;

    @CommandLine.Option(names = "--emit-trace", required = true, description = "Output trace JSON path.")
    private Path emitTrace;

    @Override
    public Integer call() throws Exception {
        JsonDocuments.write(emitTrace, parent.toolchain().replay(manifest).toSerializableMap());
        SemiocCommand.ok(spec, emitTrace);
        return 0;
    }
}
