package work.semiocore.kernel.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.semiocore.kernel.engine.Trace;
import work.semiocore.kernel.json.JsonDocuments;

@CommandLine.Command(
    name = "run",
    description = "Execute a program against a world and write its trace (and manifest).",
    mixinStandardHelpOptions = true,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SemiocCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "PROGRAM", description = "Path to the .sc program.")
    private Path program;

    @CommandLine.Option(names = "--world", required = true, description = "World JSON/YAML file.")
    private Path world;

    @CommandLine.Option(names = "--emit-trace", required = true, description = "Output trace JSON path.")
    private Path emitTrace;

    @CommandLine.Option(
        names = "--emit-manifest",
        description = "Output manifest JSON path.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path emitManifest;

    @Override
    public Integer call() throws Exception {
        Trace trace = parent.toolchain().run(program, world);
        if (emitManifest != null) {
            JsonDocuments.write(emitManifest, parent.toolchain().manifest(program, world).toSerializableMap());
        }
        JsonDocuments.write(emitTrace, trace.toSerializableMap());
        SemiocCommand.ok(spec, emitTrace);
        return 0;
    }
}
