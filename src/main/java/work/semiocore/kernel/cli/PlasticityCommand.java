package work.semiocore.kernel.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.semiocore.kernel.config.ToolchainConfig;
import work.semiocore.kernel.json.JsonDocuments;
import work.semiocore.kernel.plasticity.PlasticityReport;
import work.semiocore.kernel.plasticity.PlasticityRequest;

@CommandLine.Command(
    name = "plasticity",
    description = "Compute a plasticity report from one or more trace files.",
    mixinStandardHelpOptions = true,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE
)
final class PlasticityCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SemiocCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--traces", required = true, arity = "1..*", description = "Trace JSON files.")
    private List<Path> traces = new ArrayList<>();

    @CommandLine.Option(names = "--ctx", required = true, description = "Context to analyze (matches events[].ctx).")
    private String ctx;

    @CommandLine.Option(names = "--channel", required = true, description = "Channel to analyze (matches events[].ch).")
    private String channel;

    @CommandLine.Option(
        names = "--protocol",
        description = "Protocol label for the report (default: plasticity.protocol or Strict).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String protocol;

    @CommandLine.Option(
        names = "--window-size",
        description = "Event window size (default: plasticity.window_size or 10).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer windowSize;

    @CommandLine.Option(
        names = "--window-step",
        description = "Event window step (default: plasticity.window_step or 10).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer windowStep;

    @CommandLine.Option(
        names = "--program-file",
        description = "Program file to embed in the report (default: first trace's program_file).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String programFile;

    @CommandLine.Option(names = "--emit-report", required = true, description = "Output plasticity report JSON path.")
    private Path emitReport;

    @Override
    public Integer call() throws Exception {
        ToolchainConfig config = parent.config();
        var request = new PlasticityRequest(
            ctx,
            channel,
            windowSize != null ? windowSize : config.windowSize(),
            windowStep != null ? windowStep : config.windowStep(),
            protocol != null ? protocol : config.protocol(),
            Optional.ofNullable(programFile)
        );
        PlasticityReport report = parent.toolchain().plasticity(traces, request);
        JsonDocuments.write(emitReport, report.toSerializableMap());
        SemiocCommand.ok(spec, emitReport);
        return 0;
    }
}
