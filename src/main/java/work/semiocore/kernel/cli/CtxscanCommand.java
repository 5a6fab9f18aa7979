package work.semiocore.kernel.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.semiocore.kernel.config.ToolchainConfig;
import work.semiocore.kernel.json.JsonDocuments;
import work.semiocore.kernel.scan.CtxScanReport;
import work.semiocore.kernel.scan.ScanOptions;

@CommandLine.Command(
    name = "ctxscan",
    description = "Scan context permutations and report a contextuality witness.",
    mixinStandardHelpOptions = true,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE
)
final class CtxscanCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SemiocCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "PROGRAM", description = "Path to the .sc program.")
    private Path program;

    @CommandLine.Option(names = "--world", required = true, description = "World JSON/YAML file.")
    private Path world;

    @CommandLine.Option(names = "--emit-report", required = true, description = "Output ctxscan report JSON path.")
    private Path emitReport;

    @CommandLine.Option(
        names = "--emit-dir",
        description = "Directory for per-permutation traces (perm_NN.trace.json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path emitDir;

    @CommandLine.Option(
        names = "--max-perms",
        description = "Cap on the number of permutations (default: scan.max_perms or no cap).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxPerms;

    @CommandLine.Option(
        names = "--parallelism",
        description = "Worker threads for permutation runs (default: scan.parallelism or 1).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer parallelism;

    @Override
    public Integer call() throws Exception {
        ToolchainConfig config = parent.config();
        var options = ScanOptions.builder()
            .maxPermutations(maxPerms != null ? Optional.of(maxPerms) : config.maxPermutations())
            .parallelism(parallelism != null ? parallelism : config.parallelism());
        if (emitDir != null) {
            Files.createDirectories(emitDir);
            options.traceSink((index, trace) -> {
                Path target = emitDir.resolve(String.format("perm_%02d.trace.json", index));
                JsonDocuments.write(target, trace.toSerializableMap());
                return target.toString();
            });
        }
        CtxScanReport report = parent.toolchain().ctxscan(program, world, options);
        JsonDocuments.write(emitReport, report.toSerializableMap());
        SemiocCommand.ok(spec, emitReport);
        return 0;
    }
}
