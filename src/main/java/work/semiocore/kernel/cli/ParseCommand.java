package work.semiocore.kernel.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.semiocore.kernel.json.JsonDocuments;
import work.semiocore.kernel.json.ProgramAst;
import work.semiocore.kernel.model.Program;

@CommandLine.Command(
    name = "parse",
    description = "Parse a program and emit its AST (and optionally the language manifest) as JSON.",
    mixinStandardHelpOptions = true,
    exitCodeOnExecutionException = SemiocCommand.EXIT_FAILURE
)
final class ParseCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SemiocCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "PROGRAM", description = "Path to the .sc program.")
    private Path program;

    @CommandLine.Option(
        names = "--emit-ast",
        description = "Write the AST JSON to this file (default: stdout).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path emitAst;

    @CommandLine.Option(
        names = "--emit-lang",
        description = "Write the language manifest JSON to this file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path emitLang;

    @Override
    public Integer call() throws Exception {
        Program parsed = parent.toolchain().check(program, false);
        String programFile = ProgramAst.portableName(program, Path.of("").toAbsolutePath());

        if (emitLang != null) {
            JsonDocuments.write(emitLang, ProgramAst.languageManifest(programFile));
        }
        Map<String, Object> document = ProgramAst.document(parsed, programFile);
        if (emitAst == null) {
            spec.commandLine().getOut().print(JsonDocuments.render(document));
            spec.commandLine().getOut().flush();
        } else {
            JsonDocuments.write(emitAst, document);
            SemiocCommand.ok(spec, emitAst);
        }
        return 0;
    }
}
