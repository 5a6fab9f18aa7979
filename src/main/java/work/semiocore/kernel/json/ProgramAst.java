package work.semiocore.kernel.json;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.Stmt;

/**
 * AST document for a parsed program ({@code semiocore.ast.v1}) and the language manifest that
 * accompanies it ({@code semiocore.lang.v1}).
 */
public final class ProgramAst {
    public static final String SCHEMA = "semiocore.ast.v1";
    public static final String LANG_SCHEMA = "semiocore.lang.v1";
    public static final String LANG_VERSION = "1";

    private ProgramAst() {}

    public static Map<String, Object> document(Program program, String programFile) {
        var context = new ArrayList<Map<String, Object>>();
        for (Op op : program.context().ops()) {
            var node = new LinkedHashMap<String, Object>();
            node.put("op", op.name());
            if (op.hasArg()) {
                node.put("arg", op.arg());
            }
            context.add(node);
        }

        var ast = new LinkedHashMap<String, Object>();
        ast.put("node", "Program");
        ast.put("seed", program.seed().orElse(null));
        ast.put("context", context);
        ast.put("canonical_ctx", program.context().canonical());
        ast.put("body", statements(program.body()));

        var document = new LinkedHashMap<String, Object>();
        document.put("schema", SCHEMA);
        document.put("program_file", programFile);
        document.put("ast", ast);
        return document;
    }

    public static Map<String, Object> languageManifest(String programFile) {
        var document = new LinkedHashMap<String, Object>();
        document.put("schema", LANG_SCHEMA);
        document.put("program_file", programFile);
        document.put("lang_version", LANG_VERSION);
        document.put("features", List.of());
        document.put("ast_schema", SCHEMA);
        return document;
    }

    /**
     * Name recorded as {@code program_file}: relative to {@code workingDirectory} when the program
     * lies below it, otherwise as given; always with {@code /} separators.
     */
    public static String portableName(Path program, Path workingDirectory) {
        Path absolute = program.toAbsolutePath().normalize();
        Path base = workingDirectory.toAbsolutePath().normalize();
        Path name = absolute.startsWith(base) ? base.relativize(absolute) : program;
        return name.toString().replace(File.separatorChar, '/');
    }

    private static List<Map<String, Object>> statements(List<Stmt> body) {
        var nodes = new ArrayList<Map<String, Object>>(body.size());
        for (Stmt stmt : body) {
            var node = new LinkedHashMap<String, Object>();
            if (stmt instanceof Stmt.Tick tick) {
                node.put("node", "Tick");
                node.put("dt", tick.dt());
            } else if (stmt instanceof Stmt.Sense sense) {
                node.put("node", "Sense");
                node.put("var", sense.var());
                node.put("channel", sense.channel());
            } else if (stmt instanceof Stmt.Commit commit) {
                node.put("node", "Commit");
                node.put("var", commit.var());
            } else if (stmt instanceof Stmt.DoAddBias doBias) {
                node.put("node", "DoAddBias");
                node.put("value", doBias.value());
            } else {
                node.put("node", "OutSummarize");
            }
            nodes.add(node);
        }
        return nodes;
    }
}
