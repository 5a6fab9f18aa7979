package work.semiocore.kernel.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.semiocore.kernel.model.Context;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.OpKind;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.Stmt;

/**
 * Line-oriented parser for {@code .sc} sensing programs.
 *
 * <pre>
 * seed 12345
 * context Add(0.5) >> Sign {
 *   tick 1
 *   x := sense border
 *   commit x
 *   out := summarize
 * }
 * </pre>
 */
public final class ProgramParser {
    private static final String MEMORY_SOURCE = "<memory>";

    private static final Pattern SEED = Pattern.compile("^\\s*seed\\s+(\\d+)\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTEXT_OPEN = Pattern.compile("^\\s*context\\s+(.+?)\\s*\\{\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTEXT_CLOSE = Pattern.compile("^\\s*}\\s*$");
    private static final Pattern TICK = Pattern.compile("^\\s*tick\\s+([0-9]*\\.?[0-9]+)\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENSE = Pattern.compile(
        "^\\s*([A-Za-z_]\\w*)\\s*:=\\s*sense\\s+([A-Za-z_]\\w*)\\s*;?\\s*$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern COMMIT = Pattern.compile("^\\s*commit\\s+([A-Za-z_]\\w*)\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DO_BIAS = Pattern.compile(
        "^\\s*do\\s+add_bias\\(\\s*([+-]?[0-9]*\\.?[0-9]+)\\s*\\)\\s*;?\\s*$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern OUT_SUMMARIZE = Pattern.compile("^\\s*out\\s*:=\\s*summarize\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern OP = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*(?:\\(\\s*([+-]?[0-9]*\\.?[0-9]+)\\s*\\))?\\s*$");

    private ProgramParser() {}

    public static Program parseFile(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read program: " + path, ex);
        }
        return parse(text, path.toString());
    }

    public static Program parse(String text) {
        return parse(text, MEMORY_SOURCE);
    }

    public static Program parse(String text, String source) {
        Optional<Long> seed = Optional.empty();
        Context context = null;
        int contextLine = 0;
        var body = new ArrayList<Stmt>();
        var bodyLines = new ArrayList<Integer>();
        boolean inContext = false;

        String[] lines = text.split("\\R", -1);
        for (int index = 0; index < lines.length; index++) {
            int lineNo = index + 1;
            String line = stripComment(lines[index]);
            if (line.isEmpty()) {
                continue;
            }

            Matcher m = SEED.matcher(line);
            if (m.matches() && !inContext) {
                seed = Optional.of(parseSeed(m.group(1), source, lineNo));
                continue;
            }

            m = CONTEXT_OPEN.matcher(line);
            if (m.matches() && !inContext) {
                context = parseContext(m.group(1), source, lineNo);
                contextLine = lineNo;
                inContext = true;
                continue;
            }

            if (inContext && CONTEXT_CLOSE.matcher(line).matches()) {
                inContext = false;
                continue;
            }

            if (!inContext) {
                if (OUT_SUMMARIZE.matcher(line).matches()) {
                    body.add(new Stmt.OutSummarize());
                    bodyLines.add(lineNo);
                    continue;
                }
                throw new ProgramParseException("unexpected_top_level", source, lineNo,
                    "Unexpected top-level line (outside context): " + line);
            }

            Stmt stmt = parseStatement(line);
            if (stmt == null) {
                throw new ProgramParseException("unrecognized_statement", source, lineNo, "Unrecognized statement: " + line);
            }
            body.add(stmt);
            bodyLines.add(lineNo);
        }

        if (inContext) {
            throw new ProgramParseException("unclosed_context", source, contextLine, "Unclosed context block");
        }
        if (context == null) {
            throw new ProgramParseException("missing_context", source, 0, "Missing 'context ... { ... }' block");
        }
        if (body.stream().noneMatch(Stmt.OutSummarize.class::isInstance)) {
            throw new ProgramParseException("missing_summarize", source, 0, "Missing 'out := summarize;'");
        }
        checkCommitsFollowSenses(body, bodyLines, source);

        return new Program(seed, context, body);
    }

    /**
     * Parses a bare operator chain such as {@code Add(0.5)>>Sign}.
     */
    public static Context parseContext(String chain) {
        return parseContext(chain, MEMORY_SOURCE, 0);
    }

    private static Context parseContext(String chain, String source, int lineNo) {
        var ops = new ArrayList<Op>();
        for (String part : chain.split(">>", -1)) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            Matcher m = OP.matcher(token);
            if (!m.matches()) {
                throw new ProgramParseException("invalid_operator", source, lineNo, "Invalid operator in context: '" + token + "'");
            }
            ops.add(validateOp(m.group(1), m.group(2) == null ? null : Double.parseDouble(m.group(2)), source, lineNo));
        }
        if (ops.isEmpty()) {
            throw new ProgramParseException("empty_context", source, lineNo, "Context must contain at least one operator");
        }
        return new Context(ops);
    }

    private static Op validateOp(String name, Double arg, String source, int lineNo) {
        OpKind kind = OpKind.byName(name).orElseThrow(() -> new ProgramParseException(
            "unknown_operator", source, lineNo, "Unknown operator '" + name + "'; allowed: Add, JitterU, Sign"));
        if (kind.requiresArg() && arg == null) {
            throw new ProgramParseException("missing_operator_argument", source, lineNo,
                "Operator '" + name + "' requires a numeric argument, e.g. " + name + "(0.5)");
        }
        if (!kind.requiresArg() && arg != null) {
            throw new ProgramParseException("unexpected_operator_argument", source, lineNo,
                "Operator '" + name + "' takes no argument");
        }
        return new Op(name, arg);
    }

    private static Stmt parseStatement(String line) {
        Matcher m = TICK.matcher(line);
        if (m.matches()) {
            return new Stmt.Tick(Double.parseDouble(m.group(1)));
        }
        m = SENSE.matcher(line);
        if (m.matches()) {
            return new Stmt.Sense(m.group(1), m.group(2));
        }
        m = COMMIT.matcher(line);
        if (m.matches()) {
            return new Stmt.Commit(m.group(1));
        }
        m = DO_BIAS.matcher(line);
        if (m.matches()) {
            return new Stmt.DoAddBias(Double.parseDouble(m.group(1)));
        }
        if (OUT_SUMMARIZE.matcher(line).matches()) {
            return new Stmt.OutSummarize();
        }
        return null;
    }

    // Static forward check only: a sense anywhere earlier in the body satisfies a later commit.
    private static void checkCommitsFollowSenses(List<Stmt> body, List<Integer> lines, String source) {
        Set<String> sensed = new HashSet<>();
        for (int i = 0; i < body.size(); i++) {
            Stmt stmt = body.get(i);
            if (stmt instanceof Stmt.Sense sense) {
                sensed.add(sense.var());
            } else if (stmt instanceof Stmt.Commit commit && !sensed.contains(commit.var())) {
                throw new ProgramParseException("commit_before_sense", source, lines.get(i),
                    "commit " + commit.var() + " before sensing it");
            }
        }
    }

    private static long parseSeed(String digits, String source, int lineNo) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new ProgramParseException("seed_out_of_range", source, lineNo, "Seed does not fit in 64 bits: " + digits);
        }
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return (hash >= 0 ? line.substring(0, hash) : line).strip();
    }
}
