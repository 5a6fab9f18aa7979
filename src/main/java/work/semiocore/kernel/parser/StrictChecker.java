package work.semiocore.kernel.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.OpKind;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.Stmt;

/**
 * Strict gate applied on top of a successful parse: known operators with correct arity, a single
 * trailing {@code out := summarize}, and positive ticks.
 */
public final class StrictChecker {
    private StrictChecker() {}

    public static List<String> violations(Program program) {
        var violations = new ArrayList<String>();
        for (Op op : program.context().ops()) {
            Optional<OpKind> kind = op.kind();
            if (kind.isEmpty()) {
                violations.add("Unknown operator '" + op.name() + "' in context. Allowed: [Add, JitterU, Sign]");
            } else if (kind.get().requiresArg() && !op.hasArg()) {
                violations.add("Operator '" + op.name() + "' requires a numeric argument, e.g. " + op.name() + "(0.5)");
            } else if (!kind.get().requiresArg() && op.hasArg()) {
                violations.add("Operator '" + op.name() + "' takes no argument; use '" + op.name() + "' not '" + op.name() + "(x)'");
            }
        }

        List<Stmt> body = program.body();
        var summarizePositions = new ArrayList<Integer>();
        for (int i = 0; i < body.size(); i++) {
            if (body.get(i) instanceof Stmt.OutSummarize) {
                summarizePositions.add(i);
            }
        }
        if (summarizePositions.size() != 1) {
            violations.add("Program must contain exactly one 'out := summarize;'. Found: " + summarizePositions.size());
        } else if (summarizePositions.get(0) != body.size() - 1) {
            violations.add("'out := summarize;' must be the last statement in the context block (Strict).");
        }

        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.Tick tick && !(tick.dt() > 0.0)) {
                violations.add("tick dt must be > 0");
                break;
            }
        }
        return violations;
    }

    public static void check(Program program, String source) {
        List<String> violations = violations(program);
        if (!violations.isEmpty()) {
            throw new ProgramParseException("strict_violation", source, 0, String.join("; ", violations));
        }
    }
}
