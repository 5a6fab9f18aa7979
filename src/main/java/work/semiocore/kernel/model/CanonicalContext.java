package work.semiocore.kernel.model;

import java.util.List;
import java.util.StringJoiner;
import work.semiocore.kernel.shared.Decimals;

/**
 * Renders operator chains as {@code Op1>>Op2>>...}. The string is an audit artifact and the
 * identity used in witness reports; operator equality goes through the scanner's keys instead.
 */
public final class CanonicalContext {
    public static final String SEPARATOR = ">>";

    private CanonicalContext() {}

    public static String render(Context context) {
        return render(context.ops());
    }

    public static String render(List<Op> ops) {
        var joiner = new StringJoiner(SEPARATOR);
        for (Op op : ops) {
            joiner.add(render(op));
        }
        return joiner.toString();
    }

    public static String render(Op op) {
        if (!op.hasArg()) {
            return op.name();
        }
        return op.name() + "(" + Decimals.formatMinimal(op.arg()) + ")";
    }
}
