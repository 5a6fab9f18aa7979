package work.semiocore.kernel.scan;

import java.util.Comparator;
import java.util.List;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.shared.Decimals;

/**
 * Identity of an operator for deduplication and ordering: name plus argument rounded to 12
 * decimals, so float formatting noise never splits two equal operators.
 */
record OpKey(String name, Double arg) implements Comparable<OpKey> {
    private static final Comparator<OpKey> ORDER = Comparator
        .comparing(OpKey::name)
        .thenComparing(OpKey::arg, Comparator.nullsFirst(Comparator.naturalOrder()));

    static final Comparator<List<OpKey>> SEQUENCE_ORDER = (left, right) -> {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    };

    static OpKey of(Op op) {
        return new OpKey(op.name(), op.hasArg() ? Decimals.round(op.arg(), 12) : null);
    }

    static List<OpKey> of(List<Op> ops) {
        return ops.stream().map(OpKey::of).toList();
    }

    @Override
    public int compareTo(OpKey other) {
        return ORDER.compare(this, other);
    }
}
