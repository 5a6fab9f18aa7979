package work.semiocore.kernel.scan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.semiocore.kernel.model.Op;

/**
 * Enumerates the distinct orderings of an operator chain in a platform-independent order.
 */
public final class PermutationEnumerator {
    private PermutationEnumerator() {}

    /**
     * Distinct permutations sorted by their operator keys. Among key-equal orderings the first one
     * in lexicographic index order is kept.
     */
    public static List<List<Op>> uniquePermutations(List<Op> ops) {
        if (ops.size() <= 1) {
            return List.of(List.copyOf(ops));
        }
        Map<List<OpKey>, List<Op>> unique = new LinkedHashMap<>();
        int[] indices = new int[ops.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        do {
            var perm = new ArrayList<Op>(indices.length);
            for (int index : indices) {
                perm.add(ops.get(index));
            }
            unique.putIfAbsent(OpKey.of(perm), List.copyOf(perm));
        } while (nextPermutation(indices));

        var sorted = new ArrayList<>(unique.entrySet());
        sorted.sort(Map.Entry.comparingByKey(OpKey.SEQUENCE_ORDER));
        var result = new ArrayList<List<Op>>(sorted.size());
        for (var entry : sorted) {
            result.add(entry.getValue());
        }
        return result;
    }

    /**
     * Scan order: unique permutations with the baseline moved to index 0, then truncated to
     * {@code maxPermutations} when given.
     */
    public static List<List<Op>> scanOrder(List<Op> baseline, Optional<Integer> maxPermutations) {
        var perms = new ArrayList<>(uniquePermutations(baseline));
        List<OpKey> baselineKey = OpKey.of(baseline);
        int baselineIndex = 0;
        for (int i = 0; i < perms.size(); i++) {
            if (OpKey.of(perms.get(i)).equals(baselineKey)) {
                baselineIndex = i;
                break;
            }
        }
        if (baselineIndex != 0) {
            perms.add(0, perms.remove(baselineIndex));
        }
        if (maxPermutations.isPresent() && maxPermutations.get() < perms.size()) {
            return List.copyOf(perms.subList(0, maxPermutations.get()));
        }
        return List.copyOf(perms);
    }

    // Rearranges indices into the next lexicographic permutation; false once the last one is reached.
    private static boolean nextPermutation(int[] indices) {
        int pivot = indices.length - 2;
        while (pivot >= 0 && indices[pivot] >= indices[pivot + 1]) {
            pivot--;
        }
        if (pivot < 0) {
            return false;
        }
        int successor = indices.length - 1;
        while (indices[successor] <= indices[pivot]) {
            successor--;
        }
        swap(indices, pivot, successor);
        for (int lo = pivot + 1, hi = indices.length - 1; lo < hi; lo++, hi--) {
            swap(indices, lo, hi);
        }
        return true;
    }

    private static void swap(int[] values, int i, int j) {
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }
}
