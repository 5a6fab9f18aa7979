package work.semiocore.kernel.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.semiocore.kernel.model.Op;

class PermutationEnumeratorTest {
    private static final Op ADD = Op.add(0.5);
    private static final Op SIGN = Op.sign();
    private static final Op JITTER = Op.jitterU(0.1);

    @Test
    void distinctOperatorsYieldAllOrderingsBaselineFirst() {
        var perms = PermutationEnumerator.scanOrder(List.of(SIGN, ADD, JITTER), Optional.empty());
        assertEquals(List.of(
            List.of(SIGN, ADD, JITTER),
            List.of(ADD, JITTER, SIGN),
            List.of(ADD, SIGN, JITTER),
            List.of(JITTER, ADD, SIGN),
            List.of(JITTER, SIGN, ADD),
            List.of(SIGN, JITTER, ADD)
        ), perms);
    }

    @Test
    void uniquePermutationsAreSortedByNameThenArgument() {
        assertEquals(
            List.of(List.of(ADD, SIGN), List.of(SIGN, ADD)),
            PermutationEnumerator.uniquePermutations(List.of(SIGN, ADD))
        );
        var negative = Op.add(-1.0);
        assertEquals(
            List.of(List.of(negative, ADD), List.of(ADD, negative)),
            PermutationEnumerator.uniquePermutations(List.of(ADD, negative))
        );
    }

    @Test
    void equalOperatorsCollapse() {
        var perms = PermutationEnumerator.uniquePermutations(List.of(Op.add(1), Op.add(1), SIGN));
        assertEquals(List.of(
            List.of(Op.add(1), Op.add(1), SIGN),
            List.of(Op.add(1), SIGN, Op.add(1)),
            List.of(SIGN, Op.add(1), Op.add(1))
        ), perms);
    }

    @Test
    void argumentsEqualAtTwelveDecimalsAreTheSameOperator() {
        var a = Op.add(0.1);
        var b = Op.add(0.1 + 1e-15);
        var perms = PermutationEnumerator.uniquePermutations(List.of(a, b));
        assertEquals(1, perms.size());
        assertSame(a, perms.get(0).get(0));
        assertSame(b, perms.get(0).get(1));
    }

    @Test
    void truncatesAfterMovingBaselineToFront() {
        var perms = PermutationEnumerator.scanOrder(List.of(SIGN, ADD, JITTER), Optional.of(2));
        assertEquals(List.of(List.of(SIGN, ADD, JITTER), List.of(ADD, JITTER, SIGN)), perms);
        assertEquals(6, PermutationEnumerator.scanOrder(List.of(SIGN, ADD, JITTER), Optional.of(100)).size());
    }

    @Test
    void singleOperatorHasOnePermutation() {
        assertEquals(List.of(List.of(SIGN)), PermutationEnumerator.scanOrder(List.of(SIGN), Optional.empty()));
    }
}
