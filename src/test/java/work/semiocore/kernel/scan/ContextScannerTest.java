package work.semiocore.kernel.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.semiocore.kernel.engine.ExecutionEngine;
import work.semiocore.kernel.engine.Trace;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.World;
import work.semiocore.kernel.parser.ProgramParser;

class ContextScannerTest {
    private static final World WORLD = new World(Map.of("border", -0.3, "bright", 0.3, "wrapped", 0.1));

    @Test
    void reportsWitnessWhenOrderFlipsOutcome() {
        var report = ContextScanner.scan(singleCommit("Add(0.5) >> Sign", "border"), WORLD, ScanOptions.builder().build());

        assertFalse(report.noncontextual());
        assertEquals("Add(0.5)>>Sign", report.baselineCtx());
        assertEquals(1.0, report.dkappaMax());
        var witness = report.witness().orElseThrow();
        assertEquals(1, witness.permIndex());
        assertEquals("Sign>>Add(0.5)", witness.ctx());
        assertEquals(1, witness.diffStep());
        assertEquals("AFFIRM", witness.baselineObj());
        assertEquals("NEGATE", witness.obj());

        assertEquals(2, report.permutations().size());
        assertEquals(0, report.permutations().get(0).index());
        assertEquals(0.0, report.permutations().get(0).dkappa());
        assertEquals(1.0, report.permutations().get(1).dkappa());
    }

    @Test
    void commutingReadingIsNoncontextual() {
        var report = ContextScanner.scan(singleCommit("Add(0.5) >> Sign", "bright"), WORLD, ScanOptions.builder().build());
        assertTrue(report.noncontextual());
        assertTrue(report.witness().isEmpty());
        assertEquals(0.0, report.dkappaMax());
        assertNull(report.toSerializableMap().get("witness"));
    }

    @Test
    void witnessPointsAtFirstDifferingStep() {
        var program = ProgramParser.parse(String.join("\n",
            "context Sign >> Add(0.5) {",
            "  tick 1",
            "  b := sense bright",
            "  commit b",
            "  x := sense border",
            "  commit x",
            "  out := summarize",
            "}"
        ));
        var report = ContextScanner.scan(program, WORLD, ScanOptions.builder().build());
        var witness = report.witness().orElseThrow();
        assertEquals(2, witness.diffStep());
        assertEquals("NEGATE", witness.baselineObj());
        assertEquals("AFFIRM", witness.obj());
        assertEquals(0.5, report.dkappaMax());
    }

    @Test
    void parallelScanMatchesSequentialScan() {
        var program = ProgramParser.parse(String.join("\n",
            "seed 99",
            "context Add(0.5) >> Sign >> JitterU(0.05) >> Add(-0.2) {",
            "  tick 1",
            "  x := sense border",
            "  commit x",
            "  w := sense wrapped",
            "  commit w",
            "  out := summarize",
            "}"
        ));
        var sequential = ContextScanner.scan(program, WORLD, ScanOptions.builder().build());
        var parallel = ContextScanner.scan(program, WORLD, ScanOptions.builder().parallelism(4).build());
        assertEquals(24, sequential.permutations().size());
        assertEquals(sequential, parallel);
    }

    @Test
    void sinkReceivesEveryPermutationInIndexOrder() {
        var seen = new ArrayList<Integer>();
        TraceSink sink = (index, trace) -> {
            seen.add(index);
            return "perm_" + index + ".json";
        };
        var report = ContextScanner.scan(
            singleCommit("Add(0.5) >> Sign", "border"),
            WORLD,
            ScanOptions.builder().parallelism(2).traceSink(sink).build()
        );
        assertEquals(List.of(0, 1), seen);
        assertEquals(Optional.of("perm_1.json"), report.permutations().get(1).traceFile());
    }

    @Test
    void maxPermutationsCapsTheScan() {
        var report = ContextScanner.scan(
            singleCommit("Add(0.5) >> Sign", "border"),
            WORLD,
            ScanOptions.builder().maxPermutations(Optional.of(1)).build()
        );
        assertEquals(1, report.permutations().size());
        assertTrue(report.noncontextual());
    }

    @Test
    void failingPermutationAbortsTheScan() {
        var ex = assertThrows(ScanException.class,
            () -> ContextScanner.scan(singleCommit("JitterU(0.1) >> Sign", "bright"), WORLD, ScanOptions.builder().build()));
        assertEquals("rng_required", ex.code());
        assertEquals(0, ex.permutationIndex());
    }

    @Test
    void rejectsInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> ScanOptions.builder().maxPermutations(Optional.of(0)).build());
        assertThrows(IllegalArgumentException.class, () -> ScanOptions.builder().parallelism(0).build());
    }

    @Test
    void baselineSummaryMatchesDirectRun() {
        Program program = singleCommit("Sign >> Add(0.5)", "border");
        Trace direct = ExecutionEngine.run(program, WORLD, "<memory>");
        var report = ContextScanner.scan(program, WORLD, ScanOptions.builder().build());
        assertEquals(direct.summary(), report.baselineSummary());
    }

    private static Program singleCommit(String chain, String channel) {
        return ProgramParser.parse(
            "context " + chain + " {\n tick 1\n x := sense " + channel + "\n commit x\n out := summarize\n}");
    }
}
