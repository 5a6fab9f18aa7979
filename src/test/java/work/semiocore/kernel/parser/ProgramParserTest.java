package work.semiocore.kernel.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.semiocore.kernel.model.Context;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.Stmt;

class ProgramParserTest {
    @Test
    void parsesProgramFile() {
        var path = Path.of("src", "test", "resources", "programs", "e2_border.sc");
        var program = ProgramParser.parseFile(path);

        assertEquals(Optional.of(7L), program.seed());
        assertEquals(Context.of(Op.add(0.5), Op.sign()), program.context());
        assertEquals(
            List.of(new Stmt.Tick(1.0), new Stmt.Sense("x", "border"), new Stmt.Commit("x"), new Stmt.OutSummarize()),
            program.body()
        );
    }

    @Test
    void acceptsSemicolonsCommentsAndMixedCase() {
        var program = ProgramParser.parse(String.join("\n",
            "SEED 3;  # trailing comment",
            "Context Sign>>Add(+0.25) {",
            "  TICK .5;",
            "  v := SENSE bright;",
            "  do add_bias(-0.1);",
            "  Commit v;",
            "}",
            "out := summarize;"
        ));

        assertEquals(Optional.of(3L), program.seed());
        assertEquals("Sign>>Add(0.25)", program.context().canonical());
        assertEquals(new Stmt.Tick(0.5), program.body().get(0));
        assertEquals(new Stmt.DoAddBias(-0.1), program.body().get(2));
        assertInstanceOf(Stmt.OutSummarize.class, program.body().get(4));
    }

    @Test
    void reportsLineOfUnrecognizedStatement() {
        var ex = assertThrows(ProgramParseException.class, () -> ProgramParser.parse(String.join("\n",
            "context Sign {",
            "  tick 1",
            "  x = sense border",
            "  out := summarize",
            "}"
        ), "bad.sc"));
        assertEquals("unrecognized_statement", ex.code());
        assertEquals(3, ex.line());
        assertEquals("bad.sc", ex.source());
        assertTrue(ex.getMessage().endsWith(" at bad.sc:3"), ex.getMessage());
    }

    @Test
    void rejectsStructuralProblems() {
        assertCode("unexpected_top_level", "tick 1\ncontext Sign {\nout := summarize\n}");
        assertCode("unclosed_context", "context Sign {\n tick 1\n out := summarize");
        assertCode("missing_context", "seed 1\n");
        assertCode("missing_summarize", "context Sign {\n tick 1\n}");
        assertCode("commit_before_sense", "context Sign {\n tick 1\n commit x\n x := sense a\n out := summarize\n}");
    }

    @Test
    void unclosedContextPointsAtItsOpeningLine() {
        var ex = assertThrows(ProgramParseException.class,
            () -> ProgramParser.parse("seed 1\ncontext Sign {\n tick 1\n out := summarize"));
        assertEquals(2, ex.line());
    }

    @Test
    void rejectsBadOperators() {
        assertCode("unknown_operator", "context Scale(2) {\n out := summarize\n}");
        assertCode("missing_operator_argument", "context Add {\n out := summarize\n}");
        assertCode("unexpected_operator_argument", "context Sign(1) {\n out := summarize\n}");
        assertCode("invalid_operator", "context Add(x) {\n out := summarize\n}");
        assertCode("empty_context", "context >> {\n out := summarize\n}");
    }

    @Test
    void rejectsSeedBeyondLongRange() {
        assertCode("seed_out_of_range", "seed 99999999999999999999\ncontext Sign {\n out := summarize\n}");
    }

    @Test
    void laterContextBlockReplacesEarlierOne() {
        var program = ProgramParser.parse(String.join("\n",
            "context Sign {",
            "  tick 1",
            "}",
            "context Add(1) {",
            "  out := summarize",
            "}"
        ));
        assertEquals("Add(1)", program.context().canonical());
        assertEquals(2, program.body().size());
    }

    private static void assertCode(String code, String text) {
        var ex = assertThrows(ProgramParseException.class, () -> ProgramParser.parse(text));
        assertEquals(code, ex.code(), ex.getMessage());
    }
}
