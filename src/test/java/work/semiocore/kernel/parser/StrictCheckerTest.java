package work.semiocore.kernel.parser;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.semiocore.kernel.model.Context;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.Stmt;

class StrictCheckerTest {
    private static final Path PROGRAMS = Path.of("src", "test", "resources", "programs");

    @Test
    void wellFormedProgramPasses() {
        var program = ProgramParser.parseFile(PROGRAMS.resolve("e2_border.sc"));
        assertTrue(StrictChecker.violations(program).isEmpty());
        assertDoesNotThrow(() -> StrictChecker.check(program, "e2_border.sc"));
    }

    @Test
    void summarizeMustBeLast() {
        var program = ProgramParser.parseFile(PROGRAMS.resolve("loose.sc"));
        var ex = assertThrows(ProgramParseException.class, () -> StrictChecker.check(program, "loose.sc"));
        assertEquals("strict_violation", ex.code());
        assertTrue(ex.getMessage().contains("must be the last statement"), ex.getMessage());
    }

    @Test
    void collectsEveryViolation() {
        var program = new Program(
            Optional.empty(),
            Context.of(new Op("Scale", 2.0), new Op("Add", null)),
            List.of(new Stmt.Tick(0.0), new Stmt.OutSummarize(), new Stmt.OutSummarize())
        );
        List<String> violations = StrictChecker.violations(program);
        assertEquals(4, violations.size(), violations.toString());
        assertTrue(violations.get(0).startsWith("Unknown operator 'Scale'"));
        assertTrue(violations.get(2).contains("Found: 2"));
        assertEquals("tick dt must be > 0", violations.get(3));
    }
}
