package work.semiocore.kernel.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.semiocore.kernel.parser.ProgramParser;

class CanonicalContextTest {
    @Test
    void rendersOperatorsWithoutSpaces() {
        var context = Context.of(Op.add(0.5), Op.sign(), Op.jitterU(0.05));
        assertEquals("Add(0.5)>>Sign>>JitterU(0.05)", context.canonical());
        assertEquals(context.canonical(), context.toString());
    }

    @Test
    void integralArgumentsDropTheFraction() {
        assertEquals("Add(1)", CanonicalContext.render(Op.add(1.0)));
        assertEquals("Add(-2)", CanonicalContext.render(Op.add(-2.0)));
    }

    @Test
    void renderedChainParsesBackToTheSameOperators() {
        var context = Context.of(Op.sign(), Op.add(-0.125), Op.jitterU(0.2));
        assertEquals(context, ProgramParser.parseContext(context.canonical()));
    }

    @Test
    void contextRequiresAtLeastOneOperator() {
        assertThrows(IllegalArgumentException.class, () -> new Context(List.of()));
    }

    @Test
    void operatorKindsResolveByExactName() {
        assertEquals(OpKind.ADD, Op.add(1).kind().orElseThrow());
        assertTrue(new Op("Scale", 2.0).kind().isEmpty());
        assertTrue(new Op("sign", null).kind().isEmpty());
    }
}
