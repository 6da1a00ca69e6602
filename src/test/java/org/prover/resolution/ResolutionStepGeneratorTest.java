package org.prover.resolution;

import org.junit.Test;
import org.prover.clause.ClauseParser;
import org.prover.support.Clause;

import java.util.List;

import static org.junit.Assert.*;

public class ResolutionStepGeneratorTest {

    private static List<Resolvent> resolve(String clauseA, String clauseB) {
        return ResolutionStepGenerator.resolve(ClauseParser.parseClause(clauseA), ClauseParser.parseClause(clauseB));
    }

    @Test
    public void testModusPonensResolvent() {
        List<Resolvent> resolvents = resolve("¬Human(x) ∨ Mortal(x)", "Human(socrates)");

        assertEquals(1, resolvents.size());
        Resolvent resolvent = resolvents.get(0);
        assertEquals("Mortal(socrates)", resolvent.getClause().render());
        assertEquals("{x/socrates}", resolvent.getSubstitution().toString());
        assertEquals("¬Human(x)", resolvent.getSelectedLiteralA().render());
        assertEquals("Human(socrates)", resolvent.getSelectedLiteralB().render());
        assertFalse(resolvent.isContradiction());
    }

    @Test
    public void testComplementaryUnitsGiveEmptyClause() {
        List<Resolvent> resolvents = resolve("P(a)", "¬P(a)");

        assertEquals(1, resolvents.size());
        assertTrue(resolvents.get(0).isContradiction());
        assertEquals(Clause.empty(), resolvents.get(0).getClause());
        assertTrue(resolvents.get(0).getSubstitution().isEmpty());
    }

    @Test
    public void testEveryComplementaryPairProducesResolvent() {
        List<Resolvent> resolvents = resolve("P(x) ∨ Q(x)", "¬P(alice) ∨ ¬Q(bob)");

        assertEquals(2, resolvents.size());
        assertEquals("Q(alice) ∨ ¬Q(bob)", resolvents.get(0).getClause().render());
        assertEquals("P(bob) ∨ ¬P(alice)", resolvents.get(1).getClause().render());
    }

    @Test
    public void testDuplicateLiteralsMerged() {
        List<Resolvent> resolvents = resolve("P(x) ∨ Q(alice)", "¬P(alice) ∨ Q(alice)");

        assertEquals(1, resolvents.size());
        assertEquals(1, resolvents.get(0).getClause().size());
        assertEquals("Q(alice)", resolvents.get(0).getClause().render());
    }

    @Test
    public void testSingleLetterArgumentsUnifyAsVariables() {
        List<Resolvent> resolvents = resolve("P(a)", "¬P(b)");

        assertEquals(1, resolvents.size());
        assertTrue(resolvents.get(0).isContradiction());
        assertEquals("{a/b}", resolvents.get(0).getSubstitution().toString());
    }

    @Test
    public void testNoResolventWithoutComplementaryUnifiablePair() {
        assertTrue(resolve("P(a)", "P(a)").isEmpty());
        assertTrue(resolve("P(a)", "¬P(a, b)").isEmpty());
        assertTrue(resolve("P(alice)", "¬P(bob)").isEmpty());
        assertTrue(resolve("P(a)", "¬Q(a)").isEmpty());
    }
}
