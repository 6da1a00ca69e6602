package org.prover.clause;

import org.junit.Test;
import org.prover.support.Clause;
import org.prover.support.Literal;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class ClauseParserTest {

    @Test
    public void testNegatedPredicateApplication() {
        Literal literal = ClauseParser.parseLiteral("¬Mortal(socrates)");

        assertTrue(literal.isNegated());
        assertEquals("Mortal", literal.getPredicate());
        assertEquals(Collections.singletonList("socrates"), literal.getArguments());
    }

    @Test
    public void testArgumentsAreTrimmed() {
        Literal literal = ClauseParser.parseLiteral("  Loves( x ,  y ) ");

        assertFalse(literal.isNegated());
        assertEquals("Loves", literal.getPredicate());
        assertEquals(Arrays.asList("x", "y"), literal.getArguments());
        assertEquals("Loves(x, y)", literal.render());
    }

    @Test
    public void testRepeatedNegationCollapses() {
        Literal literal = ClauseParser.parseLiteral("¬¬Q(b)");

        assertTrue(literal.isNegated());
        assertEquals("Q", literal.getPredicate());
    }

    @Test
    public void testEmptyArgumentListBecomesAtom() {
        Literal literal = ClauseParser.parseLiteral("P()");

        assertEquals("P", literal.getPredicate());
        assertEquals(0, literal.getArity());
        assertEquals(literal, ClauseParser.parseLiteral(literal.render()));
    }

    @Test
    public void testFallbackToPropositionalAtom() {
        Literal sentence = ClauseParser.parseLiteral("¬ Piove oggi");
        assertTrue(sentence.isNegated());
        assertEquals("Piove oggi", sentence.getPredicate());
        assertEquals(0, sentence.getArity());

        Literal unbalanced = ClauseParser.parseLiteral("P(a");
        assertEquals("P(a", unbalanced.getPredicate());
        assertEquals(0, unbalanced.getArity());
    }

    @Test
    public void testTrailingTextIgnoredAfterApplication() {
        Literal literal = ClauseParser.parseLiteral("P(a) extra");

        assertEquals("P", literal.getPredicate());
        assertEquals(Collections.singletonList("a"), literal.getArguments());
    }

    @Test
    public void testUnicodePredicateName() {
        Literal literal = ClauseParser.parseLiteral("Età_1(x)");

        assertEquals("Età_1", literal.getPredicate());
        assertEquals(Collections.singletonList("x"), literal.getArguments());
    }

    @Test
    public void testRenderedLiteralParsesBack() {
        Literal original = new Literal(true, "Owns", Arrays.asList("anna", "book"));

        assertEquals(original, ClauseParser.parseLiteral(original.render()));
    }

    @Test
    public void testClauseIdentityIgnoresOrderAndDuplicates() {
        Clause first = ClauseParser.parseClause("P(x) ∨ Q(y)");
        Clause second = ClauseParser.parseClause("Q(y)∨P(x) ∨ Q(y)");

        assertEquals(first, second);
        assertEquals(2, ClauseParser.parseClause("A(a)∨B(b)").size());
    }

    @Test
    public void testParseClausesKeepsOrder() {
        List<Clause> clauses = ClauseParser.parseClauses(Arrays.asList("Human(socrates)", "¬Mortal(socrates)"));

        assertEquals(2, clauses.size());
        assertEquals("Human(socrates)", clauses.get(0).render());
        assertEquals("¬Mortal(socrates)", clauses.get(1).render());
    }

    @Test
    public void testSplitFormulaListRespectsParentheses() {
        List<String> formulas = ClauseParser.splitFormulaList(
                "¬Human(x) ∨ Mortal(x), Human(socrates), ¬Mortal(socrates)");
        assertEquals(Arrays.asList("¬Human(x) ∨ Mortal(x)", "Human(socrates)", "¬Mortal(socrates)"), formulas);

        assertEquals(Arrays.asList("Loves(x, y)", "¬Loves(a, b)"),
                ClauseParser.splitFormulaList("Loves(x, y), ¬Loves(a, b)"));
    }

    @Test
    public void testSplitFormulaListDropsBlankSegments() {
        assertEquals(Collections.singletonList("P(a)"), ClauseParser.splitFormulaList(" , ,P(a),"));
        assertTrue(ClauseParser.splitFormulaList("").isEmpty());
    }
}
