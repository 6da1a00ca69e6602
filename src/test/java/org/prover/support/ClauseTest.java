package org.prover.support;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class ClauseTest {

    private static Literal literal(boolean negated, String predicate, String... args) {
        return new Literal(negated, predicate, Arrays.asList(args));
    }

    @Test
    public void testLiteralRendering() {
        assertEquals("¬Loves(x, anna)", literal(true, "Loves", "x", "anna").render());
        assertEquals("Piove", Literal.atom(false, "Piove").render());
        assertEquals("¬Piove", Literal.atom(true, "Piove").render());
    }

    @Test
    public void testComplementaryLiterals() {
        Literal human = literal(false, "Human", "socrates");

        assertTrue(human.isComplementaryTo(literal(true, "Human", "x")));
        assertFalse(human.isComplementaryTo(literal(false, "Human", "x")));
        assertFalse(human.isComplementaryTo(literal(true, "Mortal", "socrates")));
    }

    @Test
    public void testLiteralSubstitution() {
        Literal substituted = literal(true, "Loves", "x", "y").withSubstitution(Substitution.of("x", "anna"));

        assertEquals("¬Loves(anna, y)", substituted.render());
    }

    @Test
    public void testEqualityIgnoresOrderAndDuplicates() {
        Clause first = Clause.of(literal(false, "P", "x"), literal(false, "Q", "y"));
        Clause second = Clause.of(literal(false, "Q", "y"), literal(false, "P", "x"), literal(false, "Q", "y"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(3, second.size());
        assertEquals("Q(y) ∨ P(x) ∨ Q(y)", second.render());
    }

    @Test
    public void testEmptyClause() {
        assertTrue(Clause.empty().isEmpty());
        assertEquals("", Clause.empty().render());
        assertEquals(Clause.empty(), new Clause(Collections.emptyList()));
        assertNotEquals(Clause.empty(), Clause.of(Literal.atom(false, "P")));
    }

    @Test
    public void testVariableClassification() {
        assertTrue(Term.isVariable("x"));
        assertTrue(Term.isVariable("a"));
        assertFalse(Term.isVariable("X"));
        assertFalse(Term.isVariable("xy"));
        assertFalse(Term.isVariable("socrates"));
        assertFalse(Term.isVariable("è"));
        assertFalse(Term.isVariable(""));
        assertTrue(Term.isConstant("f(x)"));
    }
}
