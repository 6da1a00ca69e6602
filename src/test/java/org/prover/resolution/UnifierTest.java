package org.prover.resolution;

import org.junit.Test;
import org.prover.support.Substitution;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class UnifierTest {

    private static List<String> terms(String... values) {
        return Arrays.asList(values);
    }

    @Test
    public void testIdenticalConstantsGiveEmptySubstitution() {
        Optional<Substitution> result = Unifier.unify(terms("a"), terms("a"));

        assertTrue(result.isPresent());
        assertTrue(result.get().isEmpty());
    }

    @Test
    public void testDistinctConstantsFail() {
        assertFalse(Unifier.unify(terms("alice"), terms("bob")).isPresent());
    }

    @Test
    public void testSingleLetterTermsAreVariables() {
        Substitution substitution = Unifier.unify(terms("a"), terms("b")).orElseThrow();

        assertEquals(Collections.singletonMap("a", "b"), substitution.asMap());
        assertEquals("{a/b}", substitution.toString());
    }

    @Test
    public void testVariableBindsToConstant() {
        Substitution substitution = Unifier.unify(terms("x"), terms("socrates")).orElseThrow();

        assertEquals(Collections.singletonMap("x", "socrates"), substitution.asMap());
        assertEquals("{x/socrates}", substitution.toString());
    }

    @Test
    public void testVariableOnRightSide() {
        Substitution substitution = Unifier.unify(terms("socrates"), terms("x")).orElseThrow();

        assertEquals("socrates", substitution.getBinding("x"));
    }

    @Test
    public void testArityMismatchFails() {
        assertFalse(Unifier.unify(terms("a"), terms("a", "b")).isPresent());
    }

    @Test
    public void testRepeatedVariableMustAgree() {
        assertFalse(Unifier.unify(terms("x", "x"), terms("alice", "bob")).isPresent());
        assertEquals("{x/alice}", Unifier.unify(terms("x", "x"), terms("alice", "alice")).orElseThrow().toString());
    }

    @Test
    public void testBindingsAreComposed() {
        Substitution substitution = Unifier.unify(terms("x", "y"), terms("y", "alice")).orElseThrow();

        assertEquals("alice", substitution.getBinding("x"));
        assertEquals("alice", substitution.getBinding("y"));
    }

    @Test
    public void testCyclicBindingsTerminate() {
        Substitution substitution = Unifier.unify(terms("x", "y", "x"), terms("y", "x", "alice")).orElseThrow();

        assertEquals("alice", substitution.getBinding("x"));
        assertEquals("alice", substitution.getBinding("y"));
    }

    @Test
    public void testCompoundTermIsOpaqueConstant() {
        Substitution substitution = Unifier.unify(terms("x"), terms("f(x)")).orElseThrow();

        assertEquals("f(x)", substitution.getBinding("x"));
        assertFalse(Unifier.unify(terms("f(a)"), terms("f(b)")).isPresent());
    }

    @Test
    public void testInitialSubstitutionIsExtended() {
        Substitution substitution = Unifier.unify(terms("x"), terms("alice"), Substitution.of("y", "bob")).orElseThrow();

        assertEquals("bob", substitution.getBinding("y"));
        assertEquals("alice", substitution.getBinding("x"));
    }
}
