package org.prover.support;

import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class SubstitutionTest {

    @Test
    public void testEmptySubstitutionRendersAsBraces() {
        assertEquals("{}", Substitution.empty().toString());
        assertTrue(Substitution.empty().isEmpty());
    }

    @Test
    public void testApplyIsSingleLookup() {
        Map<String, String> bindings = new LinkedHashMap<>();
        bindings.put("x", "y");
        bindings.put("y", "a");
        Substitution substitution = Substitution.fromMap(bindings);

        assertEquals("y", substitution.apply("x"));
        assertEquals("a", substitution.apply("y"));
        assertEquals("socrates", substitution.apply("socrates"));
    }

    @Test
    public void testComposeAppliesOtherToRightHandSides() {
        Map<String, String> other = new LinkedHashMap<>();
        other.put("y", "a");
        other.put("z", "b");

        Substitution composed = Substitution.of("x", "y").compose(Substitution.fromMap(other));

        assertEquals("a", composed.getBinding("x"));
        assertEquals("a", composed.getBinding("y"));
        assertEquals("b", composed.getBinding("z"));
        assertEquals("{x/a, y/a, z/b}", composed.toString());
    }

    @Test
    public void testComposeKeepsExistingKeys() {
        Substitution composed = Substitution.of("x", "a").compose(Substitution.of("x", "b"));

        assertEquals(1, composed.size());
        assertEquals("a", composed.getBinding("x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullBindingRejected() {
        Substitution.of("x", null);
    }
}
