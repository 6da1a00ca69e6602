package org.prover.support;

import java.util.*;

/**
 * LETTERALE PREDICATIVO - Applicazione di predicato eventualmente negata
 *
 * Rappresenta un letterale della forma [¬]Nome(arg1, arg2, ...) oppure [¬]Nome
 * per predicati nullari. Valore immutabile: due letterali sono uguali se coincidono
 * polarità, nome del predicato e sequenza ordinata degli argomenti.
 *
 * FORMATO TESTUALE:
 * • Human(socrates)      → positivo, predicato Human, argomenti [socrates]
 * • ¬Loves(x, y)         → negato, predicato Loves, argomenti [x, y]
 * • ¬Piove               → negato, predicato nullario Piove
 *
 * Gli argomenti sono termini opachi classificati da {@link Term}.
 */
public final class Literal {

    /** Simbolo di negazione usato in input e in output */
    public static final String NEGATION = "¬";

    //region ATTRIBUTI CORE

    private final boolean negated;

    private final String predicate;

    /**
     * Argomenti ordinati del predicato.
     * Invariante: lista immutabile, vuota per predicati nullari.
     */
    private final List<String> arguments;

    /** Forma testuale calcolata una sola volta, usata per uguaglianza delle clausole */
    private final String rendered;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce letterale con copia difensiva degli argomenti.
     *
     * @param negated true se il letterale è negato
     * @param predicate nome del predicato (non null)
     * @param arguments argomenti ordinati (null equivale a lista vuota)
     * @throws IllegalArgumentException se il predicato è null
     */
    public Literal(boolean negated, String predicate, List<String> arguments) {
        if (predicate == null) {
            throw new IllegalArgumentException("Nome predicato non può essere null");
        }

        this.negated = negated;
        this.predicate = predicate;
        this.arguments = arguments != null ?
                Collections.unmodifiableList(new ArrayList<>(arguments)) :
                Collections.emptyList();
        this.rendered = buildRendering();
    }

    /**
     * Crea letterale nullario (senza argomenti).
     */
    public static Literal atom(boolean negated, String predicate) {
        return new Literal(negated, predicate, Collections.emptyList());
    }

    //endregion

    //region OPERAZIONI LOGICHE

    /**
     * Verifica se questo letterale è complementare all'altro: stesso predicato,
     * polarità opposta. Gli argomenti non sono confrontati (compito dell'unificazione).
     *
     * @param other letterale da confrontare
     * @return true se i due letterali possono essere risolti tra loro
     */
    public boolean isComplementaryTo(Literal other) {
        return other != null && negated != other.negated && predicate.equals(other.predicate);
    }

    /**
     * Applica una sostituzione a ogni argomento del letterale.
     *
     * @param substitution sostituzione da applicare
     * @return nuovo letterale con argomenti sostituiti
     */
    public Literal withSubstitution(Substitution substitution) {
        if (substitution == null || substitution.isEmpty() || arguments.isEmpty()) {
            return this;
        }

        List<String> substituted = new ArrayList<>(arguments.size());
        for (String argument : arguments) {
            substituted.add(substitution.apply(argument));
        }
        return new Literal(negated, predicate, substituted);
    }

    //endregion

    //region ACCESSORS

    public boolean isNegated() {
        return negated;
    }

    public String getPredicate() {
        return predicate;
    }

    /**
     * @return argomenti immutabili del predicato
     */
    public List<String> getArguments() {
        return arguments;
    }

    public int getArity() {
        return arguments.size();
    }

    //endregion

    //region FORMATAZIONE

    private String buildRendering() {
        StringBuilder text = new StringBuilder();
        if (negated) {
            text.append(NEGATION);
        }
        text.append(predicate);
        if (!arguments.isEmpty()) {
            text.append('(').append(String.join(", ", arguments)).append(')');
        }
        return text.toString();
    }

    /**
     * Forma testuale canonica: [¬]Nome(arg1, arg2) oppure [¬]Nome.
     */
    public String render() {
        return rendered;
    }

    @Override
    public String toString() {
        return rendered;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Literal other = (Literal) obj;
        return negated == other.negated &&
                predicate.equals(other.predicate) &&
                arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(negated, predicate, arguments);
    }

    //endregion
}
