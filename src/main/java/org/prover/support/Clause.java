package org.prover.support;

import java.util.*;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Disgiunzione di letterali con doppia vista lista/insieme
 *
 * La clausola mantiene due rappresentazioni dello stesso contenuto:
 * • Lista ordinata dei letterali: usata per la risoluzione posizionale e per l'output
 * • Insieme delle forme testuali dei letterali: usato per uguaglianza e hashing
 *
 * Due clausole sono uguali se i rispettivi insiemi di letterali coincidono,
 * indipendentemente da ordine e duplicati:
 *   P(x) ∨ Q(y)  ==  Q(y) ∨ P(x) ∨ Q(y)
 *
 * La clausola senza letterali è la clausola vuota (⊥), testimone di contraddizione.
 */
public final class Clause {

    /** Separatore di disgiunzione usato in input e in output */
    public static final String DISJUNCTION = "∨";

    private static final Clause EMPTY = new Clause(Collections.emptyList());

    //region STRUTTURE DATI CORE

    /**
     * Letterali nell'ordine dichiarato.
     * Invariante: lista immutabile, può contenere duplicati.
     */
    private final List<Literal> literals;

    /**
     * Forme testuali dei letterali, base di equals/hashCode.
     * Invariante: insieme immutabile derivato da literals.
     */
    private final Set<String> literalKeys;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce clausola dai letterali nell'ordine dato.
     *
     * @param literals letterali della disgiunzione (null equivale a clausola vuota)
     * @throws IllegalArgumentException se un letterale è null
     */
    public Clause(List<Literal> literals) {
        List<Literal> copy = literals != null ? new ArrayList<>(literals) : new ArrayList<>();
        Set<String> keys = new LinkedHashSet<>();

        for (Literal literal : copy) {
            if (literal == null) {
                throw new IllegalArgumentException("Clausola contiene letterale null");
            }
            keys.add(literal.render());
        }

        this.literals = Collections.unmodifiableList(copy);
        this.literalKeys = Collections.unmodifiableSet(keys);
    }

    /**
     * @return la clausola vuota (⊥)
     */
    public static Clause empty() {
        return EMPTY;
    }

    /**
     * Crea clausola da letterali espliciti.
     */
    public static Clause of(Literal... literals) {
        return new Clause(Arrays.asList(literals));
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return true se la clausola non contiene letterali (contraddizione)
     */
    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    //endregion

    //region FORMATAZIONE E UGUAGLIANZA

    /**
     * Forma testuale: letterali uniti da " ∨ " nell'ordine dichiarato.
     * La clausola vuota produce stringa vuota; il marcatore ⊥ è responsabilità del logger.
     */
    public String render() {
        return literals.stream()
                .map(Literal::render)
                .collect(Collectors.joining(" " + DISJUNCTION + " "));
    }

    @Override
    public String toString() {
        return isEmpty() ? "⊥" : render();
    }

    /**
     * Uguaglianza insiemistica sui letterali: ignora ordine e duplicati.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Clause other = (Clause) obj;
        return literalKeys.equals(other.literalKeys);
    }

    @Override
    public int hashCode() {
        return literalKeys.hashCode();
    }

    //endregion
}
