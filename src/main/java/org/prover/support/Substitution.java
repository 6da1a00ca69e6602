package org.prover.support;

import java.util.*;
import java.util.stream.Collectors;

/**
 * SOSTITUZIONE - Mappa finita variabile → termine
 *
 * Valore immutabile che preserva l'ordine di inserimento dei legami, così che la
 * forma testuale {x/socrates, y/plato} sia riproducibile nei log delle prove.
 *
 * COMPOSIZIONE s.compose(t):
 * 1. ogni legame di s riceve t applicata al proprio lato destro
 * 2. i legami di t con chiave non presente in s vengono aggiunti invariati
 *
 * L'applicazione a un termine è una singola ricerca: i legami non vengono seguiti
 * a catena.
 */
public final class Substitution {

    private static final Substitution EMPTY = new Substitution(Collections.emptyMap());

    /**
     * Legami variabile → termine in ordine di inserimento.
     * Invariante: mappa immutabile.
     */
    private final Map<String, String> bindings;

    private Substitution(Map<String, String> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    //region FACTORY METHODS

    /**
     * @return sostituzione senza legami
     */
    public static Substitution empty() {
        return EMPTY;
    }

    /**
     * Crea sostituzione con un singolo legame.
     *
     * @param variable variabile da legare
     * @param term termine associato
     * @throws IllegalArgumentException se variabile o termine sono null
     */
    public static Substitution of(String variable, String term) {
        if (variable == null || term == null) {
            throw new IllegalArgumentException("Legame con variabile o termine null non ammesso");
        }
        Map<String, String> single = new LinkedHashMap<>();
        single.put(variable, term);
        return new Substitution(single);
    }

    /**
     * Crea sostituzione da una mappa esistente (ordine della mappa preservato).
     */
    public static Substitution fromMap(Map<String, String> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            return EMPTY;
        }
        return new Substitution(bindings);
    }

    //endregion

    //region OPERAZIONI

    /**
     * Applica la sostituzione a un termine con una sola ricerca.
     *
     * @param term termine da sostituire
     * @return termine legato se presente, altrimenti il termine stesso
     */
    public String apply(String term) {
        String bound = bindings.get(term);
        return bound != null ? bound : term;
    }

    /**
     * Compone questa sostituzione con un'altra.
     *
     * @param other sostituzione applicata dopo questa
     * @return nuova sostituzione composta
     */
    public Substitution compose(Substitution other) {
        if (other == null || other.isEmpty()) {
            return this;
        }

        Map<String, String> composed = new LinkedHashMap<>();
        for (Map.Entry<String, String> binding : bindings.entrySet()) {
            composed.put(binding.getKey(), other.apply(binding.getValue()));
        }
        for (Map.Entry<String, String> binding : other.bindings.entrySet()) {
            composed.putIfAbsent(binding.getKey(), binding.getValue());
        }
        return new Substitution(composed);
    }

    //endregion

    //region ACCESSORS

    public boolean isBound(String variable) {
        return bindings.containsKey(variable);
    }

    /**
     * @return termine legato alla variabile, null se non legata
     */
    public String getBinding(String variable) {
        return bindings.get(variable);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }

    /**
     * @return vista immutabile dei legami in ordine di inserimento
     */
    public Map<String, String> asMap() {
        return bindings;
    }

    //endregion

    /**
     * Forma testuale {var/termine, ...} oppure {} se vuota.
     */
    @Override
    public String toString() {
        if (bindings.isEmpty()) {
            return "{}";
        }
        return bindings.entrySet().stream()
                .map(binding -> binding.getKey() + "/" + binding.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return bindings.equals(((Substitution) obj).bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }
}
