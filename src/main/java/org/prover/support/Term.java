package org.prover.support;

/**
 * TERMINE - Classificazione dei token argomento dei letterali
 *
 * Un termine è un token testuale senza struttura interna. La classificazione è
 * puramente sintattica:
 * • Variabile: esattamente una lettera ASCII minuscola (x, y, z, ...)
 * • Costante: qualsiasi altro testo, trattato come simbolo opaco
 *
 * Non esistono termini funzionali annidati: "f(x)" è una costante.
 */
public final class Term {

    /**
     * Previene istanziazione - classe utility
     */
    private Term() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Verifica se il termine è una variabile.
     *
     * @param term testo del termine
     * @return true se il termine è una singola lettera ASCII minuscola
     */
    public static boolean isVariable(String term) {
        if (term == null || term.length() != 1) {
            return false;
        }
        char symbol = term.charAt(0);
        return symbol >= 'a' && symbol <= 'z';
    }

    /**
     * Verifica se il termine è una costante (tutto ciò che non è variabile).
     */
    public static boolean isConstant(String term) {
        return term != null && !isVariable(term);
    }
}
