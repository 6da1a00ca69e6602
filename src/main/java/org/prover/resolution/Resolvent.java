package org.prover.resolution;

import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.Substitution;

import java.util.Objects;

/**
 * RISOLVENTE - Esito immutabile di un singolo passo di risoluzione
 *
 * Incapsula la clausola derivata insieme ai dati che la giustificano:
 * • Sostituzione unificatrice usata sugli argomenti
 * • Letterale selezionato nella prima clausola
 * • Letterale selezionato nella seconda clausola
 *
 * Un risolvente con clausola vuota è testimone di contraddizione.
 */
public final class Resolvent {

    private final Clause clause;
    private final Substitution substitution;
    private final Literal selectedLiteralA;
    private final Literal selectedLiteralB;

    public Resolvent(Clause clause, Substitution substitution, Literal selectedLiteralA, Literal selectedLiteralB) {
        if (clause == null || substitution == null || selectedLiteralA == null || selectedLiteralB == null) {
            throw new IllegalArgumentException("Componenti del risolvente non possono essere null");
        }
        this.clause = clause;
        this.substitution = substitution;
        this.selectedLiteralA = selectedLiteralA;
        this.selectedLiteralB = selectedLiteralB;
    }

    public Clause getClause() {
        return clause;
    }

    public Substitution getSubstitution() {
        return substitution;
    }

    public Literal getSelectedLiteralA() {
        return selectedLiteralA;
    }

    public Literal getSelectedLiteralB() {
        return selectedLiteralB;
    }

    /**
     * Verifica se questo passo ha prodotto la clausola vuota ⊥.
     */
    public boolean isContradiction() {
        return clause.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Resolvent{%s ⨝ %s %s ⊢ %s}",
                selectedLiteralA, selectedLiteralB, substitution, clause);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Resolvent other = (Resolvent) obj;
        return clause.equals(other.clause) &&
                substitution.equals(other.substitution) &&
                selectedLiteralA.equals(other.selectedLiteralA) &&
                selectedLiteralB.equals(other.selectedLiteralB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clause, substitution, selectedLiteralA, selectedLiteralB);
    }
}
