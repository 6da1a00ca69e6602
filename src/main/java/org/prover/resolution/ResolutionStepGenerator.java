package org.prover.resolution;

import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.Substitution;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GENERATORE PASSI DI RISOLUZIONE - Derivazione dei risolventi tra due clausole
 *
 * Per ogni coppia di letterali complementari (uno per clausola, stesso predicato,
 * polarità opposta) tenta l'unificazione degli argomenti. In caso di successo
 * costruisce il risolvente con:
 * 1. tutti gli altri letterali della prima clausola, poi della seconda
 * 2. la sostituzione applicata a ciascun letterale
 * 3. rimozione dei duplicati per forma testuale, mantenendo la prima occorrenza
 *
 * Una singola chiamata può produrre più risolventi indipendenti, uno per ogni
 * coppia unificabile. Il risolvente vuoto (⊥) è un risultato valido.
 */
public final class ResolutionStepGenerator {

    private static final Logger LOGGER = Logger.getLogger(ResolutionStepGenerator.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private ResolutionStepGenerator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * CORE: Calcola tutti i risolventi tra due clausole.
     *
     * Le coppie sono esaminate in ordine: letterali della prima clausola nel ciclo
     * esterno, letterali della seconda nel ciclo interno.
     *
     * @param clauseA prima clausola
     * @param clauseB seconda clausola
     * @return risolventi nell'ordine di scoperta, lista vuota se nessuna coppia unifica
     */
    public static List<Resolvent> resolve(Clause clauseA, Clause clauseB) {
        List<Resolvent> resolvents = new ArrayList<>();
        if (clauseA == null || clauseB == null) {
            return resolvents;
        }

        for (Literal literalA : clauseA.getLiterals()) {
            for (Literal literalB : clauseB.getLiterals()) {
                if (!literalA.isComplementaryTo(literalB)) {
                    continue;
                }

                Optional<Substitution> unifier = Unifier.unify(literalA.getArguments(), literalB.getArguments());
                if (unifier.isEmpty()) {
                    continue;
                }

                Substitution substitution = unifier.get();
                Clause derived = buildResolventClause(clauseA, literalA, clauseB, literalB, substitution);
                resolvents.add(new Resolvent(derived, substitution, literalA, literalB));

                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest(String.format("Risolvente su %s/%s con %s: %s",
                            literalA, literalB, substitution, derived));
                }
            }
        }

        return resolvents;
    }

    /**
     * Costruisce la clausola risolvente escludendo i letterali selezionati.
     */
    private static Clause buildResolventClause(Clause clauseA, Literal selectedA,
                                               Clause clauseB, Literal selectedB,
                                               Substitution substitution) {
        Map<String, Literal> remaining = new LinkedHashMap<>();

        collectRemainingLiterals(clauseA, selectedA, substitution, remaining);
        collectRemainingLiterals(clauseB, selectedB, substitution, remaining);

        return new Clause(new ArrayList<>(remaining.values()));
    }

    /**
     * Aggiunge i letterali diversi dal selezionato, sostituiti, senza duplicati testuali.
     */
    private static void collectRemainingLiterals(Clause clause, Literal selected,
                                                 Substitution substitution, Map<String, Literal> remaining) {
        for (Literal literal : clause.getLiterals()) {
            if (literal.equals(selected)) {
                continue;
            }
            Literal substituted = literal.withSubstitution(substitution);
            remaining.putIfAbsent(substituted.render(), substituted);
        }
    }
}
