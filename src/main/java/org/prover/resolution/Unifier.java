package org.prover.resolution;

import org.prover.support.Substitution;
import org.prover.support.Term;

import java.util.*;
import java.util.logging.Logger;

/**
 * UNIFICATORE - Calcolo della sostituzione che rende identiche due liste di argomenti
 *
 * Scorre le coppie di termini da sinistra a destra accumulando una sostituzione:
 * - termini identici: consumati senza nuovi legami
 * - variabile a sinistra già legata: sostituita dal proprio legame e ritentata
 * - variabile a sinistra libera: legata al termine di destra e composta
 * - solo il termine di destra è variabile: l'orientamento delle coppie restanti
 *   viene invertito e la coppia ritentata
 * - due costanti diverse: fallimento, senza backtracking
 *
 * LIMITAZIONE PRESERVATA: nessun occurs-check. Con termini piatti una variabile può
 * essere legata a qualsiasi termine, inclusa un'altra variabile che la raggiunge.
 *
 * Le catene di legami possono chiudersi su sé stesse (x/y poi y/x produce x/x):
 * se l'inseguimento di un legame torna su una variabile già visitata per la stessa
 * coppia, la variabile viene trattata come libera.
 */
public final class Unifier {

    private static final Logger LOGGER = Logger.getLogger(Unifier.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private Unifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Unifica due liste di argomenti partendo dalla sostituzione vuota.
     *
     * @param terms1 argomenti del primo letterale
     * @param terms2 argomenti del secondo letterale
     * @return sostituzione unificatrice, vuoto se l'unificazione fallisce
     */
    public static Optional<Substitution> unify(List<String> terms1, List<String> terms2) {
        return unify(terms1, terms2, Substitution.empty());
    }

    /**
     * Unifica due liste di argomenti estendendo una sostituzione esistente.
     *
     * @param terms1 argomenti del primo letterale
     * @param terms2 argomenti del secondo letterale
     * @param initial sostituzione di partenza
     * @return sostituzione unificatrice, vuoto se arità diversa o costanti incompatibili
     */
    public static Optional<Substitution> unify(List<String> terms1, List<String> terms2, Substitution initial) {
        if (terms1 == null || terms2 == null || terms1.size() != terms2.size()) {
            LOGGER.finest("Unificazione fallita: arità diversa");
            return Optional.empty();
        }

        List<String> left = new ArrayList<>(terms1);
        List<String> right = new ArrayList<>(terms2);
        Substitution substitution = initial != null ? initial : Substitution.empty();

        // Variabili già inseguite per la coppia corrente, azzerate a ogni avanzamento
        Set<String> chased = new HashSet<>();
        int position = 0;

        while (position < left.size()) {
            String leftTerm = left.get(position);
            String rightTerm = right.get(position);

            if (leftTerm.equals(rightTerm)) {
                position++;
                chased.clear();
                continue;
            }

            if (Term.isVariable(leftTerm)) {
                if (substitution.isBound(leftTerm) && chased.add(leftTerm)) {
                    left.set(position, substitution.getBinding(leftTerm));
                    continue;
                }

                substitution = substitution.compose(Substitution.of(leftTerm, rightTerm));
                position++;
                chased.clear();
                continue;
            }

            if (Term.isVariable(rightTerm)) {
                List<String> swap = left;
                left = right;
                right = swap;
                continue;
            }

            LOGGER.finest("Unificazione fallita: " + leftTerm + " ≠ " + rightTerm);
            return Optional.empty();
        }

        return Optional.of(substitution);
    }
}
