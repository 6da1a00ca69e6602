package org.prover.resolution;

import org.prover.support.Clause;

import java.util.*;
import java.util.logging.Logger;

/**
 * REGISTRO DELLA PROVA - Traccia leggibile di ogni passo di risoluzione
 *
 * Produce la sequenza di righe consegnata al chiamante. Ogni clausola è citata con
 * l'identificatore [#N] assegnato dal {@link ClauseRegistry} della prova, condiviso per
 * riferimento con il motore: la stessa clausola appare sempre con lo stesso numero.
 *
 * FORMATO OUTPUT:
 * Clausole iniziali: 3
 *   [#1] ¬Human(x) ∨ Mortal(x)
 *   ...
 *
 * Passo 1: Risoluzione
 *   Clausola 1: [#1] ¬Human(x) ∨ Mortal(x)
 *   Clausola 2: [#2] Human(socrates)
 *   Unificazione {x/socrates} sui letterali '¬Human(x)' e 'Human(socrates)'
 *   Risultato: [#4] Mortal(socrates)
 *
 * Passo 3: Contraddizione trovata!
 *   ...
 *   Risultato: [#6] Clausola vuota (⊥) (contraddizione)
 */
public class ProofLogger {

    private static final Logger LOGGER = Logger.getLogger(ProofLogger.class.getName());

    /** Marcatore testuale della clausola vuota */
    public static final String EMPTY_CLAUSE_MARKER = "Clausola vuota (⊥)";

    //region STRUTTURE DATI CORE

    /**
     * Righe della traccia in ordine cronologico.
     */
    private final List<String> lines;

    /**
     * Registro ID condiviso con il motore della stessa prova.
     */
    private final ClauseRegistry registry;

    /**
     * Numero di passi di risoluzione registrati (contraddizione inclusa).
     */
    private int recordedSteps;

    //endregion

    /**
     * @param registry registro degli ID della prova corrente
     * @throws IllegalArgumentException se registry è null
     */
    public ProofLogger(ClauseRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Registro clausole non può essere null");
        }
        this.registry = registry;
        this.lines = new ArrayList<>();
        this.recordedSteps = 0;
    }

    //region REGISTRAZIONE PASSI

    /**
     * Registra l'intestazione con l'elenco delle clausole iniziali, assegnando gli ID.
     */
    public void logInitialClauses(Collection<Clause> clauses) {
        lines.add("Clausole iniziali: " + clauses.size());
        for (Clause clause : clauses) {
            lines.add("  " + formatClause(clause));
        }
    }

    /**
     * Registra un passo che ha prodotto una nuova clausola non vuota.
     *
     * @param step numero progressivo del passo
     * @param clauseA prima clausola sorgente
     * @param clauseB seconda clausola sorgente
     * @param resolvent risolvente accettato
     */
    public void logResolutionStep(int step, Clause clauseA, Clause clauseB, Resolvent resolvent) {
        lines.add("");
        lines.add("Passo " + step + ": Risoluzione");
        appendStepBody(clauseA, clauseB, resolvent);
        lines.add("  Risultato: " + formatClause(resolvent.getClause()));
        recordedSteps++;

        LOGGER.finest(() -> "Passo " + step + " registrato: " + resolvent.getClause());
    }

    /**
     * Registra il passo finale che deriva la clausola vuota.
     */
    public void logContradiction(int step, Clause clauseA, Clause clauseB, Resolvent resolvent) {
        lines.add("");
        lines.add("Passo " + step + ": Contraddizione trovata!");
        appendStepBody(clauseA, clauseB, resolvent);
        lines.add("  Risultato: " + formatClause(resolvent.getClause()) + " (contraddizione)");
        recordedSteps++;

        LOGGER.fine("*** CLAUSOLA VUOTA DERIVATA AL PASSO " + step + " ***");
    }

    private void appendStepBody(Clause clauseA, Clause clauseB, Resolvent resolvent) {
        lines.add("  Clausola 1: " + formatClause(clauseA));
        lines.add("  Clausola 2: " + formatClause(clauseB));
        lines.add(String.format("  Unificazione %s sui letterali '%s' e '%s'",
                resolvent.getSubstitution(),
                resolvent.getSelectedLiteralA().render(),
                resolvent.getSelectedLiteralB().render()));
    }

    /**
     * Registra la chiusura per saturazione con il riepilogo delle clausole.
     *
     * @param derivationSteps passi di risoluzione eseguiti
     * @param totalClauses clausole totali nell'universo finale
     */
    public void logSaturation(int derivationSteps, int totalClauses) {
        lines.add("");
        lines.add("Nessuna contraddizione trovata dopo " + derivationSteps + " passi.");
        lines.add("Clausole totali: " + totalClauses);
    }

    /**
     * Registra la chiusura per esaurimento delle iterazioni.
     */
    public void logIterationLimit(int maxIterations) {
        lines.add("");
        lines.add("Raggiunto il limite di iterazioni (" + maxIterations + "). Nessuna contraddizione trovata.");
    }

    //endregion

    //region FORMATAZIONE

    /**
     * Formatta la clausola con il proprio ID: "[#N] testo" oppure il marcatore ⊥.
     */
    public String formatClause(Clause clause) {
        int id = registry.idOf(clause);
        String text = clause.isEmpty() ? EMPTY_CLAUSE_MARKER : clause.render();
        return "[#" + id + "] " + text;
    }

    //endregion

    //region INTERFACCIA PUBBLICA E STATO

    /**
     * @return copia immutabile delle righe registrate
     */
    public List<String> getLines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public int getRecordedSteps() {
        return recordedSteps;
    }

    @Override
    public String toString() {
        return String.format("ProofLogger[lines=%d, steps=%d, clauses=%d]",
                lines.size(), recordedSteps, registry.size());
    }

    //endregion
}
