package org.prover.resolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RISULTATO PROVA - Contenitore immutabile dell'esito di una refutazione
 *
 * Espone l'esito booleano (contraddizione trovata o no), la traccia testuale della
 * derivazione, lo stato terminale del ciclo di saturazione e le statistiche.
 *
 * COERENZA:
 * • found == true  ↔ outcome == CONTRADICTION_FOUND
 * • outcome è sempre uno stato terminale
 */
public class ProofResult {

    //region ATTRIBUTI CORE

    private final boolean contradictionFound;

    /**
     * Righe della traccia, immutabili.
     */
    private final List<String> log;

    private final SaturationOutcome outcome;

    private final ProofStatistics statistics;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * @param outcome stato terminale della saturazione
     * @param log righe della traccia
     * @param statistics metriche di esecuzione (null → default inizializzato)
     * @throws IllegalArgumentException se outcome non terminale o log null
     */
    public ProofResult(SaturationOutcome outcome, List<String> log, ProofStatistics statistics) {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("Esito della prova deve essere uno stato terminale: " + outcome);
        }
        if (log == null) {
            throw new IllegalArgumentException("Traccia della prova non può essere null");
        }

        this.outcome = outcome;
        this.contradictionFound = outcome == SaturationOutcome.CONTRADICTION_FOUND;
        this.log = Collections.unmodifiableList(new ArrayList<>(log));
        this.statistics = statistics != null ? statistics : new ProofStatistics();
    }

    //endregion

    //region FACTORY METHODS

    public static ProofResult contradiction(List<String> log, ProofStatistics statistics) {
        return new ProofResult(SaturationOutcome.CONTRADICTION_FOUND, log, statistics);
    }

    public static ProofResult saturated(List<String> log, ProofStatistics statistics) {
        return new ProofResult(SaturationOutcome.SATURATED, log, statistics);
    }

    public static ProofResult iterationLimit(List<String> log, ProofStatistics statistics) {
        return new ProofResult(SaturationOutcome.ITERATION_LIMIT, log, statistics);
    }

    //endregion

    //region ACCESSORS

    /**
     * @return true se è stata derivata la clausola vuota
     */
    public boolean isContradictionFound() {
        return contradictionFound;
    }

    /**
     * @return righe immutabili della traccia
     */
    public List<String> getLog() {
        return log;
    }

    /**
     * @return traccia unita da a capo, pronta per file o per il modello di spiegazione
     */
    public String getLogAsText() {
        return String.join("\n", log);
    }

    public SaturationOutcome getOutcome() {
        return outcome;
    }

    public ProofStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("ProofResult[outcome=%s, lines=%d]", outcome, log.size());
    }
}
