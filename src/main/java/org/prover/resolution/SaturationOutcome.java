package org.prover.resolution;

/**
 * Stati del ciclo di saturazione.
 *
 * RUNNING è lo stato iniziale; gli altri tre sono terminali.
 */
public enum SaturationOutcome {

    /** Ciclo in corso */
    RUNNING,

    /** Derivata la clausola vuota: l'insieme di clausole è contraddittorio */
    CONTRADICTION_FOUND,

    /** Nessun nuovo risolvente in un intero giro: nessuna contraddizione derivabile */
    SATURATED,

    /** Esaurito il numero massimo di iterazioni senza esito */
    ITERATION_LIMIT;

    /**
     * @return true per gli stati che chiudono l'esecuzione
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
