package org.prover.resolution;

/**
 * STATISTICHE PROVA - Metriche di esecuzione del ciclo di saturazione
 *
 * Raccoglie contatori e tempi durante la ricerca della contraddizione, per il
 * reporting della riga di comando e per l'analisi del costo della saturazione.
 */
public class ProofStatistics {

    //region CONTATORI METRICHE CORE

    /**
     * Giri completati (o interrotti) del ciclo di saturazione.
     */
    private int iterations = 0;

    /**
     * Coppie di clausole passate al generatore di risolventi.
     */
    private int clausePairsExamined = 0;

    /**
     * Risolventi prodotti dal generatore, duplicati inclusi.
     */
    private int resolventsGenerated = 0;

    /**
     * Risolventi scartati perché già presenti nell'universo delle clausole.
     */
    private int duplicatesDiscarded = 0;

    /**
     * Nuove clausole accettate e aggiunte all'universo.
     */
    private int derivedClauses = 0;

    /**
     * Dimensione finale dell'universo delle clausole.
     */
    private int totalClauses = 0;

    //endregion

    //region TIMING E PERFORMANCE

    private long executionTimeMs = 0;

    private long startTime = 0;

    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza statistiche e avvia immediatamente il timer.
     */
    public ProofStatistics() {
        this.startTime = System.currentTimeMillis();
        this.timerStopped = false;
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public void incrementIterations() {
        iterations++;
    }

    public void incrementClausePairsExamined() {
        clausePairsExamined++;
    }

    /**
     * Somma i risolventi prodotti da una singola chiamata al generatore.
     */
    public void addResolventsGenerated(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Numero risolventi non può essere negativo: " + count);
        }
        resolventsGenerated += count;
    }

    public void incrementDuplicatesDiscarded() {
        duplicatesDiscarded++;
    }

    public void incrementDerivedClauses() {
        derivedClauses++;
    }

    public void setTotalClauses(int totalClauses) {
        if (totalClauses < 0) {
            throw new IllegalArgumentException("Numero clausole non può essere negativo: " + totalClauses);
        }
        this.totalClauses = totalClauses;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma la misurazione del tempo. Chiamate multiple sono sicure.
     */
    public void stopTimer() {
        if (startTime > 0 && !timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo di esecuzione in ms (parziale se il timer non è fermato)
     */
    public long getExecutionTimeMs() {
        if (!timerStopped && startTime > 0) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS LETTURA METRICHE

    /** @return giri del ciclo di saturazione */
    public int getIterations() {
        return iterations;
    }

    /** @return coppie di clausole esaminate */
    public int getClausePairsExamined() {
        return clausePairsExamined;
    }

    /** @return risolventi prodotti, duplicati inclusi */
    public int getResolventsGenerated() {
        return resolventsGenerated;
    }

    /** @return risolventi scartati come duplicati */
    public int getDuplicatesDiscarded() {
        return duplicatesDiscarded;
    }

    /** @return nuove clausole derivate */
    public int getDerivedClauses() {
        return derivedClauses;
    }

    /** @return dimensione finale dell'universo delle clausole */
    public int getTotalClauses() {
        return totalClauses;
    }

    /**
     * Frazione dei risolventi prodotti che erano già noti.
     *
     * @return rapporto duplicati/risolventi (0.0 se nessun risolvente)
     */
    public double getRedundancyRate() {
        return resolventsGenerated > 0 ? (double) duplicatesDiscarded / resolventsGenerated : 0.0;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=========================[ RESOLUTION COMPLETED: PROOF STATS ]=========================\n");
        output.append("    Iterazioni:          ").append(iterations).append("\n");
        output.append("    Coppie esaminate:    ").append(clausePairsExamined).append("\n");
        output.append("    Risolventi prodotti: ").append(resolventsGenerated).append("\n");
        output.append("    Duplicati scartati:  ").append(duplicatesDiscarded).append("\n");
        output.append("    Clausole derivate:   ").append(derivedClauses).append("\n");
        output.append("    Clausole totali:     ").append(totalClauses).append("\n");
        output.append("    Tempo:               ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=======================================================================================\n");
        return output.toString();
    }
}
