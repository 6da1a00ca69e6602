package org.prover.resolution;

import org.prover.clause.ClauseParser;
import org.prover.support.Clause;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * MOTORE DI SATURAZIONE - Ricerca della contraddizione per risoluzione
 *
 * Deriva iterativamente nuove clausole fino a uno stato terminale:
 *   RUNNING → { CONTRADICTION_FOUND, SATURATED, ITERATION_LIMIT }
 *
 * STRATEGIA (given-clause / semi-naive):
 * A ogni giro l'intero universo delle clausole, fotografato all'inizio del giro, viene
 * accoppiato solo con la frontiera dei risolventi nuovi del giro precedente. Coppie di
 * clausole entrambe già note non vengono ricombinate, ma ogni clausola precedente
 * incontra ogni clausola appena derivata.
 *
 * ALGORITMO:
 * 1. Parsing delle clausole; universo = frontiera = clausole iniziali; log con ID
 * 2. Per ogni giro (massimo maxIterations):
 *    - fotografia della frontiera, nuova frontiera vuota
 *    - per ogni coppia (universo × frontiera) con clausole diverse: risoluzione
 *    - risolvente vuoto: log del passo e fine con contraddizione
 *    - risolvente non vuoto e nuovo: aggiunto a universo e nuova frontiera, log
 *    - nuova frontiera vuota a fine giro: saturazione
 * 3. Giri esauriti: limite di iterazioni
 *
 * Tutto lo stato (universo, frontiera, registro ID, traccia) appartiene a una singola
 * invocazione: la stessa istanza può servire chiamate concorrenti. Il motore non
 * solleva eccezioni per nessun input testuale.
 *
 * Il flag di interruzione del thread viene controllato prima di ogni clausola
 * dell'universo: una ricerca interrotta termina con {@link CancellationException}.
 */
public class SaturationEngine {

    private static final Logger LOGGER = Logger.getLogger(SaturationEngine.class.getName());

    /** Numero massimo di giri di saturazione di default */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final int maxIterations;

    //region INIZIALIZZAZIONE

    /**
     * Motore con il limite di default di {@value #DEFAULT_MAX_ITERATIONS} giri.
     */
    public SaturationEngine() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param maxIterations numero massimo di giri di saturazione
     * @throws IllegalArgumentException se maxIterations non è positivo
     */
    public SaturationEngine(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Numero massimo di iterazioni deve essere positivo: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Scorciatoia con il limite di default.
     *
     * @param clauses clausole testuali
     * @return esito e traccia della prova
     */
    public static ProofResult prove(List<String> clauses) {
        return new SaturationEngine().proveContradiction(clauses);
    }

    //endregion

    //region PUNTO DI INGRESSO

    /**
     * CORE: Determina se l'insieme di clausole testuali è contraddittorio.
     *
     * @param clauses clausole testuali, es. ["¬Human(x) ∨ Mortal(x)", "Human(socrates)"]
     * @return esito booleano, traccia della derivazione e statistiche
     */
    public ProofResult proveContradiction(List<String> clauses) {
        List<String> texts = clauses != null ? clauses : Collections.emptyList();
        return proveClauses(ClauseParser.parseClauses(texts));
    }

    /**
     * Variante su clausole già analizzate.
     *
     * @param inputClauses clausole iniziali nell'ordine dato
     * @return esito booleano, traccia della derivazione e statistiche
     */
    public ProofResult proveClauses(List<Clause> inputClauses) {
        List<Clause> inputs = inputClauses != null ? inputClauses : Collections.emptyList();
        LOGGER.info("=== AVVIO RICERCA CONTRADDIZIONE: " + inputs.size() + " clausole ===");

        ProofStatistics statistics = new ProofStatistics();
        ClauseRegistry registry = new ClauseRegistry();
        ProofLogger logger = new ProofLogger(registry);

        logger.logInitialClauses(inputs);

        Set<Clause> allClauses = new LinkedHashSet<>(inputs);
        Set<Clause> frontier = new LinkedHashSet<>(inputs);
        int step = 1;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            statistics.incrementIterations();

            List<Clause> currentNew = new ArrayList<>(frontier);
            List<Clause> universe = new ArrayList<>(allClauses);
            frontier = new LinkedHashSet<>();

            LOGGER.fine("Giro " + iteration + ": universo=" + universe.size() + ", frontiera=" + currentNew.size());

            for (Clause clauseA : universe) {
                checkInterrupted(iteration);

                for (Clause clauseB : currentNew) {
                    if (clauseA.equals(clauseB)) {
                        continue;
                    }

                    statistics.incrementClausePairsExamined();
                    List<Resolvent> resolvents = ResolutionStepGenerator.resolve(clauseA, clauseB);
                    statistics.addResolventsGenerated(resolvents.size());

                    for (Resolvent resolvent : resolvents) {
                        if (resolvent.isContradiction()) {
                            logger.logContradiction(step, clauseA, clauseB, resolvent);
                            return finish(SaturationOutcome.CONTRADICTION_FOUND, logger, statistics, allClauses);
                        }

                        if (allClauses.add(resolvent.getClause())) {
                            frontier.add(resolvent.getClause());
                            logger.logResolutionStep(step, clauseA, clauseB, resolvent);
                            statistics.incrementDerivedClauses();
                            step++;
                        } else {
                            statistics.incrementDuplicatesDiscarded();
                        }
                    }
                }
            }

            if (frontier.isEmpty()) {
                logger.logSaturation(step - 1, allClauses.size());
                return finish(SaturationOutcome.SATURATED, logger, statistics, allClauses);
            }
        }

        LOGGER.warning("Limite di " + maxIterations + " iterazioni raggiunto senza esito");
        logger.logIterationLimit(maxIterations);
        return finish(SaturationOutcome.ITERATION_LIMIT, logger, statistics, allClauses);
    }

    //endregion

    /**
     * Chiude le statistiche e costruisce il risultato immutabile.
     */
    private ProofResult finish(SaturationOutcome outcome, ProofLogger logger,
                               ProofStatistics statistics, Set<Clause> allClauses) {
        statistics.setTotalClauses(allClauses.size());
        statistics.stopTimer();

        LOGGER.info("=== RICERCA TERMINATA: " + outcome + " dopo " + statistics.getIterations()
                + " giri, " + allClauses.size() + " clausole ===");

        List<String> log = logger.getLines();
        return switch (outcome) {
            case CONTRADICTION_FOUND -> ProofResult.contradiction(log, statistics);
            case SATURATED -> ProofResult.saturated(log, statistics);
            default -> ProofResult.iterationLimit(log, statistics);
        };
    }

    /**
     * Interrompe la ricerca se il thread corrente è stato interrotto (es. timeout della CLI).
     */
    private static void checkInterrupted(int iteration) {
        if (Thread.currentThread().isInterrupted()) {
            LOGGER.warning("Ricerca interrotta durante il giro " + iteration);
            throw new CancellationException("Ricerca della contraddizione interrotta al giro " + iteration);
        }
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
