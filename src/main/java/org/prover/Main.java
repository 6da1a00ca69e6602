package org.prover;

import org.prover.llm.LanguageModelException;
import org.prover.llm.PipelineResult;
import org.prover.llm.ProviderConfiguration;
import org.prover.llm.ReasoningPipeline;
import org.prover.clause.ClauseParser;
import org.prover.resolution.ProofResult;
import org.prover.resolution.SaturationEngine;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * RISOLUTORE PER REFUTAZIONE CON RISOLUZIONE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: clausole da file (una per riga), da directory, da riga di comando,
 *    oppure problema in linguaggio naturale da formalizzare
 * 2. PARSING: testo delle clausole -> Clause/Literal (grammatica ANTLR)
 * 3. SATURAZIONE: risoluzione con unificazione fino a contraddizione, saturazione
 *    o limite di iterazioni
 * 4. OUTPUT: esito, traccia numerata dei passi e statistiche in RESULT/
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): una clausola per riga, righe vuote e commenti # ignorati
 * - Directory batch (-d): tutti i file .txt della cartella
 * - Clausole inline (-c): elenco separato da virgole
 * - Linguaggio naturale (-nl): formalizzazione e spiegazione tramite modello linguistico
 * - Timeout configurabile (-t secondi), limite iterazioni (-i), directory output (-o)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String CLAUSES_PARAM = "-c";
    private static final String NATURAL_LANGUAGE_PARAM = "-nl";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String ITERATIONS_PARAM = "-i";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private static final String RESULT_DIRECTORY = "RESULT";
    private static final String RESULT_EXTENSION = ".result";
    private static final String COMMENT_PREFIX = "#";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del risolutore.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO RISOLUTORE PER RISOLUZIONE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            ProverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE RISOLUTORE <---");
        }
    }

    /**
     * Carica logging.properties dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream stream = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    /**
     * Esegue la modalità selezionata dalla configurazione.
     */
    private static void executeMainPipeline(ProverConfiguration config) {
        switch (config.mode) {
            case FILE -> {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config, Paths.get(config.input));
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }
            case INLINE -> {
                System.out.println("[I] Modalità: Clausole da riga di comando");
                processInlineClauses(config);
            }
            case NATURAL_LANGUAGE -> {
                System.out.println("[I] Modalità: Problema in linguaggio naturale");
                processNaturalLanguage(config);
            }
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ProverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(ProverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE RISOLUTORE <<--");
        System.out.println("Modalità: " + config.mode.description);
        if (config.mode != Mode.INLINE) {
            System.out.println("Input: " + config.input);
        }
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("Iterazioni massime: " + config.maxIterations);
        if (config.outputPath != null) {
            System.out.println("Output: " + config.outputPath);
        }
        System.out.println("===================================\n");
    }

    //endregion

    //region ELABORAZIONE CLAUSOLE

    /**
     * Elabora un file di clausole e salva il risultato.
     *
     * @return true se l'elaborazione è terminata (con qualsiasi esito), false se errore o timeout
     */
    private static boolean processSingleFile(ProverConfiguration config, Path file) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + file.getFileName());
        System.out.println("=========================\n");

        try {
            List<String> clauses = readClausesFromFile(file);
            ProofResult result = executeProofWithTimeout(clauses, config);

            if (result == null) {
                saveTimeoutReport(config, file);
                return false;
            }

            displayResult(result);
            saveResult(result, config, file, clauses);
            return true;

        } catch (Exception e) {
            handleFileProcessingError(file.toString(), e);
            return false;
        }
    }

    private static void processInlineClauses(ProverConfiguration config) {
        List<String> clauses = ClauseParser.splitFormulaList(config.input);
        ProofResult result = executeProofWithTimeout(clauses, config);
        if (result == null) {
            return;
        }
        displayResult(result);
    }

    /**
     * Legge le clausole di un file, una per riga.
     */
    static List<String> readClausesFromFile(Path file) throws IOException {
        List<String> clauses = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                clauses.add(trimmed);
            }
        }
        System.out.println("[I] Clausole lette: " + clauses.size());
        return clauses;
    }

    /**
     * Esegue la ricerca della contraddizione con timeout controllato.
     *
     * Il motore termina sempre entro il limite di iterazioni; il timeout protegge
     * l'utente da universi di clausole molto grandi. Allo scadere, shutdownNow()
     * interrompe il thread di lavoro e il motore si ferma alla clausola successiva,
     * così in modalità directory il file seguente non compete con la prova abbandonata.
     *
     * @return risultato della prova o null se timeout
     */
    private static ProofResult executeProofWithTimeout(List<String> clauses, ProverConfiguration config) {
        System.out.println("Ricerca contraddizione (timeout: " + config.timeoutSeconds + "s, iterazioni: "
                + config.maxIterations + ")...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        SaturationEngine engine = new SaturationEngine(config.maxIterations);

        try {
            Callable<ProofResult> proofTask = () -> engine.proveContradiction(clauses);
            Future<ProofResult> future = executor.submit(proofTask);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Ricerca interrotta", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore nella ricerca della contraddizione", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region ELABORAZIONE DIRECTORY

    private static void processDirectoryBatch(ProverConfiguration config) {
        try {
            List<File> files = findAllTxtFiles(config.input);
            if (files.isEmpty()) {
                System.out.println("[W] Nessun file .txt trovato in " + config.input);
                return;
            }

            int completed = 0;
            for (File file : files) {
                if (processSingleFile(config, file.toPath())) {
                    completed++;
                }
            }

            System.out.println("\n-->> RIEPILOGO DIRECTORY <<--");
            System.out.println("File elaborati: " + completed + "/" + files.size());
        } catch (IOException e) {
            System.out.println("[E] Errore lettura directory: " + e.getMessage());
        }
    }

    private static List<File> findAllTxtFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .txt nella directory...");

        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            List<File> txtFiles = paths
                    .filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();

            System.out.println("Trovati " + txtFiles.size() + " file .txt da elaborare.");
            return txtFiles;
        }
    }

    //endregion

    //region LINGUAGGIO NATURALE

    private static void processNaturalLanguage(ProverConfiguration config) {
        Path file = Paths.get(config.input);
        try {
            String problem = Files.readString(file, StandardCharsets.UTF_8).trim();
            System.out.println("[I] Problema letto: " + problem);

            ReasoningPipeline pipeline = ReasoningPipeline.fromConfiguration(ProviderConfiguration.fromEnvironment());
            PipelineResult result = pipeline.run(problem, null);

            System.out.println("\nFormalizzazione: " + result.getFormalized());
            displayResult(result.getProof());
            System.out.println("\n-->> SPIEGAZIONE <<--");
            System.out.println(result.getExplanation());

            saveResult(result.getProof(), config, file, result.getClauses());

        } catch (LanguageModelException | IllegalStateException e) {
            System.out.println("[E] Modello linguistico non disponibile: " + e.getMessage());
        } catch (IOException e) {
            handleFileProcessingError(file.toString(), e);
        }
    }

    //endregion

    //region OUTPUT RISULTATI

    private static void displayResult(ProofResult result) {
        System.out.println();
        for (String line : result.getLog()) {
            System.out.println(line);
        }
        System.out.println();
        System.out.println("Esito: " + (result.isContradictionFound() ? "CONTRADDIZIONE TROVATA" : "NESSUNA CONTRADDIZIONE")
                + " (" + result.getOutcome() + ")");
        System.out.print(result.getStatistics());
    }

    private static void saveResult(ProofResult result, ProverConfiguration config,
                                   Path inputFile, List<String> clauses) throws IOException {
        Path outputDir = getOutputDirectory(config, inputFile);
        Files.createDirectories(outputDir);
        Path resultFile = outputDir.resolve(getBaseFileName(inputFile) + RESULT_EXTENSION);

        try (FileWriter writer = new FileWriter(resultFile.toFile(), StandardCharsets.UTF_8)) {
            writer.write("RISULTATO: " + (result.isContradictionFound() ? "CONTRADDIZIONE" : "NESSUNA CONTRADDIZIONE") + "\n");
            writer.write("ESITO: " + result.getOutcome() + "\n");
            writer.write("CLAUSOLE: " + clauses.size() + "\n\n");
            writer.write("-->> TRACCIA <<--\n");
            writer.write(result.getLogAsText());
            writer.write("\n\n");
            writer.write(result.getStatistics().toString());
        }

        System.out.println("[I] Risultato salvato in " + resultFile);
    }

    private static void saveTimeoutReport(ProverConfiguration config, Path inputFile) throws IOException {
        Path outputDir = getOutputDirectory(config, inputFile);
        Files.createDirectories(outputDir);
        Path resultFile = outputDir.resolve(getBaseFileName(inputFile) + RESULT_EXTENSION);

        try (FileWriter writer = new FileWriter(resultFile.toFile(), StandardCharsets.UTF_8)) {
            writer.write("RISULTATO: TIMEOUT\n");
            writer.write("Timeout di " + config.timeoutSeconds + " secondi superato\n");
        }
    }

    private static void handleFileProcessingError(String filePath, Exception e) {
        LOGGER.log(Level.WARNING, "Errore elaborazione " + filePath, e);
        System.out.println("[E] Errore durante l'elaborazione di " + filePath + ": " + e.getMessage());
    }

    private static Path getOutputDirectory(ProverConfiguration config, Path inputFile) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath, RESULT_DIRECTORY);
        }
        Path parent = inputFile.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(RESULT_DIRECTORY) : Paths.get(RESULT_DIRECTORY);
    }

    private static String getBaseFileName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> RISOLUTORE PER REFUTAZIONE CON RISOLUZIONE <<::");
        System.out.println("Ricerca di contraddizioni in insiemi di clausole predicative");
        System.out.println("con risoluzione, unificazione e traccia numerata dei passi\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar risolutore-risoluzione.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE (mutualmente esclusive):");
        System.out.println("     -f <file>        File di clausole, una per riga (# per i commenti)");
        System.out.println("     -d <directory>   Elabora tutti i file .txt in una directory");
        System.out.println("     -c \"<clausole>\"  Clausole separate da virgole");
        System.out.println("     -nl <file>       Problema in linguaggio naturale (richiede OPENROUTER_API_KEY)");
        System.out.println();

        System.out.println("OPZIONI:");
        System.out.println("     -o <directory>   Directory di output (default: stessa di input)");
        System.out.println("     -t <secondi>     Timeout per singola prova (min: 1, default: 10)");
        System.out.println("     -i <numero>      Numero massimo di iterazioni (default: 100)");
        System.out.println("     -h               Mostra questa guida\n");

        System.out.println("FORMATO CLAUSOLE:");
        System.out.println("  ¬Human(x) ∨ Mortal(x)");
        System.out.println("  Variabili: singole lettere minuscole; ogni altro termine è una costante.\n");

        System.out.println("ESEMPIO:");
        System.out.println("  -c \"¬Human(x) ∨ Mortal(x), Human(socrates), ¬Mortal(socrates)\"");
    }

    //endregion

    //region CONFIGURAZIONE

    private enum Mode {
        FILE("File singolo"),
        DIRECTORY("Directory"),
        INLINE("Clausole inline"),
        NATURAL_LANGUAGE("Linguaggio naturale");

        private final String description;

        Mode(String description) {
            this.description = description;
        }
    }

    /**
     * Configurazione immutabile dell'esecuzione.
     */
    private static class ProverConfiguration {
        final Mode mode;
        final String input;
        final String outputPath;
        final int timeoutSeconds;
        final int maxIterations;

        ProverConfiguration(Mode mode, String input, String outputPath, int timeoutSeconds, int maxIterations) {
            this.mode = mode;
            this.input = input;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.maxIterations = maxIterations;
        }
    }

    /**
     * Parser dei parametri linea di comando con validazione completa.
     */
    private static class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se parametri invalidi
         */
        public ProverConfiguration parse(String[] args) {
            Mode mode = null;
            String input = null;
            String outputPath = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int maxIterations = SaturationEngine.DEFAULT_MAX_ITERATIONS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(mode, Mode.FILE);
                        input = getNextArgument(args, ++i, "file");
                        validateFileExists(input);
                        mode = Mode.FILE;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(mode, Mode.DIRECTORY);
                        input = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(input);
                        mode = Mode.DIRECTORY;
                    }
                    case CLAUSES_PARAM -> {
                        validateExclusiveMode(mode, Mode.INLINE);
                        input = getNextArgument(args, ++i, "clausole");
                        mode = Mode.INLINE;
                    }
                    case NATURAL_LANGUAGE_PARAM -> {
                        validateExclusiveMode(mode, Mode.NATURAL_LANGUAGE);
                        input = getNextArgument(args, ++i, "file problema");
                        validateFileExists(input);
                        mode = Mode.NATURAL_LANGUAGE;
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    case TIMEOUT_PARAM -> timeoutSeconds = parsePositiveInt(getNextArgument(args, ++i, "timeout"),
                            MIN_TIMEOUT_SECONDS, "Timeout");
                    case ITERATIONS_PARAM -> maxIterations = parsePositiveInt(getNextArgument(args, ++i, "iterazioni"),
                            1, "Numero di iterazioni");
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una modalità: -f, -d, -c oppure -nl");
            }

            return new ProverConfiguration(mode, input, outputPath, timeoutSeconds, maxIterations);
        }

        private void validateExclusiveMode(Mode current, Mode requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested.description +
                        " non può essere combinata con " + current.description);
            }
        }

        private String getNextArgument(String[] args, int index, String paramName) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro mancante per " + paramName);
            }
            return args[index];
        }

        private void validateFileExists(String path) {
            if (!Files.isRegularFile(Paths.get(path))) {
                throw new IllegalArgumentException("File non trovato: " + path);
            }
        }

        private void validateDirectoryExists(String path) {
            if (!Files.isDirectory(Paths.get(path))) {
                throw new IllegalArgumentException("Directory non trovata: " + path);
            }
        }

        private int parsePositiveInt(String value, int minimum, String name) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < minimum) {
                    throw new IllegalArgumentException(name + " deve essere almeno " + minimum + ": " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " non valido: " + value, e);
            }
        }
    }

    //endregion
}
