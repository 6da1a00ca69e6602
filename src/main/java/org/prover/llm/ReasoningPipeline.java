package org.prover.llm;

import org.prover.clause.ClauseParser;
import org.prover.resolution.ProofResult;
import org.prover.resolution.SaturationEngine;

import java.util.List;
import java.util.logging.Logger;

/**
 * PIPELINE DI RAGIONAMENTO - Dal problema in linguaggio naturale alla spiegazione
 *
 * FASI:
 * 1. Formalizzazione: il modello traduce il problema in clausole separate da virgole
 * 2. Risoluzione: {@link SaturationEngine} cerca la contraddizione
 * 3. Spiegazione: il modello riformula la traccia della prova in prosa
 *
 * Le chiamate al modello passano da {@link ModelFallbackClient}; il motore di
 * risoluzione è sincrono e non esegue I/O.
 */
public class ReasoningPipeline {

    private static final Logger LOGGER = Logger.getLogger(ReasoningPipeline.class.getName());

    private final ModelFallbackClient client;
    private final PromptRepository prompts;
    private final SaturationEngine engine;

    public ReasoningPipeline(ModelFallbackClient client, PromptRepository prompts, SaturationEngine engine) {
        if (client == null || prompts == null || engine == null) {
            throw new IllegalArgumentException("Componenti della pipeline non possono essere null");
        }
        this.client = client;
        this.prompts = prompts;
        this.engine = engine;
    }

    /**
     * Costruisce la pipeline con provider OpenRouter e motore con limite di default.
     *
     * @throws IllegalStateException se la chiave API non è configurata
     */
    public static ReasoningPipeline fromConfiguration(ProviderConfiguration configuration) {
        LanguageModelProvider provider = new OpenRouterProvider(configuration);
        ModelFallbackClient client = new ModelFallbackClient(provider, configuration.getModels());
        return new ReasoningPipeline(client, new PromptRepository(), new SaturationEngine());
    }

    /**
     * Esegue le tre fasi in sequenza.
     *
     * @param problemText problema in linguaggio naturale
     * @param userTag etichetta utente per i metadati (può essere null)
     * @return risultati di tutte le fasi
     * @throws LanguageModelException se formalizzazione o spiegazione falliscono su tutti i modelli
     */
    public PipelineResult run(String problemText, String userTag) {
        LOGGER.info("=== PIPELINE: FORMALIZZAZIONE ===");
        String formalized = formalize(problemText, userTag);

        LOGGER.info("=== PIPELINE: RISOLUZIONE ===");
        List<String> clauses = ClauseParser.splitFormulaList(formalized);
        ProofResult proof = engine.proveContradiction(clauses);

        LOGGER.info("=== PIPELINE: SPIEGAZIONE ===");
        String explanation = explain(proof, userTag);

        return new PipelineResult(formalized, clauses, proof, explanation);
    }

    /**
     * Traduce il problema in clausole testuali separate da virgole.
     */
    public String formalize(String problemText, String userTag) {
        return client.complete(prompts.getPrompt(PromptRepository.FORMALIZER), problemText, userTag);
    }

    /**
     * Riformula la traccia della prova in linguaggio naturale.
     */
    public String explain(ProofResult proof, String userTag) {
        return client.complete(prompts.getPrompt(PromptRepository.EXPLAINER), proof.getLogAsText(), userTag);
    }
}
