package org.prover.llm;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client con fallback a priorità fissa sui modelli.
 *
 * Prova i modelli nell'ordine della lista e restituisce la prima risposta riuscita.
 * Gli errori recuperabili vengono registrati e si passa al modello successivo; se
 * tutti falliscono viene sollevata {@link LanguageModelException} con l'ultimo errore.
 */
public class ModelFallbackClient {

    private static final Logger LOGGER = Logger.getLogger(ModelFallbackClient.class.getName());

    private final LanguageModelProvider provider;
    private final List<String> models;

    /**
     * @param provider provider su cui eseguire le richieste
     * @param models modelli in ordine di priorità
     * @throws IllegalArgumentException se provider null o lista modelli vuota
     */
    public ModelFallbackClient(LanguageModelProvider provider, List<String> models) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider non può essere null");
        }
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("Lista modelli vuota");
        }
        this.provider = provider;
        this.models = Collections.unmodifiableList(new ArrayList<>(models));
    }

    /**
     * Esegue la richiesta sul primo modello che risponde.
     *
     * @param systemPrompt istruzioni di sistema
     * @param userText testo dell'utente
     * @param userTag etichetta utente opzionale
     * @return risposta del primo modello riuscito
     * @throws LanguageModelException se tutti i modelli falliscono
     */
    public String complete(String systemPrompt, String userText, String userTag) {
        Exception lastFailure = null;

        for (String model : models) {
            try {
                String answer = provider.complete(model, systemPrompt, userText, userTag);
                LOGGER.fine("Risposta ottenuta da " + provider.getProviderName() + "/" + model);
                return answer;
            } catch (IOException | RuntimeException e) {
                LOGGER.log(Level.WARNING, "Modello " + model + " non disponibile, passo al successivo", e);
                lastFailure = e;
            }
        }

        throw new LanguageModelException(models, lastFailure);
    }
}
