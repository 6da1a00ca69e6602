package org.prover.llm;

import java.io.IOException;

/**
 * Provider di modelli linguistici compatibile con le chat completion.
 *
 * Usato dalla pipeline per la formalizzazione del problema e per la spiegazione
 * della traccia; il motore di risoluzione non dipende da questa interfaccia.
 */
public interface LanguageModelProvider {

    /**
     * Invia un messaggio di sistema e un messaggio utente al modello indicato.
     *
     * @param model identificatore del modello presso il provider
     * @param systemPrompt istruzioni di sistema
     * @param userText testo dell'utente
     * @param userTag etichetta opzionale dell'utente per i metadati (può essere null)
     * @return testo della risposta, senza spazi ai bordi
     * @throws IOException se la comunicazione fallisce o la risposta è un errore
     */
    String complete(String model, String systemPrompt, String userText, String userTag) throws IOException;

    /**
     * Nome del provider per i log.
     */
    default String getProviderName() {
        return this.getClass().getSimpleName();
    }
}
