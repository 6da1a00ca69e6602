package org.prover.llm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Nessun modello della lista di fallback ha prodotto una risposta.
 *
 * Conserva l'elenco dei modelli tentati; la causa è l'ultimo errore ricevuto.
 */
public class LanguageModelException extends RuntimeException {

    private final List<String> attemptedModels;

    public LanguageModelException(List<String> attemptedModels, Throwable lastFailure) {
        super("Tutti i modelli (" + String.join(", ", attemptedModels) + ") non hanno potuto elaborare la richiesta. "
                + "Ultimo errore: " + (lastFailure != null ? lastFailure.getMessage() : "sconosciuto"), lastFailure);
        this.attemptedModels = Collections.unmodifiableList(new ArrayList<>(attemptedModels));
    }

    public List<String> getAttemptedModels() {
        return attemptedModels;
    }
}
