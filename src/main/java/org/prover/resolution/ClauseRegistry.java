package org.prover.resolution;

import org.prover.support.Clause;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registro degli identificatori di clausola per una singola prova.
 *
 * Assegna numeri progressivi da 1 nell'ordine di prima apparizione (clausole iniziali,
 * poi risolventi). Clausole uguali per insieme di letterali condividono lo stesso ID.
 * Non è thread-safe: ogni esecuzione del motore ne possiede uno proprio.
 */
public final class ClauseRegistry {

    private final Map<Clause, Integer> identifiers = new LinkedHashMap<>();

    private int nextIdentifier = 1;

    /**
     * Restituisce l'ID della clausola, assegnandone uno nuovo alla prima richiesta.
     *
     * @param clause clausola da identificare
     * @return identificatore positivo stabile per questa prova
     */
    public int idOf(Clause clause) {
        if (clause == null) {
            throw new IllegalArgumentException("Clausola null non registrabile");
        }

        Integer existing = identifiers.get(clause);
        if (existing != null) {
            return existing;
        }

        int assigned = nextIdentifier++;
        identifiers.put(clause, assigned);
        return assigned;
    }

    public boolean contains(Clause clause) {
        return identifiers.containsKey(clause);
    }

    public int size() {
        return identifiers.size();
    }

}
