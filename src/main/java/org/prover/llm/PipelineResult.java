package org.prover.llm;

import org.prover.resolution.ProofResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Esiti delle tre fasi della pipeline: formalizzazione, risoluzione, spiegazione.
 */
public class PipelineResult {

    private final String formalized;
    private final List<String> clauses;
    private final ProofResult proof;
    private final String explanation;

    public PipelineResult(String formalized, List<String> clauses, ProofResult proof, String explanation) {
        if (proof == null) {
            throw new IllegalArgumentException("Risultato della prova non può essere null");
        }
        this.formalized = formalized;
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
        this.proof = proof;
        this.explanation = explanation;
    }

    /** @return testo restituito dal formalizzatore */
    public String getFormalized() {
        return formalized;
    }

    /** @return clausole estratte dal testo formalizzato */
    public List<String> getClauses() {
        return clauses;
    }

    public ProofResult getProof() {
        return proof;
    }

    public boolean isContradictionFound() {
        return proof.isContradictionFound();
    }

    public String getExplanation() {
        return explanation;
    }
}
