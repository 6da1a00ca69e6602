package org.prover.llm;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt di sistema caricati dal classpath (prompts/&lt;modulo&gt;.txt) e tenuti in cache.
 */
public class PromptRepository {

    public static final String FORMALIZER = "formalizer";
    public static final String EXPLAINER = "explainer";

    private static final String PROMPTS_DIRECTORY = "prompts/";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    /**
     * @param module nome del modulo, es. {@value #FORMALIZER}
     * @return testo del prompt senza spazi ai bordi
     * @throws IllegalStateException se il prompt non esiste nel classpath
     */
    public String getPrompt(String module) {
        return cache.computeIfAbsent(module, this::loadPrompt);
    }

    private String loadPrompt(String module) {
        String resource = PROMPTS_DIRECTORY + module + ".txt";
        try (InputStream stream = PromptRepository.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                throw new IllegalStateException("Prompt per il modulo '" + module + "' non trovato: " + resource);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Errore lettura prompt " + resource, e);
        }
    }
}
