package org.prover.llm;

import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class ModelFallbackClientTest {

    @Test
    public void testFirstAvailableModelAnswers() {
        List<String> attempts = new ArrayList<>();
        LanguageModelProvider provider = (model, systemPrompt, userText, userTag) -> {
            attempts.add(model);
            if (model.equals("primo")) {
                throw new IOException("HTTP 429");
            }
            return "risposta da " + model;
        };

        ModelFallbackClient client = new ModelFallbackClient(provider, Arrays.asList("primo", "secondo", "terzo"));

        assertEquals("risposta da secondo", client.complete("sistema", "utente", "42"));
        assertEquals(Arrays.asList("primo", "secondo"), attempts);
    }

    @Test
    public void testRuntimeFailuresAlsoFallBack() {
        LanguageModelProvider provider = (model, systemPrompt, userText, userTag) -> {
            if (model.equals("primo")) {
                throw new IllegalStateException("risposta malformata");
            }
            return "ok";
        };

        assertEquals("ok", new ModelFallbackClient(provider, Arrays.asList("primo", "secondo"))
                .complete("s", "u", null));
    }

    @Test
    public void testAllModelsFailing() {
        LanguageModelProvider provider = (model, systemPrompt, userText, userTag) -> {
            throw new IOException("guasto " + model);
        };

        try {
            new ModelFallbackClient(provider, Arrays.asList("primo", "secondo")).complete("s", "u", null);
            fail("Attesa LanguageModelException");
        } catch (LanguageModelException e) {
            assertEquals(Arrays.asList("primo", "secondo"), e.getAttemptedModels());
            assertTrue(e.getCause() instanceof IOException);
            assertEquals("guasto secondo", e.getCause().getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyModelListRejected() {
        new ModelFallbackClient((model, systemPrompt, userText, userTag) -> "", Collections.emptyList());
    }
}
