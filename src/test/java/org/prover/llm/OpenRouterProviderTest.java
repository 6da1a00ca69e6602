package org.prover.llm;

import com.google.gson.JsonObject;
import okhttp3.OkHttpClient;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class OpenRouterProviderTest {

    @Test
    public void testExtractContent() throws IOException {
        String json = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  P(a), ¬P(a) \\n\"}}]}";

        assertEquals("P(a), ¬P(a)", OpenRouterProvider.extractContent(json));
    }

    @Test
    public void testNullContentBecomesEmpty() throws IOException {
        assertEquals("", OpenRouterProvider.extractContent("{\"choices\":[{\"message\":{\"content\":null}}]}"));
    }

    @Test(expected = IOException.class)
    public void testErrorPayload() throws IOException {
        OpenRouterProvider.extractContent("{\"error\":{\"code\":429,\"message\":\"rate limited\"}}");
    }

    @Test(expected = IOException.class)
    public void testMissingChoices() throws IOException {
        OpenRouterProvider.extractContent("{\"choices\":[]}");
    }

    @Test(expected = IOException.class)
    public void testInvalidJson() throws IOException {
        OpenRouterProvider.extractContent("<html>Bad Gateway</html>");
    }

    @Test
    public void testRequestBody() {
        OpenRouterProvider provider = new OpenRouterProvider("https://example.invalid/api/v1", "chiave", new OkHttpClient());

        JsonObject body = provider.buildRequestBody("modello", "sistema", "utente");

        assertEquals("modello", body.get("model").getAsString());
        assertEquals(2, body.getAsJsonArray("messages").size());
        JsonObject system = body.getAsJsonArray("messages").get(0).getAsJsonObject();
        assertEquals("system", system.get("role").getAsString());
        assertEquals("sistema", system.get("content").getAsString());
        assertEquals("utente", body.getAsJsonArray("messages").get(1).getAsJsonObject().get("content").getAsString());
        assertEquals("OpenRouter", provider.getProviderName());
    }
}
