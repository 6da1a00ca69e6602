package org.prover.llm;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import okhttp3.*;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Provider OpenRouter (API compatibile OpenAI chat completions).
 *
 * Richiede OPENROUTER_API_KEY; l'URL base e i timeout arrivano da {@link ProviderConfiguration}.
 */
public class OpenRouterProvider implements LanguageModelProvider {

    private static final Logger LOGGER = Logger.getLogger(OpenRouterProvider.class.getName());

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client;
    private final String endpoint;
    private final String apiKey;
    private final Gson gson = new Gson();

    public OpenRouterProvider(ProviderConfiguration configuration) {
        this(configuration.getBaseUrl(), configuration.requireApiKey(), new OkHttpClient.Builder()
                .connectTimeout(configuration.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(configuration.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(configuration.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .build());
    }

    OpenRouterProvider(String baseUrl, String apiKey, OkHttpClient client) {
        this.endpoint = baseUrl.replaceAll("/$", "") + "/chat/completions";
        this.apiKey = apiKey;
        this.client = client;
    }

    @Override
    public String complete(String model, String systemPrompt, String userText, String userTag) throws IOException {
        Request.Builder request = new Request.Builder()
                .url(endpoint)
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(gson.toJson(buildRequestBody(model, systemPrompt, userText)), JSON));

        if (userTag != null && !userTag.isBlank()) {
            request.addHeader("X-Title", "prover-user-" + userTag);
        }

        LOGGER.fine("Richiesta a " + endpoint + " con modello " + model);

        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new IOException("Risposta vuota da OpenRouter (HTTP " + response.code() + ")");
            }
            String json = responseBody.string();
            if (!response.isSuccessful()) {
                throw new IOException("OpenRouter HTTP " + response.code() + ": " + json);
            }
            return extractContent(json);
        }
    }

    /**
     * Corpo della richiesta: modello e messaggi system/user.
     */
    JsonObject buildRequestBody(String model, String systemPrompt, String userText) {
        JsonObject body = new JsonObject();
        body.addProperty("model", model);

        JsonArray messages = new JsonArray();
        messages.add(message("system", systemPrompt));
        messages.add(message("user", userText));
        body.add("messages", messages);
        return body;
    }

    private static JsonObject message(String role, String content) {
        JsonObject message = new JsonObject();
        message.addProperty("role", role);
        message.addProperty("content", content != null ? content : "");
        return message;
    }

    /**
     * Estrae il testo della prima scelta dalla risposta JSON.
     *
     * @throws IOException se la risposta contiene un errore o non ha scelte
     */
    static String extractContent(String json) throws IOException {
        JsonObject obj;
        try {
            obj = JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonSyntaxException | IllegalStateException e) {
            throw new IOException("Risposta OpenRouter non è JSON valido", e);
        }

        if (obj.has("error")) {
            throw new IOException("Errore OpenRouter: " + obj.get("error").toString());
        }

        JsonArray choices = obj.getAsJsonArray("choices");
        if (choices == null || choices.size() == 0) {
            throw new IOException("Risposta OpenRouter senza scelte");
        }

        JsonObject message = choices.get(0).getAsJsonObject().getAsJsonObject("message");
        if (message == null) {
            throw new IOException("Risposta OpenRouter senza messaggio");
        }
        JsonElement content = message.get("content");
        if (content == null || content.isJsonNull()) {
            return "";
        }
        return content.getAsString().trim();
    }

    @Override
    public String getProviderName() {
        return "OpenRouter";
    }
}
