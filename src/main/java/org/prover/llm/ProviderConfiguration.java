package org.prover.llm;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONFIGURAZIONE PROVIDER - Parametri di accesso ai modelli linguistici
 *
 * Ordine di precedenza per ogni parametro:
 * 1. variabile d'ambiente (OPENROUTER_API_KEY, OPENROUTER_BASE_URL, OPENROUTER_MODELS)
 * 2. proprietà di sistema con la stessa chiave del file
 * 3. file prover.properties nel classpath
 *
 * La lista dei modelli è ordinata: è l'ordine di tentativo del fallback.
 */
public final class ProviderConfiguration {

    private static final Logger LOGGER = Logger.getLogger(ProviderConfiguration.class.getName());

    static final String RESOURCE_NAME = "prover.properties";

    static final String KEY_API_KEY = "openrouter.api-key";
    static final String KEY_BASE_URL = "openrouter.base-url";
    static final String KEY_MODELS = "openrouter.models";
    static final String KEY_CONNECT_TIMEOUT = "openrouter.connect-timeout-seconds";
    static final String KEY_READ_TIMEOUT = "openrouter.read-timeout-seconds";

    static final String ENV_API_KEY = "OPENROUTER_API_KEY";
    static final String ENV_BASE_URL = "OPENROUTER_BASE_URL";
    static final String ENV_MODELS = "OPENROUTER_MODELS";

    private static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    private static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_READ_TIMEOUT_SECONDS = 120;

    //region PARAMETRI

    private final String apiKey;
    private final String baseUrl;
    private final List<String> models;
    private final int connectTimeoutSeconds;
    private final int readTimeoutSeconds;

    //endregion

    ProviderConfiguration(String apiKey, String baseUrl, List<String> models,
                          int connectTimeoutSeconds, int readTimeoutSeconds) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("URL base del provider non può essere vuoto");
        }
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("Lista modelli non può essere vuota");
        }
        if (connectTimeoutSeconds <= 0 || readTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout devono essere positivi");
        }

        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.models = Collections.unmodifiableList(new ArrayList<>(models));
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    //region CARICAMENTO

    /**
     * Carica la configurazione da classpath, proprietà di sistema e ambiente del processo.
     */
    public static ProviderConfiguration fromEnvironment() {
        return load(loadBundledProperties(), System.getenv());
    }

    /**
     * Costruisce la configurazione da sorgenti esplicite.
     *
     * @param fileProperties proprietà di default (file)
     * @param environment variabili d'ambiente
     * @return configurazione validata
     * @throws IllegalArgumentException se valori numerici o lista modelli non validi
     */
    static ProviderConfiguration load(Properties fileProperties, Map<String, String> environment) {
        Properties defaults = fileProperties != null ? fileProperties : new Properties();
        Map<String, String> env = environment != null ? environment : Collections.emptyMap();

        String apiKey = resolve(KEY_API_KEY, ENV_API_KEY, defaults, env, null);
        String baseUrl = resolve(KEY_BASE_URL, ENV_BASE_URL, defaults, env, DEFAULT_BASE_URL);
        String models = resolve(KEY_MODELS, ENV_MODELS, defaults, env, "");

        int connectTimeout = parsePositive(resolve(KEY_CONNECT_TIMEOUT, null, defaults, env, null),
                DEFAULT_CONNECT_TIMEOUT_SECONDS, KEY_CONNECT_TIMEOUT);
        int readTimeout = parsePositive(resolve(KEY_READ_TIMEOUT, null, defaults, env, null),
                DEFAULT_READ_TIMEOUT_SECONDS, KEY_READ_TIMEOUT);

        return new ProviderConfiguration(apiKey, baseUrl, parseModelList(models), connectTimeout, readTimeout);
    }

    private static String resolve(String key, String envName, Properties defaults,
                                  Map<String, String> env, String fallback) {
        if (envName != null) {
            String fromEnv = env.get(envName);
            if (fromEnv != null && !fromEnv.isBlank()) {
                return fromEnv.trim();
            }
        }

        String fromSystem = System.getProperty(key);
        if (fromSystem != null && !fromSystem.isBlank()) {
            return fromSystem.trim();
        }

        String fromFile = defaults.getProperty(key);
        if (fromFile != null && !fromFile.isBlank()) {
            return fromFile.trim();
        }
        return fallback;
    }

    /**
     * Divide la lista modelli separata da virgole, preservando l'ordine.
     */
    static List<String> parseModelList(String value) {
        List<String> models = new ArrayList<>();
        if (value == null) {
            return models;
        }
        for (String model : value.split(",")) {
            String trimmed = model.trim();
            if (!trimmed.isEmpty()) {
                models.add(trimmed);
            }
        }
        return models;
    }

    private static int parsePositive(String value, int fallback, String key) {
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException("Valore non positivo per " + key + ": " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valore numerico non valido per " + key + ": " + value, e);
        }
    }

    private static Properties loadBundledProperties() {
        Properties properties = new Properties();
        try (InputStream stream = ProviderConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (stream == null) {
                LOGGER.warning("File " + RESOURCE_NAME + " non trovato nel classpath, uso valori di default");
                return properties;
            }
            properties.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Errore lettura " + RESOURCE_NAME, e);
        }
        return properties;
    }

    //endregion

    //region ACCESSORS

    /**
     * @return chiave API
     * @throws IllegalStateException se la chiave non è configurata
     */
    public String requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(ENV_API_KEY + " non impostata nell'ambiente");
        }
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return modelli in ordine di tentativo
     */
    public List<String> getModels() {
        return models;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("ProviderConfiguration[baseUrl=%s, models=%s, apiKey=%s]",
                baseUrl, models, hasApiKey() ? "***" : "assente");
    }
}
