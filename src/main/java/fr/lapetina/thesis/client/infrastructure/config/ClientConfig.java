package fr.lapetina.thesis.client.infrastructure.config;

import fr.lapetina.thesis.client.domain.model.BackendKind;

/**
 * Root configuration object for the client layer.
 * Designed to be populated from YAML.
 */
public class ClientConfig {

    private PoolConfig pool = new PoolConfig();
    private CredentialsConfig credentials = new CredentialsConfig();
    private BackendConfig openai = BackendConfig.openAiDefaults();
    private BackendConfig gemini = BackendConfig.geminiDefaults();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private SessionConfig session = new SessionConfig();
    private SearchConfig search = new SearchConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public CredentialsConfig getCredentials() { return credentials; }
    public void setCredentials(CredentialsConfig credentials) { this.credentials = credentials; }

    public BackendConfig getOpenai() { return openai; }
    public void setOpenai(BackendConfig openai) { this.openai = openai; }

    public BackendConfig getGemini() { return gemini; }
    public void setGemini(BackendConfig gemini) { this.gemini = gemini; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public SessionConfig getSession() { return session; }
    public void setSession(SessionConfig session) { this.session = session; }

    public SearchConfig getSearch() { return search; }
    public void setSearch(SearchConfig search) { this.search = search; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Returns the backend section for the given kind.
     */
    public BackendConfig backend(BackendKind kind) {
        return kind == BackendKind.OPENAI ? openai : gemini;
    }

    /**
     * Worker and connection pool sizing.
     */
    public static class PoolConfig {
        private int maxWorkers = 5;
        private int maxConnections = 10;
        private String backendKind = "auto";
        private long batchTimeoutMs = 60000;
        private long shutdownTimeoutMs = 5000;

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

        public int getMaxConnections() { return maxConnections; }
        public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

        public String getBackendKind() { return backendKind; }
        public void setBackendKind(String backendKind) { this.backendKind = backendKind; }

        public long getBatchTimeoutMs() { return batchTimeoutMs; }
        public void setBatchTimeoutMs(long batchTimeoutMs) { this.batchTimeoutMs = batchTimeoutMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Where the AI API key and endpoint come from.
     * An inline {@code apiKey} wins over the environment variable.
     */
    public static class CredentialsConfig {
        private String apiKey;
        private String apiKeyEnv = "GOOGLE_API_KEY";
        private String apiBaseEnv = "GOOGLE_API_BASE";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getApiBaseEnv() { return apiBaseEnv; }
        public void setApiBaseEnv(String apiBaseEnv) { this.apiBaseEnv = apiBaseEnv; }
    }

    /**
     * Per-backend model and retry settings.
     */
    public static class BackendConfig {
        private boolean enabled = true;
        private String modelName;
        private String apiBase;
        private double temperature = 0.7;
        private int maxTokens = 1048576;
        private long timeoutMs = 120000;
        private int maxRetries = 3;
        private long retryDelayMs = 1000;
        private boolean exponentialBackoff = true;
        private double backoffFactor = 2.0;
        private String systemPrompt;

        static BackendConfig openAiDefaults() {
            BackendConfig config = new BackendConfig();
            config.setModelName(BackendKind.OPENAI.getDefaultModel());
            config.setTemperature(0.1);
            config.setSystemPrompt("You are a helpful assistant specialized in academic research and literature review.");
            return config;
        }

        static BackendConfig geminiDefaults() {
            BackendConfig config = new BackendConfig();
            config.setModelName(BackendKind.GEMINI.getDefaultModel());
            config.setApiBase("https://generativelanguage.googleapis.com");
            return config;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getModelName() { return modelName; }
        public void setModelName(String modelName) { this.modelName = modelName; }

        public String getApiBase() { return apiBase; }
        public void setApiBase(String apiBase) { this.apiBase = apiBase; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }

        public boolean isExponentialBackoff() { return exponentialBackoff; }
        public void setExponentialBackoff(boolean exponentialBackoff) { this.exponentialBackoff = exponentialBackoff; }

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public String getSystemPrompt() { return systemPrompt; }
        public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }
    }

    /**
     * Circuit breaker thresholds, applied to the breaker each chat session owns.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long resetTimeoutMs = 300000;
        private int halfOpenMaxCalls = 3;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getResetTimeoutMs() { return resetTimeoutMs; }
        public void setResetTimeoutMs(long resetTimeoutMs) { this.resetTimeoutMs = resetTimeoutMs; }

        public int getHalfOpenMaxCalls() { return halfOpenMaxCalls; }
        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) { this.halfOpenMaxCalls = halfOpenMaxCalls; }
    }

    /**
     * Session expiry and conversation history settings.
     */
    public static class SessionConfig {
        private long maxIdleSeconds = 3600;
        private int maxHistoryPairs = 5;
        private boolean compressHistory = true;
        private long sweepIntervalMs = 60000;

        public long getMaxIdleSeconds() { return maxIdleSeconds; }
        public void setMaxIdleSeconds(long maxIdleSeconds) { this.maxIdleSeconds = maxIdleSeconds; }

        public int getMaxHistoryPairs() { return maxHistoryPairs; }
        public void setMaxHistoryPairs(int maxHistoryPairs) { this.maxHistoryPairs = maxHistoryPairs; }

        public boolean isCompressHistory() { return compressHistory; }
        public void setCompressHistory(boolean compressHistory) { this.compressHistory = compressHistory; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    /**
     * Literature search service settings.
     */
    public static class SearchConfig {
        private boolean enabled = false;
        private int maxClients = 5;
        private String searchUrl = "https://api.cnki.net/v1/search";
        private String oauthUrl = "https://api.cnki.net/oauth/token";
        private String uniplatform;
        private String accessToken;
        private String clientId;
        private String clientSecret;
        private int pageSize = 50;
        private String defaultPublicationUpperBound = "20220101";
        private long requestTimeoutMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxClients() { return maxClients; }
        public void setMaxClients(int maxClients) { this.maxClients = maxClients; }

        public String getSearchUrl() { return searchUrl; }
        public void setSearchUrl(String searchUrl) { this.searchUrl = searchUrl; }

        public String getOauthUrl() { return oauthUrl; }
        public void setOauthUrl(String oauthUrl) { this.oauthUrl = oauthUrl; }

        public String getUniplatform() { return uniplatform; }
        public void setUniplatform(String uniplatform) { this.uniplatform = uniplatform; }

        public String getAccessToken() { return accessToken; }
        public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }

        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

        public int getPageSize() { return pageSize; }
        public void setPageSize(int pageSize) { this.pageSize = pageSize; }

        public String getDefaultPublicationUpperBound() { return defaultPublicationUpperBound; }
        public void setDefaultPublicationUpperBound(String bound) { this.defaultPublicationUpperBound = bound; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "thesis_client";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
