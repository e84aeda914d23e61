package fr.lapetina.thesis.client;

import fr.lapetina.thesis.client.domain.exception.ConfigurationException;
import fr.lapetina.thesis.client.domain.model.AccessToken;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment;
import fr.lapetina.thesis.client.infrastructure.config.ConfigLoader;
import fr.lapetina.thesis.client.infrastructure.http.BackendFactory;
import fr.lapetina.thesis.client.infrastructure.http.HttpBackendFactory;
import fr.lapetina.thesis.client.infrastructure.http.ObjectMappers;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import fr.lapetina.thesis.client.pool.BackendDetector;
import fr.lapetina.thesis.client.pool.ConnectionPool;
import fr.lapetina.thesis.client.search.AccessTokenClient;
import fr.lapetina.thesis.client.search.SearchClientPool;
import fr.lapetina.thesis.client.session.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Wires the client layer from configuration: metrics, AI client and, when enabled,
 * the literature search pool. Components are created here and passed explicitly.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ClientContext context = ClientContext.create("config.yaml")) {
 *     AiResponse response = context.getAiClient().send("Hello");
 *     context.getSearchPool().ifPresent(pool -> pool.dispatchConcurrent(queries));
 * }
 * }</pre>
 */
public class ClientContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientContext.class);

    private final ClientConfig config;
    private final ClientMetrics metrics;
    private final ConnectionPool connectionPool;
    private final ConcurrentAiClient aiClient;
    private final SearchClientPool searchPool;

    protected ClientContext(ClientConfig config, ClientEnvironment environment,
                            BackendFactory backendFactoryOverride, SearchClientPool searchPoolOverride) {
        this.config = config;
        this.metrics = new ClientMetrics(config.getMetrics().getPrefix());

        // Allow override for testing
        BackendFactory backendFactory = backendFactoryOverride != null
                ? backendFactoryOverride
                : new HttpBackendFactory(config, environment);

        this.connectionPool = new ConnectionPool(
                config,
                environment,
                backendFactory,
                new BackendDetector(),
                new SessionFactory(config, metrics),
                metrics,
                Clock.systemUTC()
        );
        this.aiClient = new ConcurrentAiClient(config, connectionPool);

        if (searchPoolOverride != null) {
            this.searchPool = searchPoolOverride;
        } else if (config.getSearch().isEnabled()) {
            this.searchPool = SearchClientPool.create(config.getSearch(), resolveAccessToken(config.getSearch()), metrics);
        } else {
            this.searchPool = null;
        }

        log.info("ClientContext initialized: searchEnabled={}, maxWorkers={}, maxConnections={}",
                searchPool != null, config.getPool().getMaxWorkers(), config.getPool().getMaxConnections());
    }

    /**
     * Creates a context from the specified configuration file, reading credentials from the process environment.
     */
    public static ClientContext create(String configPath) {
        log.info("Creating ClientContext from config: {}", configPath);
        return new ClientContext(new ConfigLoader(configPath).load(), ClientEnvironment.system(), null, null);
    }

    /**
     * Creates a context from the default configuration (config.yaml).
     */
    public static ClientContext create() {
        return create("config.yaml");
    }

    public static ClientContext create(ClientConfig config, ClientEnvironment environment) {
        return new ClientContext(config, environment, null, null);
    }

    private static String resolveAccessToken(ClientConfig.SearchConfig search) {
        if (search.getAccessToken() != null && !search.getAccessToken().isBlank()) {
            return search.getAccessToken();
        }
        if (search.getClientId() == null || search.getClientSecret() == null) {
            throw new ConfigurationException(
                    "Search is enabled but neither search.accessToken nor search.clientId/clientSecret is set");
        }

        AccessTokenClient tokenClient = new AccessTokenClient(
                HttpClient.newHttpClient(),
                ObjectMappers.standard(),
                search.getOauthUrl(),
                Duration.ofMillis(search.getRequestTimeoutMs())
        );
        try {
            AccessToken token = tokenClient.fetch(search.getClientId(), search.getClientSecret());
            return token.value();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to obtain search access token: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationException("Interrupted while obtaining search access token", e);
        }
    }

    public ClientConfig getConfig() {
        return config;
    }

    public ClientMetrics getMetrics() {
        return metrics;
    }

    /**
     * Prometheus exposition of every client meter, or empty when metrics exposure is disabled.
     */
    public Optional<String> scrapeMetrics() {
        return config.getMetrics().isEnabled() ? Optional.of(metrics.scrape()) : Optional.empty();
    }

    public ConcurrentAiClient getAiClient() {
        return aiClient;
    }

    public ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    /**
     * Search pool, absent when search is disabled.
     */
    public Optional<SearchClientPool> getSearchPool() {
        return Optional.ofNullable(searchPool);
    }

    @Override
    public void close() {
        log.info("Shutting down ClientContext...");

        try {
            aiClient.close();
        } catch (Exception e) {
            log.warn("Error closing AI client", e);
        }

        if (searchPool != null) {
            try {
                searchPool.close();
            } catch (Exception e) {
                log.warn("Error closing search pool", e);
            }
        }

        metrics.close();
        log.info("ClientContext shut down");
    }
}
