package fr.lapetina.thesis.client;

import fr.lapetina.thesis.client.domain.exception.ConfigurationException;
import fr.lapetina.thesis.client.domain.model.AiResponse;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.search.SearchClientPool;
import fr.lapetina.thesis.client.support.TestConfigs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientContextTest {

    @Test
    @DisplayName("should wire the AI client without a search pool by default")
    void shouldWireWithoutSearch() {
        try (TestClientContext context = TestClientContext.create()) {
            AiResponse response = context.getAiClient().send("Hello");

            assertThat(response.content()).isNotBlank();
            assertThat(context.getSearchPool()).isEmpty();
            assertThat(context.getConnectionPool().isInitialized()).isTrue();
        }
    }

    @Test
    @DisplayName("should build the search pool from a static access token")
    void shouldBuildSearchPool() {
        ClientConfig config = TestConfigs.fastConfig("openai");
        config.getSearch().setEnabled(true);
        config.getSearch().setMaxClients(3);
        config.getSearch().setAccessToken("static-token");

        try (TestClientContext context = TestClientContext.create(config)) {
            assertThat(context.getSearchPool()).isPresent();
            SearchClientPool pool = context.getSearchPool().get();
            assertThat(pool.getMaxClients()).isEqualTo(3);
            assertThat(pool.getAvailableClients()).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("should reject enabled search without credentials")
    void shouldRejectSearchWithoutCredentials() {
        ClientConfig config = TestConfigs.fastConfig("openai");
        config.getSearch().setEnabled(true);

        assertThatThrownBy(() -> TestClientContext.create(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("search.accessToken");
    }

    @Test
    @DisplayName("should expose the scrape only while metrics are enabled")
    void shouldGateMetricsScrape() {
        ClientConfig config = TestConfigs.fastConfig("openai");
        config.getMetrics().setPrefix("ctx");

        try (TestClientContext context = TestClientContext.create(config)) {
            context.getAiClient().send("Hello");

            assertThat(context.scrapeMetrics()).hasValueSatisfying(text -> assertThat(text).contains("ctx_calls_total"));

            config.getMetrics().setEnabled(false);
            assertThat(context.scrapeMetrics()).isEmpty();
        }
    }
}
