package com.programmersdiary.marketdaemon.cache;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.RequestMatcher;
import org.springframework.web.client.RestClient;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class UpstashRestStoreTest {

    private static final String URL = "https://eu1-fancy-cat.upstash.io";

    @Test
    void listsKeysByPatternWithBearerToken() {
        var builder = RestClient.builder();
        var server = MockRestServiceServer.bindTo(builder).build();
        var store = new UpstashRestStore(builder, URL, "secret-token");
        server.expect(path("/keys/material_prices:*"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer secret-token"))
                .andRespond(withSuccess("{\"result\":[\"material_prices:A\",\"material_prices:B\"]}",
                        MediaType.APPLICATION_JSON));

        assertThat(store.keys("material_prices:*")).containsExactly("material_prices:A", "material_prices:B");
        server.verify();
    }

    @Test
    void deletesKeyAndReturnsRemovedCount() {
        var builder = RestClient.builder();
        var server = MockRestServiceServer.bindTo(builder).build();
        var store = new UpstashRestStore(builder, URL, "secret-token");
        server.expect(path("/del/material_prices:Copper,Nickel:2025-01-01"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"result\":1}", MediaType.APPLICATION_JSON));

        assertThat(store.delete("material_prices:Copper,Nickel:2025-01-01")).isEqualTo(1);
        server.verify();
    }

    @Test
    void errorEnvelopeBecomesStoreException() {
        var builder = RestClient.builder();
        var server = MockRestServiceServer.bindTo(builder).build();
        var store = new UpstashRestStore(builder, URL, "secret-token");
        server.expect(path("/keys/*"))
                .andRespond(withSuccess("{\"error\":\"ERR max request size exceeded\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> store.keys("*"))
                .isInstanceOf(CacheStoreException.class)
                .hasMessageContaining("ERR max request size exceeded");
    }

    @Test
    void unauthorizedResponseBecomesStoreException() {
        var builder = RestClient.builder();
        var server = MockRestServiceServer.bindTo(builder).build();
        var store = new UpstashRestStore(builder, URL, "wrong-token");
        server.expect(path("/del/market_indicators"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Unauthorized\"}"));

        assertThatThrownBy(() -> store.delete("market_indicators"))
                .isInstanceOf(CacheStoreException.class)
                .hasMessageContaining("401");
    }

    @Test
    void missingCredentialsFailFastWithoutNetworkCalls() {
        var builder = RestClient.builder();
        var server = MockRestServiceServer.bindTo(builder).build();
        var store = new UpstashRestStore(builder, URL, " ");
        var executor = Executors.newSingleThreadExecutor();
        try {
            var invalidator = new CacheInvalidator(store, executor);

            assertThat(store.isConfigured()).isFalse();
            assertThatThrownBy(() -> invalidator.clearByPrefix("material_prices:"))
                    .isInstanceOf(ConfigurationMissingException.class)
                    .hasMessageContaining("marketdaemon.cache.rest-url");
            assertThatThrownBy(() -> store.delete("market_indicators"))
                    .isInstanceOf(ConfigurationMissingException.class);
            server.verify();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void exactKeyClearWithoutCredentialsIsAConfigurationError() {
        var builder = RestClient.builder();
        var server = MockRestServiceServer.bindTo(builder).build();
        var store = new UpstashRestStore(builder, "", "");
        var executor = Executors.newSingleThreadExecutor();
        try {
            var invalidator = new CacheInvalidator(store, executor);

            assertThatThrownBy(() -> invalidator.clearTarget(CacheTarget.MARKET_INDICATORS))
                    .isInstanceOf(ConfigurationMissingException.class);
            assertThatThrownBy(() -> invalidator.clearKeys(List.of("technical_articles_list")))
                    .isInstanceOf(ConfigurationMissingException.class);
            assertThatThrownBy(invalidator::status)
                    .isInstanceOf(ConfigurationMissingException.class);
            server.verify();
        } finally {
            executor.shutdownNow();
        }
    }

    private static RequestMatcher path(String expected) {
        return request -> assertThat(URLDecoder.decode(request.getURI().getRawPath(), StandardCharsets.UTF_8))
                .isEqualTo(expected);
    }
}
