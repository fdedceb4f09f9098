package com.programmersdiary.marketdaemon.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} over the Upstash Redis REST protocol: each command is
 * a path such as {@code /keys/<pattern>} and answers {@code {"result": ...}}
 * or {@code {"error": "..."}}.
 */
@Component
public class UpstashRestStore implements KeyValueStore {

    private final RestClient restClient;

    public UpstashRestStore(
            RestClient.Builder restClientBuilder,
            @Value("${marketdaemon.cache.rest-url:}") String restUrl,
            @Value("${marketdaemon.cache.rest-token:}") String restToken) {
        this.restClient = hasText(restUrl) && hasText(restToken)
                ? restClientBuilder
                        .baseUrl(restUrl)
                        .defaultHeader("Authorization", "Bearer " + restToken)
                        .build()
                : null;
    }

    public boolean isConfigured() {
        return restClient != null;
    }

    @Override
    public void requireConfigured() {
        requireClient();
    }

    @Override
    public List<String> keys(String pattern) {
        var result = execute("KEYS " + pattern, () -> requireClient().get()
                .uri("/keys/{pattern}", pattern)
                .retrieve()
                .body(UpstashResponse.class));
        if (!result.isArray()) {
            throw new CacheStoreException("KEYS " + pattern + " returned a non-array result: " + result);
        }
        var keys = new ArrayList<String>(result.size());
        result.forEach(node -> keys.add(node.asText()));
        return keys;
    }

    @Override
    public long delete(String key) {
        return execute("DEL " + key, () -> requireClient().post()
                .uri("/del/{key}", key)
                .retrieve()
                .body(UpstashResponse.class))
                .asLong();
    }

    private RestClient requireClient() {
        if (restClient == null) {
            throw new ConfigurationMissingException(
                    "Cache store is not configured: set marketdaemon.cache.rest-url and marketdaemon.cache.rest-token");
        }
        return restClient;
    }

    private JsonNode execute(String command, Supplier<UpstashResponse> call) {
        requireClient();
        UpstashResponse response;
        try {
            response = call.get();
        } catch (RestClientResponseException e) {
            throw new CacheStoreException(command + " failed with " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new CacheStoreException(command + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new CacheStoreException(command + " returned an empty response");
        }
        if (response.error() != null) {
            throw new CacheStoreException(command + " failed: " + response.error());
        }
        if (response.result() == null) {
            throw new CacheStoreException(command + " returned no result");
        }
        return response.result();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record UpstashResponse(
            @JsonProperty("result") JsonNode result,
            @JsonProperty("error") String error) {}
}
