package com.programmersdiary.marketdaemon.indicators;

import com.fasterxml.jackson.databind.JsonNode;
import com.programmersdiary.marketdaemon.scheduling.RefreshAction;
import com.programmersdiary.marketdaemon.scheduling.RefreshResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Asks the dashboard to recompute its market indicators dataset.
 */
@Component
public class MarketIndicatorsClient implements RefreshAction {

    private static final Logger log = LoggerFactory.getLogger(MarketIndicatorsClient.class);

    private final RestClient restClient;
    private final String refreshPath;

    public MarketIndicatorsClient(
            RestClient.Builder restClientBuilder,
            @Value("${marketdaemon.refresh.site-url:http://localhost:3000}") String siteUrl,
            @Value("${marketdaemon.refresh.path:/api/market-indicators}") String refreshPath) {
        this.restClient = restClientBuilder
                .baseUrl(siteUrl)
                .defaultHeader("Accept", "application/json")
                .build();
        this.refreshPath = refreshPath;
    }

    @Override
    public RefreshResult refresh() {
        log.info("Market indicators refresh started: POST {}", refreshPath);
        try {
            var response = restClient.post()
                    .uri(refreshPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .toEntity(JsonNode.class);
            log.info("Market indicators refresh succeeded with status {}", response.getStatusCode().value());
            log.debug("Market indicators refresh payload: {}", response.getBody());
            return RefreshResult.ok(response.getStatusCode().value(), response.getBody());
        } catch (RestClientResponseException e) {
            log.error("Market indicators refresh failed: {} {}", e.getStatusCode().value(), e.getStatusText());
            var body = e.getResponseBodyAsString();
            return RefreshResult.failed(e.getStatusCode().value(), body.isBlank() ? e.getStatusText() : body);
        } catch (RestClientException e) {
            log.error("Market indicators refresh could not reach {}: {}", refreshPath, e.getMessage());
            return RefreshResult.failed(null, e.getMessage());
        }
    }
}
