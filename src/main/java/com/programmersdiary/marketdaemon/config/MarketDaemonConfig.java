package com.programmersdiary.marketdaemon.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MarketDaemonConfig {

    @Bean
    public RestClientCustomizer timeoutCustomizer(
            @Value("${marketdaemon.http.connect-timeout:5s}") Duration connectTimeout,
            @Value("${marketdaemon.http.read-timeout:30s}") Duration readTimeout) {
        return builder -> {
            var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService cacheDeleteExecutor(
            @Value("${marketdaemon.cache.delete-parallelism:8}") int parallelism) {
        return Executors.newFixedThreadPool(Math.max(1, parallelism));
    }
}
