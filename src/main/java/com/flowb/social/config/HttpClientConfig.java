package com.flowb.social.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
public class HttpClientConfig {

    private final DataStoreProperties properties;

    public HttpClientConfig(DataStoreProperties properties) {
        this.properties = properties;
    }

    /**
     * Shared client for the data store, channel senders and the federation lookup.
     * Read timeouts are applied per request.
     */
    @Bean
    public HttpClient externalHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
