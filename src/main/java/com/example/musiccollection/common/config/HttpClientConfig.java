package com.example.musiccollection.common.config;

import java.time.Clock;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient catalogHttpClient(AppCatalogProperties properties) {
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig(properties.getConnectTimeoutMs(), properties.getSocketTimeoutMs()))
                .setUserAgent(properties.getUserAgent())
                .disableAutomaticRetries()
                .build();
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient libraryHttpClient(AppLibraryProperties properties) {
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig(properties.getConnectTimeoutMs(), properties.getSocketTimeoutMs()))
                .disableAutomaticRetries()
                .build();
    }

    @Bean
    public Clock syncClock() {
        return Clock.systemDefaultZone();
    }

    private RequestConfig requestConfig(int connectTimeoutMs, int socketTimeoutMs) {
        return RequestConfig.custom()
                .setConnectTimeout(connectTimeoutMs)
                .setConnectionRequestTimeout(connectTimeoutMs)
                .setSocketTimeout(socketTimeoutMs)
                .build();
    }
}
