package com.example.musiccollection.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.catalog")
public class AppCatalogProperties {

    private String baseUrl = "https://api.discogs.com";

    private String token;

    private String username;

    private String userAgent = "MusicCollectionManager/1.0";

    private int perPage = 100;

    /**
     * Pause after every listing page.
     */
    private int pageDelayMs = 1000;

    /**
     * Pause after every per-release stats or release request.
     */
    private int detailDelayMs = 2000;

    /**
     * Pause after an HTTP 429 before the same request is repeated.
     */
    private int rateLimitCooldownMs = 10000;

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 30000;
}
