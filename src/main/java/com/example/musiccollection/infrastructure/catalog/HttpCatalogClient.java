package com.example.musiccollection.infrastructure.catalog;

import com.example.musiccollection.common.config.AppCatalogProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class HttpCatalogClient implements CatalogClient {

    private final CloseableHttpClient httpClient;
    private final AppCatalogProperties properties;

    public HttpCatalogClient(@Qualifier("catalogHttpClient") CloseableHttpClient httpClient,
                             AppCatalogProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public CatalogResponse get(String pathAndQuery) throws IOException {
        String baseUrl = properties.getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        HttpGet request = new HttpGet(baseUrl + pathAndQuery);
        if (StringUtils.hasText(properties.getToken())) {
            request.setHeader(HttpHeaders.AUTHORIZATION, "Discogs token=" + properties.getToken());
        }
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getStatusLine().getStatusCode();
            String body = null;
            if (statusCode == 200 && response.getEntity() != null) {
                body = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            } else {
                EntityUtils.consumeQuietly(response.getEntity());
            }
            return new CatalogResponse(statusCode, body);
        }
    }
}
