package com.example.musiccollection.infrastructure.library;

import com.example.musiccollection.common.config.AppLibraryProperties;
import com.example.musiccollection.common.exception.LibraryConnectionException;
import com.example.musiccollection.domain.model.LibraryBrowseItem;
import com.example.musiccollection.domain.model.LibraryBrowseResult;
import com.example.musiccollection.domain.model.LibraryLoadPage;
import com.example.musiccollection.domain.model.LibrarySession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Talks to the JSON bridge that fronts the library core's browse service.
 * <p>
 * Endpoints, all POST with a JSON body:
 * {@code /api/browse/session}, {@code /api/browse/browse}, {@code /api/browse/load},
 * {@code /api/browse/close}.
 */
@Component
public class HttpLibraryBrowseClient implements LibraryBrowseClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLibraryBrowseClient.class);

    private static final String HIERARCHY = "browse";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppLibraryProperties properties;

    public HttpLibraryBrowseClient(@Qualifier("libraryHttpClient") CloseableHttpClient httpClient,
                                   ObjectMapper objectMapper,
                                   AppLibraryProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public LibrarySession openSession() {
        JsonNode response = post("/api/browse/session", objectMapper.createObjectNode());
        String sessionKey = response.path("session_key").asText(null);
        if (!StringUtils.hasText(sessionKey)) {
            throw new LibraryConnectionException("Library bridge returned no session key");
        }
        String coreName = response.path("core_name").asText(null);
        log.info("LIBRARY_SESSION_OPENED core={}", coreName);
        return new LibrarySession(sessionKey, coreName, LocalDateTime.now());
    }

    @Override
    public LibraryBrowseResult browse(LibrarySession session, String itemKey, boolean popAll) {
        ObjectNode body = sessionBody(session);
        if (itemKey != null) {
            body.put("item_key", itemKey);
        }
        if (popAll) {
            body.put("pop_all", true);
        }
        JsonNode response = post("/api/browse/browse", body);
        JsonNode list = response.path("list");
        return new LibraryBrowseResult(
                response.path("action").asText(null),
                list.path("title").asText(null),
                list.path("count").asInt(0));
    }

    @Override
    public LibraryLoadPage load(LibrarySession session, int offset, int count) {
        ObjectNode body = sessionBody(session);
        body.put("offset", offset);
        body.put("count", count);
        JsonNode response = post("/api/browse/load", body);

        List<LibraryBrowseItem> items = new ArrayList<>();
        for (JsonNode item : response.path("items")) {
            items.add(new LibraryBrowseItem(
                    item.path("title").asText(""),
                    item.path("subtitle").asText(null),
                    item.path("item_key").asText(null),
                    item.path("image_key").asText(null),
                    item.path("hint").asText(null)));
        }
        return new LibraryLoadPage(items, response.path("list").path("count").asInt(0));
    }

    @Override
    public void closeSession(LibrarySession session) {
        if (session == null) {
            return;
        }
        try {
            post("/api/browse/close", sessionBody(session));
        } catch (LibraryConnectionException e) {
            log.warn("LIBRARY_SESSION_CLOSE_FAILED core={} reason={}", session.getCoreName(), e.getMessage());
        }
    }

    private ObjectNode sessionBody(LibrarySession session) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("session_key", session.getSessionKey());
        body.put("hierarchy", HIERARCHY);
        return body;
    }

    private JsonNode post(String path, ObjectNode body) {
        HttpPost request = new HttpPost(trimTrailingSlash(properties.getBaseUrl()) + path);
        if (StringUtils.hasText(properties.getToken())) {
            request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken());
        }
        try {
            request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getStatusLine().getStatusCode();
                String payload = response.getEntity() == null
                        ? ""
                        : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                if (statusCode >= 500) {
                    throw new LibraryConnectionException("Library bridge " + path + " returned HTTP " + statusCode);
                }
                if (statusCode >= 400) {
                    throw new IllegalStateException("Library bridge " + path + " rejected request, HTTP " + statusCode);
                }
                return payload.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(payload);
            }
        } catch (IOException e) {
            throw new LibraryConnectionException("Library bridge " + path + " unreachable: " + e.getMessage(), e);
        }
    }

    private String trimTrailingSlash(String value) {
        if (value != null && value.endsWith("/")) {
            return value.substring(0, value.length() - 1);
        }
        return value;
    }
}
