package com.example.musiccollection.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    /**
     * HTTP bridge in front of the library core's browse service.
     */
    private String baseUrl = "http://localhost:3001";

    private String token;

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 30000;

    /**
     * Navigation attempts before the source is marked failed.
     */
    private int maxRetry = 2;

    private int retryBackoffMs = 2000;

    private int navigationDelayMs = 500;

    private int pageDelayMs = 100;

    private int pageSize = 100;

    private List<String> physicalTags = new ArrayList<>(Arrays.asList("mycds", "mylps"));

    /**
     * Action entry the core lists first inside every tag; not an album.
     */
    private String playTagTitle = "Play Tag";

    public Set<String> normalizedPhysicalTags() {
        return physicalTags.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
