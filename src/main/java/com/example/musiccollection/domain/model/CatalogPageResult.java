package com.example.musiccollection.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Items accumulated by a paged listing. When {@code abortError} is set the listing stopped
 * early; the items gathered before that point are still valid.
 */
@Data
public class CatalogPageResult {

    private final List<CatalogRelease> items = new ArrayList<>();

    private int pagesFetched;

    private int totalPages;

    private int rateLimitedCount;

    private FetchError abortError;

    public boolean isComplete() {
        return abortError == null;
    }
}
