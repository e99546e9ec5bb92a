package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppCatalogProperties;
import com.example.musiccollection.domain.model.CatalogPageResult;
import com.example.musiccollection.domain.model.CatalogTrack;
import com.example.musiccollection.domain.model.FetchError;
import com.example.musiccollection.domain.model.FetchResult;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.example.musiccollection.infrastructure.catalog.CatalogClient;
import com.example.musiccollection.infrastructure.catalog.CatalogListingPage;
import com.example.musiccollection.infrastructure.catalog.CatalogPayloadParser;
import com.example.musiccollection.infrastructure.catalog.CatalogResponse;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Rate-limited reads from the catalog API.
 * <p>
 * Listings page until {@code pagination.pages}; an HTTP 429 waits out the cooldown and repeats
 * the same page, any other failure ends the listing and keeps what was gathered. Per-release
 * detail calls are best effort and never throw.
 */
@Service
public class CatalogFetchService {

    private static final Logger log = LoggerFactory.getLogger(CatalogFetchService.class);

    static final String ENDPOINT_COLLECTION = "collection";
    static final String ENDPOINT_WANTLIST = "wantlist";
    static final String ENDPOINT_STATS = "marketplace_stats";
    static final String ENDPOINT_RELEASE = "release";

    private final CatalogClient catalogClient;
    private final CatalogPayloadParser payloadParser;
    private final AppCatalogProperties properties;
    private final MeterRegistry meterRegistry;

    public CatalogFetchService(CatalogClient catalogClient,
                               CatalogPayloadParser payloadParser,
                               AppCatalogProperties properties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.catalogClient = catalogClient;
        this.payloadParser = payloadParser;
        this.properties = properties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public CatalogPageResult fetchCollection() {
        return fetchListing(ENDPOINT_COLLECTION,
                "/users/" + requireUsername() + "/collection/folders/0/releases", "releases");
    }

    public CatalogPageResult fetchWantlist() {
        return fetchListing(ENDPOINT_WANTLIST, "/users/" + requireUsername() + "/wants", "wants");
    }

    public FetchResult<MarketplaceStats> fetchMarketplaceStats(long releaseId) {
        return fetchDetail(ENDPOINT_STATS, "/marketplace/stats/" + releaseId, payloadParser::parseStats);
    }

    public FetchResult<List<CatalogTrack>> fetchTracklist(long releaseId) {
        return fetchDetail(ENDPOINT_RELEASE, "/releases/" + releaseId, payloadParser::parseTracklist);
    }

    CatalogPageResult fetchListing(String endpoint, String basePath, String arrayField) {
        CatalogPageResult result = new CatalogPageResult();
        int page = 1;
        while (true) {
            String path = basePath + "?page=" + page + "&per_page=" + properties.getPerPage();
            CatalogResponse response;
            try {
                response = catalogClient.get(path);
            } catch (IOException e) {
                result.setAbortError(FetchError.io(e));
                incrementRequest(endpoint, "io_error");
                log.warn("CATALOG_LISTING_ABORTED endpoint={} page={} reason={} kept={}",
                        endpoint, page, e.getMessage(), result.getItems().size());
                break;
            }
            incrementRequest(endpoint, String.valueOf(response.getStatusCode()));

            if (response.isRateLimited()) {
                result.setRateLimitedCount(result.getRateLimitedCount() + 1);
                log.warn("CATALOG_RATE_LIMITED endpoint={} page={} cooldownMs={}",
                        endpoint, page, properties.getRateLimitCooldownMs());
                pause(properties.getRateLimitCooldownMs());
                continue;
            }
            if (!response.isOk()) {
                result.setAbortError(FetchError.status(response.getStatusCode()));
                log.warn("CATALOG_LISTING_ABORTED endpoint={} page={} status={} kept={}",
                        endpoint, page, response.getStatusCode(), result.getItems().size());
                break;
            }

            CatalogListingPage listingPage;
            try {
                listingPage = payloadParser.parseListingPage(response.getBody(), arrayField);
            } catch (IOException e) {
                result.setAbortError(FetchError.parse(e));
                log.warn("CATALOG_LISTING_ABORTED endpoint={} page={} reason=unparseable kept={}",
                        endpoint, page, result.getItems().size());
                break;
            }
            result.getItems().addAll(listingPage.getItems());
            result.setPagesFetched(result.getPagesFetched() + 1);
            result.setTotalPages(listingPage.getTotalPages());
            log.info("CATALOG_PAGE_FETCHED endpoint={} page={} pages={} items={}",
                    endpoint, page, listingPage.getTotalPages(), result.getItems().size());

            if (page >= listingPage.getTotalPages()) {
                break;
            }
            page++;
            pause(properties.getPageDelayMs());
        }
        return result;
    }

    private <T> FetchResult<T> fetchDetail(String endpoint, String path, PayloadParser<T> parser) {
        try {
            FetchResult<T> result = requestOnce(endpoint, path, parser);
            if (!result.isSuccess() && result.getError().getKind() == FetchError.Kind.RATE_LIMITED) {
                pause(properties.getRateLimitCooldownMs());
                result = requestOnce(endpoint, path, parser);
            }
            if (!result.isSuccess()) {
                log.debug("CATALOG_DETAIL_FAILED endpoint={} path={} reason={}",
                        endpoint, path, result.getError().getReason());
            }
            return result;
        } finally {
            pause(properties.getDetailDelayMs());
        }
    }

    private <T> FetchResult<T> requestOnce(String endpoint, String path, PayloadParser<T> parser) {
        CatalogResponse response;
        try {
            response = catalogClient.get(path);
        } catch (IOException e) {
            incrementRequest(endpoint, "io_error");
            return FetchResult.failure(FetchError.io(e));
        }
        incrementRequest(endpoint, String.valueOf(response.getStatusCode()));
        if (!response.isOk()) {
            return FetchResult.failure(FetchError.status(response.getStatusCode()));
        }
        try {
            return FetchResult.success(parser.parse(response.getBody()));
        } catch (IOException e) {
            return FetchResult.failure(FetchError.parse(e));
        }
    }

    private String requireUsername() {
        if (!StringUtils.hasText(properties.getUsername())) {
            throw new IllegalStateException("app.catalog.username is not configured");
        }
        return properties.getUsername().trim();
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Catalog fetch interrupted");
        }
    }

    private void incrementRequest(String endpoint, String status) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("music.sync.catalog.request", "endpoint", endpoint, "status", status).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, endpoint={}", endpoint, e);
        }
    }

    @FunctionalInterface
    private interface PayloadParser<T> {
        T parse(String body) throws IOException;
    }
}
