package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.CatalogPageResult;
import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.FetchResult;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CatalogWantlistSyncService {

    private static final Logger log = LoggerFactory.getLogger(CatalogWantlistSyncService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.DISCOGS_WANTLIST;

    private final CatalogFetchService catalogFetchService;
    private final CollectionStoreService collectionStoreService;
    private final SyncLedgerService syncLedgerService;
    private final AppSyncProperties appSyncProperties;

    public CatalogWantlistSyncService(CatalogFetchService catalogFetchService,
                                      CollectionStoreService collectionStoreService,
                                      SyncLedgerService syncLedgerService,
                                      AppSyncProperties appSyncProperties) {
        this.catalogFetchService = catalogFetchService;
        this.collectionStoreService = collectionStoreService;
        this.syncLedgerService = syncLedgerService;
        this.appSyncProperties = appSyncProperties;
    }

    public SyncOutcome sync(boolean force) {
        if (syncLedgerService.shouldSkip(SOURCE, force)) {
            return SyncOutcome.skipped(SOURCE, collectionStoreService.count(StoreTable.DISCOGS_WANTLIST),
                    "synced within " + appSyncProperties.getSkipDays() + " days");
        }

        CatalogPageResult listing = catalogFetchService.fetchWantlist();
        List<CatalogRelease> releases = listing.getItems();
        if (releases.isEmpty() && !listing.isComplete()) {
            String reason = listing.getAbortError().getReason();
            syncLedgerService.recordFailure(SOURCE, reason);
            return SyncOutcome.failed(SOURCE, reason);
        }

        List<Optional<MarketplaceStats>> stats = new ArrayList<>(releases.size());
        Set<Long> seenReleaseIds = new HashSet<>();
        long duplicates = 0;
        long statsFailures = 0;
        for (int i = 0; i < releases.size(); i++) {
            if (i % 50 == 0) {
                log.info("CATALOG_WANTLIST_PROGRESS processed={} total={}", i, releases.size());
            }
            CatalogRelease release = releases.get(i);
            if (!seenReleaseIds.add(release.getReleaseId())) {
                duplicates++;
                log.warn("CATALOG_WANTLIST_DUPLICATE releaseId={}", release.getReleaseId());
            }
            FetchResult<MarketplaceStats> result = catalogFetchService.fetchMarketplaceStats(release.getReleaseId());
            if (!result.isSuccess()) {
                statsFailures++;
            }
            stats.add(result.value());
        }

        collectionStoreService.replaceWantlist(releases, stats);
        long stored = collectionStoreService.count(StoreTable.DISCOGS_WANTLIST);

        SyncOutcome outcome;
        if (!listing.isComplete()) {
            String status = "partial: listing stopped at page " + (listing.getPagesFetched() + 1)
                    + " (" + listing.getAbortError().getReason() + ")";
            syncLedgerService.update(SOURCE, stored, status);
            outcome = SyncOutcome.partial(SOURCE, stored, status);
        } else if (statsFailures > 0) {
            String status = "partial: " + statsFailures + " detail requests failed";
            syncLedgerService.update(SOURCE, stored, status);
            outcome = SyncOutcome.partial(SOURCE, stored, status);
        } else {
            syncLedgerService.update(SOURCE, stored, SyncLedgerService.STATUS_SUCCESS);
            outcome = SyncOutcome.success(SOURCE, stored);
        }
        log.info("CATALOG_WANTLIST_SYNCED items={} duplicates={} statsFailures={} rateLimited={}",
                stored, duplicates, statsFailures, listing.getRateLimitedCount());
        return outcome
                .detail("duplicates", duplicates)
                .detail("statsFailures", statsFailures)
                .detail("rateLimited", listing.getRateLimitedCount());
    }
}
