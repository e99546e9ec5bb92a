package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.CatalogPageResult;
import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.CatalogTrack;
import com.example.musiccollection.domain.model.FetchResult;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.domain.model.UpsertResult;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Mirrors the catalog collection: listing, marketplace figures and tracklists. Also keeps the
 * ledger row of the derived catalog track table.
 */
@Service
public class CatalogCollectionSyncService {

    private static final Logger log = LoggerFactory.getLogger(CatalogCollectionSyncService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.DISCOGS_COLLECTION;

    private final CatalogFetchService catalogFetchService;
    private final CollectionStoreService collectionStoreService;
    private final SyncLedgerService syncLedgerService;
    private final AppSyncProperties appSyncProperties;

    public CatalogCollectionSyncService(CatalogFetchService catalogFetchService,
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
            return SyncOutcome.skipped(SOURCE, collectionStoreService.count(StoreTable.DISCOGS_COLLECTION),
                    "synced within " + appSyncProperties.getSkipDays() + " days");
        }

        CatalogPageResult listing = catalogFetchService.fetchCollection();
        List<CatalogRelease> releases = listing.getItems();
        if (releases.isEmpty() && !listing.isComplete()) {
            String reason = listing.getAbortError().getReason();
            syncLedgerService.recordFailure(SOURCE, reason);
            return SyncOutcome.failed(SOURCE, reason);
        }
        log.info("CATALOG_COLLECTION_LISTED items={} pages={}/{} complete={}",
                releases.size(), listing.getPagesFetched(), listing.getTotalPages(), listing.isComplete());

        Set<Long> seenReleaseIds = new HashSet<>();
        long inserted = 0;
        long duplicates = 0;
        long statsFailures = 0;
        long tracklistFailures = 0;
        int processed = 0;
        for (CatalogRelease release : releases) {
            if (processed % 50 == 0) {
                log.info("CATALOG_COLLECTION_PROGRESS processed={} total={}", processed, releases.size());
            }
            processed++;

            FetchResult<MarketplaceStats> stats = catalogFetchService.fetchMarketplaceStats(release.getReleaseId());
            if (!stats.isSuccess()) {
                statsFailures++;
            }
            UpsertResult upsert = collectionStoreService.upsertCollectionItem(release, stats.value(), seenReleaseIds);
            if (upsert.isInserted()) {
                inserted++;
            }
            if (upsert.isDuplicate()) {
                duplicates++;
                continue;
            }

            FetchResult<List<CatalogTrack>> tracklist = catalogFetchService.fetchTracklist(release.getReleaseId());
            if (tracklist.isSuccess()) {
                collectionStoreService.replaceCatalogTracks(upsert.getId(), release.getReleaseId(),
                        tracklist.value().orElseThrow(IllegalStateException::new));
            } else {
                tracklistFailures++;
            }
        }

        long pruned = 0;
        if (listing.isComplete()) {
            pruned = collectionStoreService.pruneCollection(seenReleaseIds);
        }
        long releaseCount = seenReleaseIds.size();
        long trackCount = collectionStoreService.count(StoreTable.DISCOGS_TRACKS);
        long detailFailures = statsFailures + tracklistFailures;

        SyncOutcome outcome;
        if (!listing.isComplete()) {
            String status = "partial: listing stopped at page " + (listing.getPagesFetched() + 1)
                    + " (" + listing.getAbortError().getReason() + ")";
            syncLedgerService.update(SOURCE, releaseCount, status);
            syncLedgerService.update(SyncSourceId.DISCOGS_TRACKS, trackCount, status);
            outcome = SyncOutcome.partial(SOURCE, releaseCount, status);
        } else if (detailFailures > 0) {
            String status = "partial: " + detailFailures + " detail requests failed";
            syncLedgerService.update(SOURCE, releaseCount, status);
            syncLedgerService.update(SyncSourceId.DISCOGS_TRACKS, trackCount, status);
            outcome = SyncOutcome.partial(SOURCE, releaseCount, status);
        } else {
            syncLedgerService.update(SOURCE, releaseCount, SyncLedgerService.STATUS_SUCCESS);
            syncLedgerService.update(SyncSourceId.DISCOGS_TRACKS, trackCount, SyncLedgerService.STATUS_SUCCESS);
            outcome = SyncOutcome.success(SOURCE, releaseCount);
        }

        log.info("CATALOG_COLLECTION_SYNCED releases={} inserted={} duplicates={} pruned={} tracks={} "
                        + "statsFailures={} tracklistFailures={} rateLimited={}",
                releaseCount, inserted, duplicates, pruned, trackCount, statsFailures, tracklistFailures,
                listing.getRateLimitedCount());
        return outcome
                .detail("inserted", inserted)
                .detail("duplicates", duplicates)
                .detail("pruned", pruned)
                .detail("tracks", trackCount)
                .detail("statsFailures", statsFailures)
                .detail("tracklistFailures", tracklistFailures)
                .detail("rateLimited", listing.getRateLimitedCount());
    }
}
