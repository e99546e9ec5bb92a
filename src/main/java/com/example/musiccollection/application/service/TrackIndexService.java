package com.example.musiccollection.application.service;

import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.domain.model.TrackIndexStats;
import com.example.musiccollection.infrastructure.persistence.mapper.TrackIndexMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Flat title index over library and catalog tracks, rebuilt from scratch.
 */
@Service
public class TrackIndexService {

    private static final Logger log = LoggerFactory.getLogger(TrackIndexService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.TRACK_INDEX;

    private final TrackIndexMapper trackIndexMapper;
    private final CollectionStoreService collectionStoreService;
    private final SyncLedgerService syncLedgerService;

    public TrackIndexService(TrackIndexMapper trackIndexMapper,
                             CollectionStoreService collectionStoreService,
                             SyncLedgerService syncLedgerService) {
        this.trackIndexMapper = trackIndexMapper;
        this.collectionStoreService = collectionStoreService;
        this.syncLedgerService = syncLedgerService;
    }

    /**
     * @param upstreamChanged a track table was reloaded earlier in this run
     */
    public SyncOutcome sync(boolean force, boolean upstreamChanged) {
        if (!upstreamChanged && syncLedgerService.shouldSkip(SOURCE, force)) {
            return SyncOutcome.skipped(SOURCE, collectionStoreService.count(StoreTable.TRACK_INDEX),
                    "no track source changed");
        }
        TrackIndexStats stats = rebuild();
        syncLedgerService.update(SOURCE, stats.getTotalRows(), SyncLedgerService.STATUS_SUCCESS);
        return SyncOutcome.success(SOURCE, stats.getTotalRows())
                .detail("distinctTitles", stats.getDistinctTitles())
                .detail("libraryRows", stats.getLibraryRows())
                .detail("catalogRows", stats.getCatalogRows());
    }

    public TrackIndexStats rebuild() {
        trackIndexMapper.truncate();
        long libraryRows = trackIndexMapper.insertFromLibraryTracks();
        long catalogRows = trackIndexMapper.insertFromCatalogTracks();
        TrackIndexStats stats = new TrackIndexStats(
                trackIndexMapper.countAll(),
                trackIndexMapper.countDistinctTitles(),
                libraryRows,
                catalogRows);
        log.info("TRACK_INDEX_REBUILT total={} distinctTitles={} libraryRows={} catalogRows={}",
                stats.getTotalRows(), stats.getDistinctTitles(), libraryRows, catalogRows);
        return stats;
    }

    public long countDistinctTitles() {
        return trackIndexMapper.countDistinctTitles();
    }
}
