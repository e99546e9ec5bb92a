package com.example.musiccollection.application.service;

import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.RunReport;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.entity.SyncHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.SyncHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs the selected sources one after another in a fixed order. A failing source is recorded in
 * the ledger and the run moves on; {@link #run} itself never throws.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final LibraryBrowseService libraryBrowseService;
    private final LibraryAlbumSyncService libraryAlbumSyncService;
    private final LibraryTagSyncService libraryTagSyncService;
    private final CatalogCollectionSyncService catalogCollectionSyncService;
    private final CatalogWantlistSyncService catalogWantlistSyncService;
    private final LibraryTrackImportService libraryTrackImportService;
    private final PlayHistoryImportService playHistoryImportService;
    private final TrackIndexService trackIndexService;
    private final SyncLedgerService syncLedgerService;
    private final CollectionStoreService collectionStoreService;
    private final SyncHistoryMapper syncHistoryMapper;
    private final MeterRegistry meterRegistry;

    // the library session and the catalog rate limit both assume one run at a time
    private final ReentrantLock runLock = new ReentrantLock();

    public SyncOrchestrator(LibraryBrowseService libraryBrowseService,
                            LibraryAlbumSyncService libraryAlbumSyncService,
                            LibraryTagSyncService libraryTagSyncService,
                            CatalogCollectionSyncService catalogCollectionSyncService,
                            CatalogWantlistSyncService catalogWantlistSyncService,
                            LibraryTrackImportService libraryTrackImportService,
                            PlayHistoryImportService playHistoryImportService,
                            TrackIndexService trackIndexService,
                            SyncLedgerService syncLedgerService,
                            CollectionStoreService collectionStoreService,
                            SyncHistoryMapper syncHistoryMapper,
                            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryBrowseService = libraryBrowseService;
        this.libraryAlbumSyncService = libraryAlbumSyncService;
        this.libraryTagSyncService = libraryTagSyncService;
        this.catalogCollectionSyncService = catalogCollectionSyncService;
        this.catalogWantlistSyncService = catalogWantlistSyncService;
        this.libraryTrackImportService = libraryTrackImportService;
        this.playHistoryImportService = playHistoryImportService;
        this.trackIndexService = trackIndexService;
        this.syncLedgerService = syncLedgerService;
        this.collectionStoreService = collectionStoreService;
        this.syncHistoryMapper = syncHistoryMapper;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * @param sources sources to run; null or empty means all of them
     * @param force   ignore freshness checks
     */
    public RunReport run(Set<SyncSourceId> sources, boolean force) {
        runLock.lock();
        try {
            return doRun(sources, force);
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private RunReport doRun(Set<SyncSourceId> sources, boolean force) {
        Set<SyncSourceId> selected = resolveSelection(sources);
        boolean fullRun = selected.containsAll(SyncSourceId.runnableSources());

        RunReport report = new RunReport();
        report.setStartedAt(syncLedgerService.now());
        report.setForce(force);
        report.setFullRun(fullRun);
        log.info("SYNC_RUN_START sources={} force={} fullRun={}", selected, force, fullRun);

        LibrarySessionScope scope = libraryBrowseService.openScope();
        try {
            for (SyncSourceId source : SyncSourceId.runOrder()) {
                if (selected.contains(source)) {
                    report.getOutcomes().add(runSource(source, scope, force, report));
                }
            }
        } finally {
            closeScope(scope);
        }

        if (fullRun) {
            report.setSnapshotRecorded(recordSnapshot());
        }
        report.setFinishedAt(syncLedgerService.now());
        log.info("SYNC_RUN_FINISH sources={} failed={} snapshot={} startedAt={} finishedAt={}",
                report.getOutcomes().size(), report.failedCount(), report.isSnapshotRecorded(),
                report.getStartedAt(), report.getFinishedAt());
        return report;
    }

    Set<SyncSourceId> resolveSelection(Set<SyncSourceId> sources) {
        if (sources == null || sources.isEmpty()) {
            return EnumSet.copyOf(SyncSourceId.runnableSources());
        }
        Set<SyncSourceId> selected = EnumSet.noneOf(SyncSourceId.class);
        for (SyncSourceId source : sources) {
            if (source.isRunnable()) {
                selected.add(source);
            }
        }
        // tag flags live on album rows, so reloading albums must re-apply them
        if (selected.contains(SyncSourceId.ROON_ALBUMS)) {
            selected.add(SyncSourceId.ROON_TAGS);
        }
        return selected;
    }

    private SyncOutcome runSource(SyncSourceId source, LibrarySessionScope scope, boolean force, RunReport report) {
        long startedAtNanos = System.nanoTime();
        log.info("SYNC_SOURCE_START source={} force={}", source.getLedgerName(), force);
        SyncOutcome outcome;
        try {
            outcome = dispatch(source, scope, force, report);
        } catch (Exception e) {
            log.error("SYNC_SOURCE_FAILED source={} reason={}", source.getLedgerName(), e.getMessage(), e);
            recordFailureSafely(source, e);
            outcome = SyncOutcome.failed(source, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        long elapsedNanos = System.nanoTime() - startedAtNanos;
        outcome.setDurationMs(TimeUnit.NANOSECONDS.toMillis(elapsedNanos));

        switch (outcome.getStatus()) {
            case SKIPPED:
                log.info("SYNC_SOURCE_SKIPPED source={} records={} reason={}",
                        source.getLedgerName(), outcome.getRecordCount(), outcome.getMessage());
                break;
            case FAILED:
                log.warn("SYNC_SOURCE_FINISH source={} status={} message={} elapsedMs={}",
                        source.getLedgerName(), outcome.getStatus(), outcome.getMessage(), outcome.getDurationMs());
                break;
            default:
                log.info("SYNC_SOURCE_FINISH source={} status={} records={} details={} elapsedMs={}",
                        source.getLedgerName(), outcome.getStatus(), outcome.getRecordCount(),
                        outcome.getDetails(), outcome.getDurationMs());
                break;
        }
        incrementCounter("music.sync.source.finished", 1,
                "source", source.getLedgerName(), "result", outcome.getStatus().name());
        if (outcome.isRan()) {
            incrementCounter("music.sync.source.records", outcome.getRecordCount(), "source", source.getLedgerName());
        }
        recordDuration("music.sync.source.duration", elapsedNanos, "source", source.getLedgerName());
        return outcome;
    }

    private SyncOutcome dispatch(SyncSourceId source, LibrarySessionScope scope, boolean force, RunReport report)
            throws Exception {
        switch (source) {
            case ROON_ALBUMS:
                return libraryAlbumSyncService.sync(scope, force);
            case ROON_TAGS:
                return libraryTagSyncService.sync(scope, force, ran(report, SyncSourceId.ROON_ALBUMS));
            case DISCOGS_COLLECTION:
                return catalogCollectionSyncService.sync(force);
            case DISCOGS_WANTLIST:
                return catalogWantlistSyncService.sync(force);
            case ROON_TRACKS:
                return libraryTrackImportService.sync(force);
            case ROON_PLAY_HISTORY:
                return playHistoryImportService.sync(force);
            case TRACK_INDEX:
                boolean upstreamChanged = ran(report, SyncSourceId.ROON_TRACKS)
                        || ran(report, SyncSourceId.DISCOGS_COLLECTION);
                return trackIndexService.sync(force, upstreamChanged);
            default:
                throw new IllegalArgumentException("Source is not runnable: " + source.getLedgerName());
        }
    }

    private boolean ran(RunReport report, SyncSourceId source) {
        SyncOutcome outcome = report.outcomeOf(source);
        return outcome != null && outcome.isRan();
    }

    private void recordFailureSafely(SyncSourceId source, Exception cause) {
        try {
            syncLedgerService.recordFailure(source, cause.getMessage());
        } catch (Exception ledgerError) {
            log.error("SYNC_LEDGER_WRITE_FAILED source={} reason={}", source.getLedgerName(), ledgerError.getMessage());
        }
    }

    private void closeScope(LibrarySessionScope scope) {
        try {
            scope.close();
        } catch (Exception e) {
            log.warn("LIBRARY_SESSION_CLOSE_FAILED reason={}", e.getMessage());
        }
    }

    private boolean recordSnapshot() {
        try {
            SyncHistoryEntity snapshot = new SyncHistoryEntity();
            snapshot.setSyncDate(syncLedgerService.now());
            snapshot.setRoonAlbums(collectionStoreService.count(StoreTable.ROON_ALBUMS));
            snapshot.setRoonTracks(collectionStoreService.count(StoreTable.ROON_TRACKS));
            snapshot.setRoonPlayHistory(collectionStoreService.count(StoreTable.ROON_PLAY_HISTORY));
            snapshot.setDiscogsCollection(collectionStoreService.count(StoreTable.DISCOGS_COLLECTION));
            snapshot.setDiscogsTracks(collectionStoreService.count(StoreTable.DISCOGS_TRACKS));
            snapshot.setDiscogsWantlist(collectionStoreService.count(StoreTable.DISCOGS_WANTLIST));
            snapshot.setTrackIndexTotal(collectionStoreService.count(StoreTable.TRACK_INDEX));
            snapshot.setTrackIndexDistinct(trackIndexService.countDistinctTitles());
            snapshot.setListeningHistory(collectionStoreService.count(StoreTable.LISTENING_HISTORY));
            syncHistoryMapper.insert(snapshot);
            log.info("SYNC_SNAPSHOT_RECORDED albums={} tracks={} collection={} wantlist={} trackIndex={}",
                    snapshot.getRoonAlbums(), snapshot.getRoonTracks(), snapshot.getDiscogsCollection(),
                    snapshot.getDiscogsWantlist(), snapshot.getTrackIndexTotal());
            return true;
        } catch (Exception e) {
            log.error("SYNC_SNAPSHOT_FAILED reason={}", e.getMessage(), e);
            return false;
        }
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }
}
