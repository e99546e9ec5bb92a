package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.fileimport.ImportStats;
import com.example.musiccollection.infrastructure.fileimport.LibraryTrackCsvReader;
import com.example.musiccollection.infrastructure.persistence.entity.LibraryTrackEntity;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Imports the library's track CSV export when it changed since the last import.
 */
@Service
public class LibraryTrackImportService {

    private static final Logger log = LoggerFactory.getLogger(LibraryTrackImportService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.ROON_TRACKS;
    private static final int PROGRESS_INTERVAL = 10000;

    private final FileSourceSupport fileSourceSupport;
    private final LibraryTrackCsvReader csvReader;
    private final CollectionStoreService collectionStoreService;
    private final SyncLedgerService syncLedgerService;
    private final AppSyncProperties appSyncProperties;

    public LibraryTrackImportService(FileSourceSupport fileSourceSupport,
                                     LibraryTrackCsvReader csvReader,
                                     CollectionStoreService collectionStoreService,
                                     SyncLedgerService syncLedgerService,
                                     AppSyncProperties appSyncProperties) {
        this.fileSourceSupport = fileSourceSupport;
        this.csvReader = csvReader;
        this.collectionStoreService = collectionStoreService;
        this.syncLedgerService = syncLedgerService;
        this.appSyncProperties = appSyncProperties;
    }

    public SyncOutcome sync(boolean force) throws IOException {
        FileSourceSupport.FileGate gate = fileSourceSupport.check(SOURCE, StoreTable.ROON_TRACKS,
                appSyncProperties.getRoonTracksFile(), force);
        if (!gate.shouldImport()) {
            return gate.getOutcome();
        }

        collectionStoreService.clearLibraryTracks();
        BatchBuffer<LibraryTrackEntity> writer = collectionStoreService.libraryTrackWriter();
        ImportStats stats = csvReader.read(gate.getFile(), track -> {
            writer.add(track);
            if (writer.passedProgressMark(PROGRESS_INTERVAL)) {
                log.info("TRACK_IMPORT_PROGRESS written={}", writer.getWritten());
            }
        });
        writer.flush();

        long written = writer.getWritten();
        String status = stats.getRecordsSkipped() == 0
                ? SyncLedgerService.STATUS_SUCCESS
                : "success, " + stats.getRecordsSkipped() + " rows skipped";
        syncLedgerService.update(SOURCE, written, status);
        log.info("TRACK_IMPORT_FINISHED file={} tracks={} skipped={}",
                gate.getFile(), written, stats.getRecordsSkipped());
        return SyncOutcome.success(SOURCE, written).detail("skipped", stats.getRecordsSkipped());
    }
}
