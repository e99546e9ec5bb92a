package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.fileimport.ImportStats;
import com.example.musiccollection.infrastructure.fileimport.PlayHistoryJsonReader;
import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PlayHistoryImportService {

    private static final Logger log = LoggerFactory.getLogger(PlayHistoryImportService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.ROON_PLAY_HISTORY;
    private static final int PROGRESS_INTERVAL = 5000;

    private final FileSourceSupport fileSourceSupport;
    private final PlayHistoryJsonReader jsonReader;
    private final CollectionStoreService collectionStoreService;
    private final SyncLedgerService syncLedgerService;
    private final AppSyncProperties appSyncProperties;

    public PlayHistoryImportService(FileSourceSupport fileSourceSupport,
                                    PlayHistoryJsonReader jsonReader,
                                    CollectionStoreService collectionStoreService,
                                    SyncLedgerService syncLedgerService,
                                    AppSyncProperties appSyncProperties) {
        this.fileSourceSupport = fileSourceSupport;
        this.jsonReader = jsonReader;
        this.collectionStoreService = collectionStoreService;
        this.syncLedgerService = syncLedgerService;
        this.appSyncProperties = appSyncProperties;
    }

    public SyncOutcome sync(boolean force) throws IOException {
        FileSourceSupport.FileGate gate = fileSourceSupport.check(SOURCE, StoreTable.ROON_PLAY_HISTORY,
                appSyncProperties.getRoonPlayHistoryFile(), force);
        if (!gate.shouldImport()) {
            return gate.getOutcome();
        }

        collectionStoreService.clearPlayHistory();
        BatchBuffer<PlayHistoryEntity> writer = collectionStoreService.playHistoryWriter();
        ImportStats stats = jsonReader.read(gate.getFile(), play -> {
            writer.add(play);
            if (writer.passedProgressMark(PROGRESS_INTERVAL)) {
                log.info("PLAY_HISTORY_IMPORT_PROGRESS written={}", writer.getWritten());
            }
        });
        writer.flush();

        long written = writer.getWritten();
        String status = stats.getRecordsSkipped() == 0
                ? SyncLedgerService.STATUS_SUCCESS
                : "success, " + stats.getRecordsSkipped() + " records skipped";
        syncLedgerService.update(SOURCE, written, status);
        log.info("PLAY_HISTORY_IMPORT_FINISHED file={} plays={} skipped={}",
                gate.getFile(), written, stats.getRecordsSkipped());
        return SyncOutcome.success(SOURCE, written).detail("skipped", stats.getRecordsSkipped());
    }
}
