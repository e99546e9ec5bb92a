package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.LibraryBrowseItem;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LibraryAlbumSyncService {

    private static final Logger log = LoggerFactory.getLogger(LibraryAlbumSyncService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.ROON_ALBUMS;

    private final LibraryBrowseService libraryBrowseService;
    private final CollectionStoreService collectionStoreService;
    private final SyncLedgerService syncLedgerService;
    private final AppSyncProperties appSyncProperties;

    public LibraryAlbumSyncService(LibraryBrowseService libraryBrowseService,
                                   CollectionStoreService collectionStoreService,
                                   SyncLedgerService syncLedgerService,
                                   AppSyncProperties appSyncProperties) {
        this.libraryBrowseService = libraryBrowseService;
        this.collectionStoreService = collectionStoreService;
        this.syncLedgerService = syncLedgerService;
        this.appSyncProperties = appSyncProperties;
    }

    public SyncOutcome sync(LibrarySessionScope scope, boolean force) {
        if (syncLedgerService.shouldSkip(SOURCE, force)) {
            return SyncOutcome.skipped(SOURCE, collectionStoreService.count(StoreTable.ROON_ALBUMS),
                    "synced within " + appSyncProperties.getSkipDays() + " days");
        }

        List<LibraryBrowseItem> albums = libraryBrowseService.loadAlbums(scope);
        if (albums.isEmpty()) {
            // keep the previous rows rather than replacing them with nothing
            syncLedgerService.recordFailure(SOURCE, "No albums found");
            return SyncOutcome.failed(SOURCE, "No albums found");
        }

        long written = collectionStoreService.replaceLibraryAlbums(albums);
        syncLedgerService.update(SOURCE, written, SyncLedgerService.STATUS_SUCCESS);
        log.info("LIBRARY_ALBUMS_SYNCED albums={}", written);
        return SyncOutcome.success(SOURCE, written);
    }
}
