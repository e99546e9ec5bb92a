package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppLibraryProperties;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.domain.model.TaggedAlbum;
import com.example.musiccollection.infrastructure.persistence.entity.SyncLedgerEntity;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Flags library albums that are also owned physically, based on membership in the configured
 * library tags. Matching is on album title only, case-insensitively.
 */
@Service
public class LibraryTagSyncService {

    private static final Logger log = LoggerFactory.getLogger(LibraryTagSyncService.class);

    private static final SyncSourceId SOURCE = SyncSourceId.ROON_TAGS;

    private final LibraryBrowseService libraryBrowseService;
    private final CollectionStoreService collectionStoreService;
    private final SchemaGuardService schemaGuardService;
    private final SyncLedgerService syncLedgerService;
    private final AppLibraryProperties appLibraryProperties;

    public LibraryTagSyncService(LibraryBrowseService libraryBrowseService,
                                 CollectionStoreService collectionStoreService,
                                 SchemaGuardService schemaGuardService,
                                 SyncLedgerService syncLedgerService,
                                 AppLibraryProperties appLibraryProperties) {
        this.libraryBrowseService = libraryBrowseService;
        this.collectionStoreService = collectionStoreService;
        this.schemaGuardService = schemaGuardService;
        this.syncLedgerService = syncLedgerService;
        this.appLibraryProperties = appLibraryProperties;
    }

    /**
     * @param albumsReloaded album rows were replaced earlier in this run, which cleared every flag
     */
    public SyncOutcome sync(LibrarySessionScope scope, boolean force, boolean albumsReloaded) {
        if (!albumsReloaded && syncLedgerService.shouldSkip(SOURCE, force)) {
            SyncLedgerEntity entry = syncLedgerService.find(SOURCE);
            long previous = entry == null || entry.getRecordsCount() == null ? 0L : entry.getRecordsCount();
            return SyncOutcome.skipped(SOURCE, previous, "album rows unchanged and tags recently synced");
        }

        schemaGuardService.ensurePhysicalFlagColumns();
        Set<String> tagNames = appLibraryProperties.normalizedPhysicalTags();
        List<TaggedAlbum> tagged = libraryBrowseService.loadTaggedAlbums(scope, tagNames);
        if (tagged.isEmpty()) {
            log.warn("LIBRARY_TAGS_EMPTY tags={}", tagNames);
        }

        long matched = collectionStoreService.flagPhysicalDuplicates(tagged);
        syncLedgerService.update(SOURCE, matched, SyncLedgerService.STATUS_SUCCESS);
        log.info("LIBRARY_TAGS_SYNCED taggedAlbums={} flaggedRows={}", tagged.size(), matched);
        return SyncOutcome.success(SOURCE, matched).detail("taggedAlbums", tagged.size());
    }
}
