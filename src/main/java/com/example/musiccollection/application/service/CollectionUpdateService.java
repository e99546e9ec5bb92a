package com.example.musiccollection.application.service;

import com.example.musiccollection.api.response.CatalogItemResponse;
import com.example.musiccollection.common.exception.BusinessException;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * User edits on synced rows. These columns are never written by a sync.
 */
@Service
public class CollectionUpdateService {

    private static final Logger log = LoggerFactory.getLogger(CollectionUpdateService.class);

    private final CatalogCollectionMapper catalogCollectionMapper;
    private final PlayHistoryMapper playHistoryMapper;
    private final SyncLedgerService syncLedgerService;

    public CollectionUpdateService(CatalogCollectionMapper catalogCollectionMapper,
                                   PlayHistoryMapper playHistoryMapper,
                                   SyncLedgerService syncLedgerService) {
        this.catalogCollectionMapper = catalogCollectionMapper;
        this.playHistoryMapper = playHistoryMapper;
        this.syncLedgerService = syncLedgerService;
    }

    public CatalogItemResponse updateLastListened(Long id, LocalDateTime listenedAt) {
        requireCatalogItem(id);
        LocalDateTime value = listenedAt == null ? syncLedgerService.now() : listenedAt;
        catalogCollectionMapper.updateLastListened(id, value);
        log.info("CATALOG_LAST_LISTENED_UPDATED id={} listenedAt={}", id, value);
        return CollectionQueryService.toCatalogItem(requireCatalogItem(id));
    }

    public CatalogItemResponse updateNunFlag(Long id, boolean nun) {
        requireCatalogItem(id);
        catalogCollectionMapper.updateNunFlag(id, nun);
        return CollectionQueryService.toCatalogItem(requireCatalogItem(id));
    }

    public CatalogItemResponse updateNotes(Long id, String notes) {
        requireCatalogItem(id);
        catalogCollectionMapper.updateNotes(id, notes);
        return CollectionQueryService.toCatalogItem(requireCatalogItem(id));
    }

    /**
     * Corrects the timestamp of an imported play. A later re-import of the export replaces it.
     */
    public void updatePlayedAt(Long id, LocalDateTime playedAt) {
        PlayHistoryEntity play = playHistoryMapper.selectById(id);
        if (play == null) {
            throw BusinessException.notFound("Play history record", null);
        }
        playHistoryMapper.updatePlayedAt(id, playedAt);
        log.info("PLAY_HISTORY_PLAYED_AT_UPDATED id={} playedAt={}", id, playedAt);
    }

    CatalogCollectionEntity requireCatalogItem(Long id) {
        CatalogCollectionEntity entity = catalogCollectionMapper.selectById(id);
        if (entity == null) {
            throw BusinessException.notFound("Catalog item", "Refresh the collection and retry");
        }
        return entity;
    }
}
